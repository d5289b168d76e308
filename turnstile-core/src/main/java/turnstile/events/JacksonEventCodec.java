package turnstile.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link EventCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Events are written as compact JSON objects. The built-in {@link StatusEvent},
 * {@link ErrorEvent} and {@link LogEvent} types are registered by default; register
 * additional event classes with {@link #register(String, Class)}. Unknown JSON properties
 * are ignored on decode so newer writers do not break older readers.
 *
 * <p>This class is thread-safe.
 */
public final class JacksonEventCodec implements EventCodec {

    private final ObjectMapper mapper;
    private final Map<String, Class<? extends Event>> types = new ConcurrentHashMap<>();

    public JacksonEventCodec() {
        this(new ObjectMapper()
            .findAndRegisterModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public JacksonEventCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        register(StatusEvent.TYPE, StatusEvent.class);
        register(ErrorEvent.TYPE, ErrorEvent.class);
        register(LogEvent.TYPE, LogEvent.class);
    }

    /**
     * Maps a type tag to the class it decodes into. Replaces an earlier mapping.
     *
     * @return this codec
     */
    public JacksonEventCodec register(String type, Class<? extends Event> eventClass) {
        types.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(eventClass, "eventClass"));
        return this;
    }

    @Override
    public String encode(Event event) {
        Objects.requireNonNull(event, "event");
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Failed to serialize " + event.type() + " event", e);
        }
    }

    @Override
    public Event decode(BuildEvent event) {
        Objects.requireNonNull(event, "event");
        Class<? extends Event> eventClass = types.get(event.type());
        if (eventClass == null) {
            throw new EventCodecException("No event class registered for type: " + event.type());
        }
        try {
            return mapper.readValue(event.payload(), eventClass);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Failed to deserialize " + event.type()
                + " event " + event.buildId() + "/" + event.sequence(), e);
        }
    }
}
