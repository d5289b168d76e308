package turnstile.events;

/**
 * Converts events to and from the text stored in the {@code payload} column.
 *
 * @see JacksonEventCodec
 */
public interface EventCodec {

    /**
     * Serializes {@code event}.
     *
     * @throws EventCodecException if the event cannot be serialized
     */
    String encode(Event event);

    /**
     * Deserializes a stored row into the event class registered for its type.
     *
     * @throws EventCodecException if the type is unknown or the payload is malformed
     */
    Event decode(BuildEvent event);
}
