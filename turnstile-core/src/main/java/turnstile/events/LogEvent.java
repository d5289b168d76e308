package turnstile.events;

import java.util.Objects;

/**
 * A chunk of output from {@code origin} (a step or stream name).
 */
public record LogEvent(String origin, String payload, long time) implements Event {

    public static final String TYPE = "log";

    public LogEvent {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String version() {
        return "1.0";
    }
}
