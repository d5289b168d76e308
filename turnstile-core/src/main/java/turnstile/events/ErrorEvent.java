package turnstile.events;

import java.util.Objects;

/**
 * A build step failed with {@code message} at {@code time} (epoch seconds).
 */
public record ErrorEvent(String message, long time) implements Event {

    public static final String TYPE = "error";

    public ErrorEvent {
        Objects.requireNonNull(message, "message");
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
