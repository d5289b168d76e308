package turnstile.events;

import java.util.Objects;

/**
 * The build moved to {@code status} at {@code time} (epoch seconds).
 */
public record StatusEvent(BuildStatus status, long time) implements Event {

    public static final String TYPE = "status";

    public StatusEvent {
        Objects.requireNonNull(status, "status");
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
