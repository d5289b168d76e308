package turnstile.bus;

import java.util.Objects;

/**
 * A change notification received from the database.
 *
 * <p>A notification never carries the new state; it only tells a waiter that a recheck
 * is worthwhile. {@code healthy == false} means the underlying stream was interrupted
 * and notifications may have been lost, so every waiter should recheck.
 *
 * @param channel the channel it was published on, or {@code null} for a disconnect signal
 * @param payload optional payload, empty when none was sent
 * @param healthy {@code false} for a disconnect signal
 */
public record Notification(String channel, String payload, boolean healthy) {

    private static final Notification DISCONNECTED = new Notification(null, "", false);

    public Notification {
        if (healthy) {
            Objects.requireNonNull(channel, "channel");
        }
        payload = payload == null ? "" : payload;
    }

    public static Notification of(String channel, String payload) {
        return new Notification(channel, payload, true);
    }

    public static Notification disconnected() {
        return DISCONNECTED;
    }
}
