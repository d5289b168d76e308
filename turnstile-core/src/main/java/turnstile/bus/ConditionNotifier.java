package turnstile.bus;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Waits until a predicate over durable state becomes true, using a bus subscription to
 * avoid polling.
 *
 * <p>The predicate is evaluated once right after subscribing, so a notification that
 * fired before the subscription existed cannot be missed, and again after every wake.
 * Notifications only justify a recheck; the predicate is the source of truth.
 *
 * <pre>{@code
 * try (ConditionNotifier aborted = ConditionNotifier.open(bus, Channels.buildAbort(id),
 *         () -> builds.isAborted(id))) {
 *     aborted.await();
 *     cancelSteps(id);
 * }
 * }</pre>
 */
public final class ConditionNotifier implements AutoCloseable {

    /**
     * Predicate over durable state. Evaluated on the waiting thread.
     */
    @FunctionalInterface
    public interface Condition {
        boolean check();
    }

    private final NotificationBus bus;
    private final String channel;
    private final Condition condition;
    private final Sink sink;

    private ConditionNotifier(NotificationBus bus, String channel, Condition condition) {
        this.bus = bus;
        this.channel = channel;
        this.condition = condition;
        this.sink = bus.listen(channel);
    }

    /**
     * Subscribes to {@code channel}. Close the returned notifier to unsubscribe.
     */
    public static ConditionNotifier open(NotificationBus bus, String channel, Condition condition) {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(condition, "condition");
        return new ConditionNotifier(bus, channel, condition);
    }

    /**
     * Blocks until the condition holds.
     *
     * @throws IllegalStateException if the bus is closed while waiting
     */
    public void await() throws InterruptedException {
        while (!condition.check()) {
            sink.await();
            bus.ensureOpen();
        }
    }

    /**
     * Blocks until the condition holds or {@code timeout} elapses.
     *
     * @return {@code true} if the condition held before the deadline
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.check()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            Optional<Notification> wake = sink.await(Duration.ofNanos(remaining));
            if (wake.isEmpty()) {
                return condition.check();
            }
            bus.ensureOpen();
        }
        return true;
    }

    public String channel() {
        return channel;
    }

    @Override
    public void close() {
        bus.unlisten(channel, sink);
    }
}
