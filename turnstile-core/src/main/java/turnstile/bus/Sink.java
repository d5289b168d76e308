package turnstile.bus;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A capacity-one, coalescing wake signal for one subscriber of one channel.
 *
 * <p>A wake that arrives while another is still pending is dropped: wakes are
 * level-triggered hints to recheck durable state, not a counted queue.
 *
 * <p>Obtained from {@link NotificationBus#listen(String)}; hand it back to
 * {@link NotificationBus#unlisten(String, Sink)} when done.
 */
public final class Sink {
    private final String channel;
    private final BlockingQueue<Notification> slot = new ArrayBlockingQueue<>(1);

    Sink(String channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public String channel() {
        return channel;
    }

    /**
     * Deposits a wake without blocking.
     *
     * @return {@code false} if a wake was already pending
     */
    boolean offer(Notification notification) {
        return slot.offer(notification);
    }

    /**
     * Blocks until a wake is pending and consumes it.
     */
    public Notification await() throws InterruptedException {
        return slot.take();
    }

    /**
     * Waits up to {@code timeout} for a wake and consumes it.
     *
     * @return the wake, or empty on timeout
     */
    public Optional<Notification> await(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(slot.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Consumes the pending wake, if any, without waiting.
     */
    public Optional<Notification> poll() {
        return Optional.ofNullable(slot.poll());
    }

    public boolean isPending() {
        return !slot.isEmpty();
    }

    @Override
    public String toString() {
        return "Sink[" + channel + "]";
    }
}
