package turnstile.spi;

import turnstile.bus.Notification;

import java.time.Duration;
import java.util.Optional;

/**
 * The single underlying change-notification stream of a process.
 *
 * <p>Only {@link turnstile.bus.NotificationBus} talks to a listener. It calls
 * {@link #receive(Duration)} from its one dispatch thread and {@link #listen}/{@link #unlisten}
 * from subscribing threads, so implementations must allow those to interleave.
 *
 * @see turnstile.jdbc.notify.PostgresNotificationListener
 * @see turnstile.memory.InMemoryNotificationHub
 */
public interface NotificationListener extends AutoCloseable {

    /**
     * Starts receiving notifications published on {@code channel}.
     */
    void listen(String channel);

    /**
     * Stops receiving notifications published on {@code channel}.
     */
    void unlisten(String channel);

    /**
     * Waits up to {@code timeout} for the next notification.
     *
     * <p>After the stream was interrupted and restored, the first value returned is
     * {@link Notification#disconnected()}.
     *
     * @param timeout how long to wait
     * @return the next notification, or empty if none arrived in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<Notification> receive(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
