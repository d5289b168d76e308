package turnstile.memory;

import turnstile.bus.Notification;
import turnstile.spi.NotificationListener;
import turnstile.spi.NotificationPublisher;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * LISTEN/NOTIFY broker living inside one JVM.
 *
 * <p>The hub is the publisher; {@link #openListener()} returns one listening session per
 * {@link turnstile.bus.NotificationBus}. A published notification is delivered to every
 * open session listening on its channel, including the publisher's own, as PostgreSQL does.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryNotificationHub implements NotificationPublisher {

    private final CopyOnWriteArrayList<Session> sessions = new CopyOnWriteArrayList<>();

    /**
     * Opens a new listening session.
     */
    public NotificationListener openListener() {
        Session session = new Session();
        sessions.add(session);
        return session;
    }

    @Override
    public void publish(String channel, String payload) {
        Objects.requireNonNull(channel, "channel");
        Notification notification = Notification.of(channel, payload);
        for (Session session : sessions) {
            if (session.channels.contains(channel)) {
                session.inbox.offer(notification);
            }
        }
    }

    /**
     * Simulates a dropped connection: every open session reports a disconnect next.
     */
    public void interrupt() {
        for (Session session : sessions) {
            session.inbox.offer(Notification.disconnected());
        }
    }

    private final class Session implements NotificationListener {
        private final Set<String> channels = ConcurrentHashMap.newKeySet();
        private final BlockingQueue<Notification> inbox = new LinkedBlockingQueue<>();

        @Override
        public void listen(String channel) {
            channels.add(Objects.requireNonNull(channel, "channel"));
        }

        @Override
        public void unlisten(String channel) {
            channels.remove(channel);
        }

        @Override
        public Optional<Notification> receive(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        }

        @Override
        public void close() {
            sessions.remove(this);
            channels.clear();
            inbox.clear();
        }
    }
}
