package turnstile.spi;

/**
 * Asks the database to broadcast a notification to every listening session.
 *
 * @see turnstile.jdbc.notify.JdbcNotificationPublisher
 */
@FunctionalInterface
public interface NotificationPublisher {

    /**
     * Publishes on {@code channel}.
     *
     * @param channel channel name
     * @param payload optional payload; {@code null} or empty for none
     * @throws turnstile.StoreException if the database rejects the request
     */
    void publish(String channel, String payload);
}
