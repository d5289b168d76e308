/**
 * PostgreSQL {@code LISTEN}/{@code NOTIFY} transport for {@link turnstile.bus.NotificationBus}.
 */
package turnstile.jdbc.notify;
