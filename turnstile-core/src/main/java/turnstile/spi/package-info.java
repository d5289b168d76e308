/**
 * Service provider interfaces that separate the core from its storage and transport.
 *
 * <ul>
 *   <li>{@link turnstile.spi.ConnectionProvider} - supplies JDBC connections</li>
 *   <li>{@link turnstile.spi.LockDatabase} - session-scoped advisory locks</li>
 *   <li>{@link turnstile.spi.LeaseStore} - lease rows</li>
 *   <li>{@link turnstile.spi.BuildEventStore} - event rows and per-build counters</li>
 *   <li>{@link turnstile.spi.NotificationListener} / {@link turnstile.spi.NotificationPublisher}
 *       - the notification stream</li>
 *   <li>{@link turnstile.spi.MetricsExporter} - counters and gauges</li>
 * </ul>
 */
package turnstile.spi;
