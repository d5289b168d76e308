/**
 * Spring Boot auto-configuration for turnstile.
 *
 * <p>Add {@code turnstile-spring-boot-starter} next to a {@code DataSource} to get a
 * {@link turnstile.lock.LockCoordinator}, a {@link turnstile.bus.NotificationBus} and a
 * {@link turnstile.events.BuildEventLog}. Configure under the {@code turnstile.*} prefix:
 *
 * <pre>
 * turnstile.initialize-schema=true
 * turnstile.tables.event=ci_build_events
 * turnstile.bus.receive-timeout=PT2S
 * turnstile.connection-retry.max-attempts=10
 * turnstile.metrics.name-prefix=ci.turnstile
 * </pre>
 */
package turnstile.spring.boot;
