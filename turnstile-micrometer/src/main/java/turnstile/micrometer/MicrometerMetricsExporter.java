package turnstile.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import turnstile.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code turnstile.lock.acquired} - locks acquired, including those under leases</li>
 *   <li>{@code turnstile.lock.contended} - acquire attempts that found the lock held</li>
 *   <li>{@code turnstile.lease.signed} - leases signed</li>
 *   <li>{@code turnstile.lease.renewal.failure} - lease renewals that failed</li>
 *   <li>{@code turnstile.notification.dispatched} - wakes delivered to sinks</li>
 *   <li>{@code turnstile.notification.coalesced} - wakes merged into a pending one</li>
 *   <li>{@code turnstile.events.appended} - build events committed</li>
 *   <li>{@code turnstile.builds.finished} - builds that reached a terminal status</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code turnstile.bus.subscriptions} - sinks registered with the notification bus</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter lockAcquired;
  private final Counter lockContended;
  private final Counter leaseSigned;
  private final Counter leaseRenewalFailure;
  private final Counter notificationDispatched;
  private final Counter notificationCoalesced;
  private final Counter eventsAppended;
  private final Counter buildsFinished;
  private final Gauge subscriptionsGauge;

  private final AtomicInteger subscriptions = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "turnstile"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "turnstile");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "ci.turnstile"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.lockAcquired = Counter.builder(namePrefix + ".lock.acquired")
        .description("Locks acquired")
        .register(registry);
    this.lockContended = Counter.builder(namePrefix + ".lock.contended")
        .description("Lock attempts that found the lock held")
        .register(registry);
    this.leaseSigned = Counter.builder(namePrefix + ".lease.signed")
        .description("Leases signed")
        .register(registry);
    this.leaseRenewalFailure = Counter.builder(namePrefix + ".lease.renewal.failure")
        .description("Lease renewals that failed")
        .register(registry);
    this.notificationDispatched = Counter.builder(namePrefix + ".notification.dispatched")
        .description("Notification wakes delivered to sinks")
        .register(registry);
    this.notificationCoalesced = Counter.builder(namePrefix + ".notification.coalesced")
        .description("Notification wakes merged into a pending wake")
        .register(registry);
    this.eventsAppended = Counter.builder(namePrefix + ".events.appended")
        .description("Build events committed")
        .register(registry);
    this.buildsFinished = Counter.builder(namePrefix + ".builds.finished")
        .description("Builds that reached a terminal status")
        .register(registry);

    this.subscriptionsGauge = Gauge.builder(namePrefix + ".bus.subscriptions", subscriptions, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementLockAcquired() {
    if (closed) return;
    lockAcquired.increment();
  }

  @Override
  public void incrementLockContended() {
    if (closed) return;
    lockContended.increment();
  }

  @Override
  public void incrementLeaseSigned() {
    if (closed) return;
    leaseSigned.increment();
  }

  @Override
  public void incrementLeaseRenewalFailure() {
    if (closed) return;
    leaseRenewalFailure.increment();
  }

  @Override
  public void incrementNotificationDispatched() {
    if (closed) return;
    notificationDispatched.increment();
  }

  @Override
  public void incrementNotificationCoalesced() {
    if (closed) return;
    notificationCoalesced.increment();
  }

  @Override
  public void incrementEventsAppended(int count) {
    if (closed) return;
    eventsAppended.increment(count);
  }

  @Override
  public void incrementBuildsFinished() {
    if (closed) return;
    buildsFinished.increment();
  }

  @Override
  public void recordActiveSubscriptions(int subscriptions) {
    if (closed) return;
    this.subscriptions.set(subscriptions);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(lockAcquired, lockContended, leaseSigned, leaseRenewalFailure,
        notificationDispatched, notificationCoalesced, eventsAppended, buildsFinished,
        subscriptionsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
