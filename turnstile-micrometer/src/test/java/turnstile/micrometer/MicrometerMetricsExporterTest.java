package turnstile.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void lockCounters() {
    exporter.incrementLockAcquired();
    exporter.incrementLockAcquired();
    exporter.incrementLockContended();
    assertEquals(2.0, counter("turnstile.lock.acquired").count());
    assertEquals(1.0, counter("turnstile.lock.contended").count());
  }

  @Test
  void leaseCounters() {
    exporter.incrementLeaseSigned();
    exporter.incrementLeaseRenewalFailure();
    exporter.incrementLeaseRenewalFailure();
    assertEquals(1.0, counter("turnstile.lease.signed").count());
    assertEquals(2.0, counter("turnstile.lease.renewal.failure").count());
  }

  @Test
  void notificationCounters() {
    exporter.incrementNotificationDispatched();
    exporter.incrementNotificationCoalesced();
    exporter.incrementNotificationCoalesced();
    exporter.incrementNotificationCoalesced();
    assertEquals(1.0, counter("turnstile.notification.dispatched").count());
    assertEquals(3.0, counter("turnstile.notification.coalesced").count());
  }

  @Test
  void eventsAppendedCountsWholeBatch() {
    exporter.incrementEventsAppended(5);
    exporter.incrementEventsAppended(1);
    assertEquals(6.0, counter("turnstile.events.appended").count());
  }

  @Test
  void buildsFinished() {
    exporter.incrementBuildsFinished();
    assertEquals(1.0, counter("turnstile.builds.finished").count());
  }

  @Test
  void recordActiveSubscriptions() {
    exporter.recordActiveSubscriptions(12);
    assertEquals(12.0, gauge("turnstile.bus.subscriptions").value());

    exporter.recordActiveSubscriptions(0);
    assertEquals(0.0, gauge("turnstile.bus.subscriptions").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "ci.turnstile");
    custom.incrementLockAcquired();
    custom.recordActiveSubscriptions(3);

    assertEquals(1.0, counter("ci.turnstile.lock.acquired").count());
    assertEquals(3.0, gauge("ci.turnstile.bus.subscriptions").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementLockAcquired();
    exporter.close();

    assertNull(registry.find("turnstile.lock.acquired").counter());
    assertNull(registry.find("turnstile.bus.subscriptions").gauge());
    assertDoesNotThrow(() -> exporter.incrementLockAcquired());
    assertNull(registry.find("turnstile.lock.acquired").counter());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void emptyOrDottedPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "ci."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
