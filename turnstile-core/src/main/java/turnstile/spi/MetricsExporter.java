package turnstile.spi;

/**
 * Observability hook for exporting coordination counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code turnstile-micrometer} bridges
 * this interface to a Micrometer {@code MeterRegistry}.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of locks acquired, including the locks underneath leases.
     */
    void incrementLockAcquired();

    /**
     * Increments the count of acquire attempts that found the lock already held,
     * either by this process or by another session.
     */
    void incrementLockContended();

    /**
     * Increments the count of leases signed.
     */
    void incrementLeaseSigned();

    /**
     * Increments the count of lease renewals that failed with a database error.
     */
    void incrementLeaseRenewalFailure();

    /**
     * Increments the count of wakes delivered to sinks by the notification dispatcher.
     */
    void incrementNotificationDispatched();

    /**
     * Increments the count of wakes skipped because the sink already held a pending wake.
     */
    void incrementNotificationCoalesced();

    /**
     * Increments the count of build events committed to the event log.
     *
     * @param count number of events in the committed batch
     */
    void incrementEventsAppended(int count);

    /**
     * Increments the count of builds that reached a terminal status.
     */
    default void incrementBuildsFinished() {
    }

    /**
     * Records the number of sinks currently registered with the notification bus.
     *
     * @param subscriptions active sink count
     */
    default void recordActiveSubscriptions(int subscriptions) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementLockAcquired() {
        }

        @Override
        public void incrementLockContended() {
        }

        @Override
        public void incrementLeaseSigned() {
        }

        @Override
        public void incrementLeaseRenewalFailure() {
        }

        @Override
        public void incrementNotificationDispatched() {
        }

        @Override
        public void incrementNotificationCoalesced() {
        }

        @Override
        public void incrementEventsAppended(int count) {
        }
    }
}
