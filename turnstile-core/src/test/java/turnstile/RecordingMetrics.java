package turnstile;

import turnstile.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} that counts every call, for assertions in tests.
 */
public final class RecordingMetrics implements MetricsExporter {
    public final AtomicInteger lockAcquired = new AtomicInteger();
    public final AtomicInteger lockContended = new AtomicInteger();
    public final AtomicInteger leaseSigned = new AtomicInteger();
    public final AtomicInteger leaseRenewalFailure = new AtomicInteger();
    public final AtomicInteger notificationDispatched = new AtomicInteger();
    public final AtomicInteger notificationCoalesced = new AtomicInteger();
    public final AtomicInteger eventsAppended = new AtomicInteger();
    public final AtomicInteger buildsFinished = new AtomicInteger();
    public final AtomicInteger activeSubscriptions = new AtomicInteger();

    @Override
    public void incrementLockAcquired() {
        lockAcquired.incrementAndGet();
    }

    @Override
    public void incrementLockContended() {
        lockContended.incrementAndGet();
    }

    @Override
    public void incrementLeaseSigned() {
        leaseSigned.incrementAndGet();
    }

    @Override
    public void incrementLeaseRenewalFailure() {
        leaseRenewalFailure.incrementAndGet();
    }

    @Override
    public void incrementNotificationDispatched() {
        notificationDispatched.incrementAndGet();
    }

    @Override
    public void incrementNotificationCoalesced() {
        notificationCoalesced.incrementAndGet();
    }

    @Override
    public void incrementEventsAppended(int count) {
        eventsAppended.addAndGet(count);
    }

    @Override
    public void incrementBuildsFinished() {
        buildsFinished.incrementAndGet();
    }

    @Override
    public void recordActiveSubscriptions(int subscriptions) {
        activeSubscriptions.set(subscriptions);
    }
}
