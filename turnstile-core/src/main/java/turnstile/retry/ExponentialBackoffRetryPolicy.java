package turnstile.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>The delay for attempt {@code n} is {@code baseDelay * 2^(n-1)}, capped at
 * {@code maxDelay}, multiplied by a random factor in [0.5, 1.5) and capped again.
 * Used for connection establishment and for re-opening a dropped LISTEN session.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelayMs delay before the second attempt (milliseconds)
     * @param maxDelayMs  upper bound for any single delay (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long uncapped;
        if (attempts >= 31 || (1L << (attempts - 1)) > maxDelayMs / baseDelayMs) {
            uncapped = maxDelayMs;
        } else {
            uncapped = baseDelayMs * (1L << (attempts - 1));
        }
        long capped = Math.min(maxDelayMs, uncapped);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
    }
}
