package turnstile.lock;

import turnstile.spi.ConnectionProvider;
import turnstile.spi.LeaseStore;
import turnstile.spi.LockDatabase;
import turnstile.spi.MetricsExporter;
import turnstile.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative mutual exclusion across processes sharing one database.
 *
 * <p>Each coordinator owns one {@link LockDatabase} session and the registry that keeps
 * callers inside this process from defeating each other through that shared session.
 * Plain {@linkplain Lock locks} map directly onto advisory locks; {@linkplain Lease leases}
 * add a time gate persisted through a {@link LeaseStore} and a renewal task.
 *
 * <p>Create one instance per process via {@link #builder()} and pass it to every consumer.
 * Nothing here retries: a {@code false} or empty result means another holder is doing the
 * work, and database errors surface as {@link turnstile.StoreException}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * LockCoordinator locks = LockCoordinator.builder()
 *     .lockDatabase(new JdbcLockDatabase(connectionProvider, dialect))
 *     .connectionProvider(connectionProvider)
 *     .leaseStore(new JdbcLeaseStore(dialect))
 *     .build();
 *
 * locks.acquireSchedulingLock(pipelineId, Duration.ofSeconds(10)).ifPresent(lease -> {
 *     try {
 *         schedule(pipelineId);
 *     } finally {
 *         lease.breakLease();
 *     }
 * });
 * }</pre>
 *
 * <p>{@link #close()} breaks every lease and releases every lock still held through this
 * coordinator, stops the renewal thread and closes the lock session. A lease whose holder
 * never breaks it keeps renewing until then.
 *
 * <p>This class is thread-safe.
 */
public final class LockCoordinator implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(LockCoordinator.class.getName());

    private final LockDatabase lockDatabase;
    private final ConnectionProvider connectionProvider;
    private final LeaseStore leaseStore;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final LockRegistry registry = new LockRegistry();
    private final Set<Lock> active = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService renewalScheduler;
    private volatile boolean closed;

    private LockCoordinator(Builder builder) {
        this.lockDatabase = Objects.requireNonNull(builder.lockDatabase, "lockDatabase");
        this.connectionProvider = builder.connectionProvider;
        this.leaseStore = builder.leaseStore;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an unacquired handle for {@code id}.
     */
    public Lock newLock(LockId id) {
        ensureOpen();
        return new DatabaseLock(this, id);
    }

    /**
     * Tries to take {@code id} without waiting.
     *
     * @return the held lock, or empty if the id is held in this process or by another session
     */
    public Optional<Lock> acquire(LockId id) {
        Lock lock = newLock(id);
        return lock.acquire() ? Optional.of(lock) : Optional.empty();
    }

    /**
     * Creates an unsigned lease renewed every {@code interval / 2}.
     */
    public Lease newLease(String name, LockId id, Duration interval) {
        Objects.requireNonNull(interval, "interval");
        Duration half = interval.dividedBy(2);
        return newLease(name, id, interval, half.isZero() ? Duration.ofMillis(1) : half);
    }

    /**
     * Creates an unsigned lease with an explicit renewal cadence.
     *
     * @param name       lease row name, unique per subject
     * @param id         underlying advisory lock
     * @param interval   minimum time between successful signs
     * @param renewEvery how often a signed lease re-stamps its row; should be well below
     *                   {@code interval}
     * @throws IllegalStateException if no lease store was configured
     */
    public Lease newLease(String name, LockId id, Duration interval, Duration renewEvery) {
        ensureOpen();
        if (leaseStore == null || connectionProvider == null) {
            throw new IllegalStateException("Leases require a leaseStore and a connectionProvider");
        }
        return new Lease(this, name, id, interval, renewEvery);
    }

    /**
     * Tries to sign a lease without waiting.
     *
     * @return the signed lease, or empty if it is held or was signed within {@code interval}
     */
    public Optional<Lease> acquireLease(String name, LockId id, Duration interval) {
        Lease lease = newLease(name, id, interval);
        return lease.attemptSign() ? Optional.of(lease) : Optional.empty();
    }

    /**
     * Leases the right to schedule a pipeline at most once per {@code interval}.
     */
    public Optional<Lease> acquireSchedulingLock(int pipelineId, Duration interval) {
        return acquireLease("pipeline-scheduling-" + pipelineId, LockId.pipelineScheduling(pipelineId), interval);
    }

    /**
     * Leases the right to check a resource at most once per {@code interval}.
     */
    public Optional<Lease> acquireCheckingLock(int resourceId, Duration interval) {
        return acquireLease("resource-checking-" + resourceId, LockId.resourceChecking(resourceId), interval);
    }

    /**
     * Takes the lock that makes this process the tracker of a running build.
     */
    public Optional<Lock> acquireTrackingLock(long buildId) {
        return acquire(LockId.buildTracking(buildId));
    }

    /**
     * Takes the lock of a named singleton task.
     */
    public Optional<Lock> acquireTaskLock(String taskName) {
        return acquire(LockId.task(taskName));
    }

    /**
     * Whether some handle of this coordinator currently holds {@code id}.
     */
    public boolean isHeld(LockId id) {
        return registry.isRegistered(id);
    }

    /**
     * Breaks all leases and releases all locks still held, then closes the lock session.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        List<Lock> held = new ArrayList<>(active);
        // Leases first so their underlying locks are released by breakLease().
        held.sort((a, b) -> Boolean.compare(b instanceof Lease, a instanceof Lease));
        for (Lock lock : held) {
            try {
                lock.release();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to release " + lock + " on close", e);
            }
        }
        synchronized (this) {
            if (renewalScheduler != null) {
                renewalScheduler.shutdownNow();
                try {
                    renewalScheduler.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        lockDatabase.close();
    }

    synchronized ScheduledFuture<?> scheduleRenewal(Runnable task, Duration every) {
        ensureOpen();
        if (renewalScheduler == null) {
            renewalScheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("turnstile-lease-renewal-"));
        }
        long everyMs = Math.max(1L, every.toMillis());
        return renewalScheduler.scheduleWithFixedDelay(task, everyMs, everyMs, TimeUnit.MILLISECONDS);
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("LockCoordinator has been closed");
        }
    }

    void track(Lock lock) {
        active.add(lock);
    }

    void untrack(Lock lock) {
        active.remove(lock);
    }

    LockRegistry registry() {
        return registry;
    }

    LockDatabase lockDatabase() {
        return lockDatabase;
    }

    ConnectionProvider connectionProvider() {
        return connectionProvider;
    }

    LeaseStore leaseStore() {
        return leaseStore;
    }

    MetricsExporter metrics() {
        return metrics;
    }

    Clock clock() {
        return clock;
    }

    /**
     * Builder for {@link LockCoordinator}.
     */
    public static final class Builder {
        private LockDatabase lockDatabase;
        private ConnectionProvider connectionProvider;
        private LeaseStore leaseStore;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the advisory-lock session. The coordinator takes ownership and closes it.
         *
         * <p><b>Required.</b>
         *
         * @param lockDatabase the lock session
         * @return this builder
         */
        public Builder lockDatabase(LockDatabase lockDatabase) {
            this.lockDatabase = lockDatabase;
            return this;
        }

        /**
         * Sets the connection provider used for lease claims and renewals.
         *
         * <p>Optional. Required only for leases.
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the lease persistence backend.
         *
         * <p>Optional. Required only for leases.
         *
         * @param leaseStore the lease store
         * @return this builder
         */
        public Builder leaseStore(LeaseStore leaseStore) {
            this.leaseStore = leaseStore;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock that timestamps lease claims.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}. Every process sharing a lease
         * table compares its own clock against stamps written by the others, so hosts
         * must be time-synchronized to well within the lease interval.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the coordinator.
         *
         * @return a new {@link LockCoordinator}
         * @throws NullPointerException if {@code lockDatabase} is null
         */
        public LockCoordinator build() {
            return new LockCoordinator(this);
        }
    }
}
