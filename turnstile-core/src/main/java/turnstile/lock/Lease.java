package turnstile.lock;

import turnstile.StoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A renewable, time-gated claim on top of an advisory {@link Lock}.
 *
 * <p>{@link #attemptSign()} succeeds only if the underlying lock is free <em>and</em> the
 * lease row was not claimed within the last {@code interval}. The time gate is checked and
 * stamped by a single conditional statement, so it cannot race with another claimant.
 * While signed, a renewal task re-stamps the row every {@code renewEvery} so the lease
 * keeps looking fresh to other processes. The renewal task runs until
 * {@link #breakLease()} or {@link LockCoordinator#close()}.
 *
 * <p>Because the gate is time-based, a lease broken by one process cannot be signed by
 * anyone (including the same process) until {@code interval} has passed since the last
 * stamp. A crashed holder's lease therefore expires on its own.
 *
 * <p>This class is thread-safe.
 */
public final class Lease implements Lock {
    private static final Logger logger = Logger.getLogger(Lease.class.getName());

    private final LockCoordinator coordinator;
    private final String name;
    private final Duration interval;
    private final Duration renewEvery;
    private final Lock lock;
    private final List<Runnable> afterBreak = new ArrayList<>();

    private boolean signed;
    private ScheduledFuture<?> renewal;

    Lease(LockCoordinator coordinator, String name, LockId id, Duration interval, Duration renewEvery) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.name = Objects.requireNonNull(name, "name");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.renewEvery = Objects.requireNonNull(renewEvery, "renewEvery");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (renewEvery.isNegative() || renewEvery.isZero()) {
            throw new IllegalArgumentException("renewEvery must be positive");
        }
        this.lock = new DatabaseLock(coordinator, id);
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    @Override
    public LockId id() {
        return lock.id();
    }

    /**
     * Tries to sign the lease without waiting.
     *
     * @return {@code true} if signed; {@code false} if the lock is held elsewhere or the
     *         lease was claimed less than {@code interval} ago
     * @throws StoreException if the database fails; the underlying lock is released first
     * @throws IllegalStateException if the coordinator closes while signing; the underlying
     *         lock is released first
     */
    public synchronized boolean attemptSign() {
        if (signed || !lock.acquire()) {
            return false;
        }

        boolean claimed;
        try (Connection conn = coordinator.connectionProvider().getConnection()) {
            conn.setAutoCommit(true);
            coordinator.leaseStore().ensureExists(conn, name);
            claimed = coordinator.leaseStore().attemptSign(conn, name, coordinator.clock().instant(), interval);
        } catch (SQLException | RuntimeException e) {
            StoreException failure = e instanceof StoreException se
                ? se : new StoreException("Failed to sign lease " + name, e);
            try {
                lock.release();
            } catch (RuntimeException releaseFailure) {
                failure.addSuppressed(releaseFailure);
            }
            throw failure;
        }

        if (!claimed) {
            lock.release();
            return false;
        }

        try {
            renewal = coordinator.scheduleRenewal(this::renew, renewEvery);
        } catch (RuntimeException e) {
            // The coordinator closed after the row was stamped; nothing would ever release the lock.
            try {
                lock.release();
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
        signed = true;
        coordinator.track(this);
        coordinator.metrics().incrementLeaseSigned();
        return true;
    }

    /**
     * Stops renewal, releases the underlying lock, then runs the after-break actions.
     *
     * <p>Idempotent: breaking an unsigned lease does nothing.
     */
    public void breakLease() {
        List<Runnable> actions;
        RuntimeException failure = null;
        synchronized (this) {
            if (!signed) {
                return;
            }
            if (renewal != null) {
                renewal.cancel(false);
                renewal = null;
            }
            signed = false;
            coordinator.untrack(this);
            actions = new ArrayList<>(afterBreak);
            afterBreak.clear();
            try {
                lock.release();
            } catch (RuntimeException e) {
                failure = e;
            }
        }
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "After-break action for lease " + name + " failed", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Registers an action to run once after the next successful {@link #breakLease()}.
     *
     * @param action the action to run
     */
    public synchronized void afterBreak(Runnable action) {
        afterBreak.add(Objects.requireNonNull(action, "action"));
    }

    /** Same as {@link #attemptSign()}. */
    @Override
    public boolean acquire() {
        return attemptSign();
    }

    /** Same as {@link #breakLease()}. */
    @Override
    public void release() {
        breakLease();
    }

    /** Same as {@link #afterBreak(Runnable)}. */
    @Override
    public void afterRelease(Runnable action) {
        afterBreak(action);
    }

    @Override
    public synchronized boolean isHeld() {
        return signed;
    }

    // Holds the monitor so a renewal in flight finishes before breakLease() releases the lock.
    private synchronized void renew() {
        if (!signed) {
            return;
        }
        try (Connection conn = coordinator.connectionProvider().getConnection()) {
            conn.setAutoCommit(true);
            if (!coordinator.leaseStore().renew(conn, name, coordinator.clock().instant())) {
                logger.log(Level.WARNING, "Lease row {0} is missing; renewal had no effect", name);
            }
        } catch (SQLException | RuntimeException e) {
            coordinator.metrics().incrementLeaseRenewalFailure();
            logger.log(Level.WARNING, "Failed to renew lease " + name, e);
        }
    }

    @Override
    public String toString() {
        return "Lease[" + name + ", " + lock.id() + ", interval=" + interval + "]";
    }
}
