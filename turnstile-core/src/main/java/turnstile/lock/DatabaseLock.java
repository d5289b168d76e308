package turnstile.lock;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Lock} backed by the coordinator's advisory-lock session and registry.
 */
final class DatabaseLock implements Lock {
    private static final Logger logger = Logger.getLogger(DatabaseLock.class.getName());

    private final LockCoordinator coordinator;
    private final LockId id;
    private final List<Runnable> afterRelease = new ArrayList<>();
    private boolean held;

    DatabaseLock(LockCoordinator coordinator, LockId id) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public LockId id() {
        return id;
    }

    @Override
    public synchronized boolean acquire() {
        coordinator.ensureOpen();
        if (held || !coordinator.registry().tryRegister(id)) {
            coordinator.metrics().incrementLockContended();
            return false;
        }

        boolean acquired;
        try {
            acquired = coordinator.lockDatabase().tryAcquire(id);
        } catch (RuntimeException e) {
            coordinator.registry().unregister(id);
            throw e;
        }
        if (!acquired) {
            coordinator.registry().unregister(id);
            coordinator.metrics().incrementLockContended();
            return false;
        }

        held = true;
        coordinator.track(this);
        coordinator.metrics().incrementLockAcquired();
        return true;
    }

    @Override
    public void release() {
        List<Runnable> actions;
        RuntimeException failure = null;
        synchronized (this) {
            if (!held) {
                return;
            }
            try {
                if (!coordinator.lockDatabase().release(id)) {
                    logger.log(Level.WARNING, "Session no longer held {0}; dropping local registration", id);
                }
            } catch (RuntimeException e) {
                failure = e;
            }
            // Local state is cleared even when the database call fails.
            coordinator.registry().unregister(id);
            coordinator.untrack(this);
            held = false;
            actions = new ArrayList<>(afterRelease);
            afterRelease.clear();
        }
        for (Runnable action : actions) {
            runSafely(action);
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public synchronized void afterRelease(Runnable action) {
        afterRelease.add(Objects.requireNonNull(action, "action"));
    }

    @Override
    public synchronized boolean isHeld() {
        return held;
    }

    private void runSafely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "After-release action for " + id + " failed", e);
        }
    }

    @Override
    public String toString() {
        return "DatabaseLock[" + id + "]";
    }
}
