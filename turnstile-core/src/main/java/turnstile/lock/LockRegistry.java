package turnstile.lock;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local set of lock ids held through one {@link turnstile.spi.LockDatabase} session.
 *
 * <p>Advisory locks are reentrant per session, so without this registry two callers in
 * the same process would both "acquire" the same id. An id is registered before the
 * database is asked and removed again if the database says no.
 *
 * <p>This class is thread-safe.
 */
final class LockRegistry {
    private final Set<LockId> held = ConcurrentHashMap.newKeySet();

    /**
     * Registers the id unless it already is.
     *
     * @return {@code true} if the caller now owns the registration
     */
    boolean tryRegister(LockId id) {
        return held.add(id);
    }

    void unregister(LockId id) {
        held.remove(id);
    }

    boolean isRegistered(LockId id) {
        return held.contains(id);
    }

    int size() {
        return held.size();
    }
}
