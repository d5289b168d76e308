package turnstile.spi;

import turnstile.lock.LockId;

/**
 * One database session's advisory-lock primitive.
 *
 * <p>Locks are scoped to the session, not to the calling thread: acquiring an id the
 * session already holds succeeds again. {@link turnstile.lock.LockCoordinator} keeps a
 * process-local registry in front of this interface so callers sharing one session
 * still exclude each other.
 *
 * <p>Database failures surface as {@link turnstile.StoreException} with the driver's
 * exception as the cause.
 *
 * @see turnstile.jdbc.JdbcLockDatabase
 * @see turnstile.memory.InMemoryLockServer
 */
public interface LockDatabase extends AutoCloseable {

    /**
     * Tries to take the lock without waiting.
     *
     * @param id the lock to take
     * @return {@code true} if this session now holds the lock
     */
    boolean tryAcquire(LockId id);

    /**
     * Releases one hold of the lock.
     *
     * @param id the lock to release
     * @return {@code false} if this session did not hold the lock
     */
    boolean release(LockId id);

    /**
     * Ends the session. Every lock it still holds is released.
     */
    @Override
    void close();
}
