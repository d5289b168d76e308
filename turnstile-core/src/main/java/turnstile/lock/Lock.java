package turnstile.lock;

/**
 * Handle on a cross-process mutual-exclusion claim.
 *
 * <p>Acquisition never blocks: {@code false} means someone else is doing this work and is
 * not an error. Database failures propagate as {@link turnstile.StoreException}.
 *
 * @see LockCoordinator#newLock(LockId)
 * @see Lease
 */
public interface Lock {

    /**
     * The id this handle claims.
     */
    LockId id();

    /**
     * Tries to take the claim without waiting.
     *
     * @return {@code true} if this handle now holds the claim
     */
    boolean acquire();

    /**
     * Gives the claim up and then runs the after-release actions.
     *
     * <p>Idempotent. Calling it on a handle that does not hold the claim does nothing,
     * and the actions run only on the call that actually released.
     */
    void release();

    /**
     * Registers an action to run after the next successful {@link #release()}.
     *
     * <p>Actions fire once, in registration order, on the releasing thread, and are then
     * discarded. A failing action is logged and does not stop the others.
     *
     * @param action the action to run
     */
    void afterRelease(Runnable action);

    /**
     * Whether this handle currently holds the claim.
     */
    boolean isHeld();
}
