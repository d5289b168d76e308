package turnstile.lock;

/**
 * Namespaces of the advisory-lock key space.
 *
 * <p>Each kind owns the first half of a two-part {@link LockId}, so a build id and a
 * pipeline id with the same numeric value never contend with each other. Codes are
 * persisted implicitly in the database's lock table and must never be renumbered.
 */
public enum LockKind {
    BUILD_TRACKING(1),
    PIPELINE_SCHEDULING(2),
    JOB_SCHEDULING(3),
    RESOURCE_CHECKING(4),
    TASK(5),
    DATABASE_MIGRATION(6);

    private final int code;

    LockKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
