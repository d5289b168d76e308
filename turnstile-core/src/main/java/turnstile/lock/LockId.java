package turnstile.lock;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Key into the database's two-int advisory-lock space.
 *
 * <p>{@code namespace} is the {@linkplain LockKind#code() code of a lock kind};
 * {@code key} is either a numeric subject id used directly or the CRC-32 checksum of a
 * semantic string. Derivation is deterministic, so every process computes the same id
 * for the same subject.
 *
 * <p>String-derived keys can still collide within one namespace. Callers pass enough
 * context in the key string (for example {@code "team/pipeline/task"}) to keep that rare.
 */
public record LockId(int namespace, int key) {

    public static LockId of(LockKind kind, int key) {
        Objects.requireNonNull(kind, "kind");
        return new LockId(kind.code(), key);
    }

    public static LockId of(LockKind kind, String semanticKey) {
        Objects.requireNonNull(kind, "kind");
        return new LockId(kind.code(), checksum(semanticKey));
    }

    public static LockId buildTracking(long buildId) {
        return of(LockKind.BUILD_TRACKING, narrow(buildId, "buildId"));
    }

    public static LockId pipelineScheduling(int pipelineId) {
        return of(LockKind.PIPELINE_SCHEDULING, pipelineId);
    }

    public static LockId jobScheduling(int jobId) {
        return of(LockKind.JOB_SCHEDULING, jobId);
    }

    public static LockId resourceChecking(int resourceId) {
        return of(LockKind.RESOURCE_CHECKING, resourceId);
    }

    public static LockId task(String taskName) {
        return of(LockKind.TASK, taskName);
    }

    public static LockId databaseMigration() {
        return of(LockKind.DATABASE_MIGRATION, 0);
    }

    /**
     * CRC-32 (IEEE) of the UTF-8 bytes of {@code semanticKey}, reinterpreted as a signed int.
     */
    static int checksum(String semanticKey) {
        Objects.requireNonNull(semanticKey, "semanticKey");
        CRC32 crc = new CRC32();
        crc.update(semanticKey.getBytes(StandardCharsets.UTF_8));
        return (int) crc.getValue();
    }

    private static int narrow(long id, String name) {
        if (id < Integer.MIN_VALUE || id > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " does not fit the lock key space: " + id);
        }
        return (int) id;
    }

    @Override
    public String toString() {
        return "LockId[" + namespace + ":" + key + "]";
    }
}
