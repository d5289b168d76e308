package turnstile.lock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LockIdTest {

    @Test
    void checksumIsCrc32OfUtf8Bytes() {
        // CRC-32 check value of "123456789" is 0xCBF43926
        assertEquals(0xCBF43926, LockId.checksum("123456789"));
    }

    @Test
    void semanticKeysAreDeterministic() {
        assertEquals(LockId.task("nightly-cleanup"), LockId.task("nightly-cleanup"));
        assertNotEquals(LockId.task("nightly-cleanup"), LockId.task("nightly-backup"));
    }

    @Test
    void kindsSeparateEqualNumericIds() {
        LockId build = LockId.buildTracking(5);
        LockId pipeline = LockId.pipelineScheduling(5);
        LockId job = LockId.jobScheduling(5);
        LockId resource = LockId.resourceChecking(5);

        assertEquals(5, build.key());
        assertEquals(5, pipeline.key());
        assertNotEquals(build, pipeline);
        assertNotEquals(pipeline, job);
        assertNotEquals(job, resource);
    }

    @Test
    void namespaceIsKindCode() {
        assertEquals(LockKind.BUILD_TRACKING.code(), LockId.buildTracking(1).namespace());
        assertEquals(LockKind.PIPELINE_SCHEDULING.code(), LockId.pipelineScheduling(1).namespace());
        assertEquals(LockKind.TASK.code(), LockId.task("x").namespace());
        assertEquals(LockKind.DATABASE_MIGRATION.code(), LockId.databaseMigration().namespace());
    }

    @Test
    void buildIdOutsideIntRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> LockId.buildTracking(1L << 40));
        assertThrows(IllegalArgumentException.class, () -> LockId.buildTracking(Long.MIN_VALUE));
    }

    @Test
    void nullSemanticKeyRejected() {
        assertThrows(NullPointerException.class, () -> LockId.task(null));
    }

    @Test
    void toStringShowsBothHalves() {
        assertEquals("LockId[2:42]", LockId.pipelineScheduling(42).toString());
    }
}
