package turnstile.events;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BuildStatusTest {

    @Test
    void terminalStatuses() {
        assertFalse(BuildStatus.PENDING.isTerminal());
        assertFalse(BuildStatus.STARTED.isTerminal());
        assertTrue(BuildStatus.SUCCEEDED.isTerminal());
        assertTrue(BuildStatus.FAILED.isTerminal());
        assertTrue(BuildStatus.ERRORED.isTerminal());
        assertTrue(BuildStatus.ABORTED.isTerminal());
    }

    @Test
    void valuesRoundTrip() {
        for (BuildStatus status : BuildStatus.values()) {
            assertEquals(status, BuildStatus.fromValue(status.value()));
        }
    }

    @Test
    void unknownValueRejected() {
        assertThrows(IllegalArgumentException.class, () -> BuildStatus.fromValue("paused"));
    }
}
