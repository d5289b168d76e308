package turnstile.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a build as seen by the event log.
 *
 * <p>{@code PENDING -> STARTED -> one of the terminal statuses}. Nothing leaves a terminal
 * status.
 */
public enum BuildStatus {
    PENDING("pending", false),
    STARTED("started", false),
    SUCCEEDED("succeeded", true),
    FAILED("failed", true),
    ERRORED("errored", true),
    ABORTED("aborted", true);

    private final String value;
    private final boolean terminal;

    BuildStatus(String value, boolean terminal) {
        this.value = value;
        this.terminal = terminal;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }

    @JsonCreator
    public static BuildStatus fromValue(String value) {
        for (BuildStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown build status: " + value);
    }
}
