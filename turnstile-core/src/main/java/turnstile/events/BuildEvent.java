package turnstile.events;

import java.util.Objects;

/**
 * A persisted row of the build event log.
 *
 * @param buildId  owning build
 * @param sequence position within the build, gapless and strictly increasing from 1
 * @param type     event type tag
 * @param version  payload schema version
 * @param payload  serialized event
 */
public record BuildEvent(long buildId, long sequence, String type, String version, String payload) {

    public BuildEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(payload, "payload");
    }
}
