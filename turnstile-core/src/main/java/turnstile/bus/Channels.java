package turnstile.bus;

/**
 * Channel names shared by writers and waiters.
 *
 * <p>Names are derived from the subject id so unrelated builds never share a channel.
 */
public final class Channels {

    /** Published when any build moves from pending to started. */
    public static final String BUILD_STARTED = "build_started";

    private Channels() {
    }

    /**
     * Channel signalled after new events for {@code buildId} are committed.
     */
    public static String buildEvents(long buildId) {
        return "build_events_" + buildId;
    }

    /**
     * Channel signalled when {@code buildId} is asked to abort.
     */
    public static String buildAbort(long buildId) {
        return "build_abort_" + buildId;
    }
}
