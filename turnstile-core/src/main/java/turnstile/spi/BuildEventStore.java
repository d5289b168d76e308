package turnstile.spi;

import turnstile.events.BuildEvent;

import java.sql.Connection;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for the build event log and the per-build sequence counters.
 *
 * <p>Every method runs on a caller-supplied {@link Connection}; the caller owns the
 * transaction. The counter row is the only serialization point between concurrent
 * appenders of one build, and since it is updated inside the appending transaction a
 * rollback never leaves a gap.
 *
 * @see turnstile.jdbc.JdbcBuildEventStore
 */
public interface BuildEventStore {

    /**
     * Creates the build's counter. Does nothing if the counter exists, including when
     * another caller creates it concurrently.
     *
     * @throws IllegalStateException if the build has already finished
     */
    void initialize(Connection conn, long buildId);

    /**
     * Takes the next sequence number from the build's counter.
     *
     * @throws IllegalStateException if the build has no counter (never initialized, or finished)
     */
    long nextSequence(Connection conn, long buildId);

    /**
     * Inserts one event row.
     */
    void insert(Connection conn, BuildEvent event);

    /**
     * Returns up to {@code limit} events with {@code sequence >= fromSequence}, ascending.
     */
    List<BuildEvent> eventsSince(Connection conn, long buildId, long fromSequence, int limit);

    /**
     * Whether the build has events but no counter any more.
     */
    boolean isFinished(Connection conn, long buildId);

    /**
     * Drops the build's counter. Stored events stay.
     */
    void finalizeSequence(Connection conn, long buildId);

    /**
     * Removes every event and counter of the given builds.
     *
     * @return number of event rows deleted
     */
    int delete(Connection conn, Collection<Long> buildIds);
}
