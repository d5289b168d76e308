package turnstile.spi;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;

/**
 * Persistence for time-gated lease claims, one row per lease name.
 *
 * <p>All methods operate on a caller-supplied {@link Connection} in auto-commit mode.
 *
 * @see turnstile.jdbc.JdbcLeaseStore
 */
public interface LeaseStore {

    /**
     * Inserts the lease row with a claim time far in the past, unless it already exists.
     *
     * @param conn the JDBC connection
     * @param name lease name
     */
    void ensureExists(Connection conn, String name);

    /**
     * Stamps {@code claimed_at = now} in one statement, but only when the previous
     * claim is at least {@code interval} old.
     *
     * @param conn     the JDBC connection
     * @param name     lease name
     * @param now      current time
     * @param interval minimum age of the previous claim
     * @return {@code true} if the row was updated; {@code false} means "claimed recently"
     */
    boolean attemptSign(Connection conn, String name, Instant now, Duration interval);

    /**
     * Re-stamps the claim of a lease this process already holds.
     *
     * @param conn the JDBC connection
     * @param name lease name
     * @param now  current time
     * @return {@code true} if the row exists and was updated
     */
    boolean renew(Connection conn, String name, Instant now);
}
