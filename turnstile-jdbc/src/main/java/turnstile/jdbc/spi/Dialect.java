package turnstile.jdbc.spi;

import turnstile.lock.LockId;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for leases, event sequences, advisory
 * locks and notifications. Register custom dialects via
 * {@code META-INF/services/turnstile.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL (all features) and H2 (leases and events only; pair it
 * with the in-memory lock server and notification hub).
 *
 * @see turnstile.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Inserts the lease row with {@code claimed_at} set to the epoch unless it exists.
   *
   * @param conn  JDBC connection
   * @param table lease table
   * @param name  lease name
   */
  void insertLeaseIfAbsent(Connection conn, String table, String name);

  /**
   * Stamps {@code claimed_at = now} where {@code claimed_at <= cutoff}, in one statement.
   *
   * @return {@code true} if the lease was claimed
   */
  boolean signLease(Connection conn, String table, String name, Instant now, Instant cutoff);

  /**
   * SQL re-stamping a lease.
   *
   * <p>Parameters: claimed_at (Timestamp), lease_name (String)
   */
  String renewLeaseSql(String table);

  /**
   * Creates a build's sequence counter, continuing after its highest stored event, unless
   * the counter exists.
   */
  void initializeSequence(Connection conn, String sequenceTable, String eventTable, long buildId);

  /**
   * Increments the build's counter and returns the value it had.
   *
   * @return the taken sequence number, or {@code -1} if the build has no counter
   */
  long nextSequence(Connection conn, String sequenceTable, long buildId);

  /**
   * Whether {@link #tryAdvisoryLock} and {@link #advisoryUnlock} are supported.
   */
  default boolean supportsAdvisoryLocks() {
    return false;
  }

  /**
   * Takes a session-scoped advisory lock without waiting.
   */
  default boolean tryAdvisoryLock(Connection conn, LockId id) {
    throw new UnsupportedOperationException("Advisory locks are not supported by " + name());
  }

  /**
   * Releases one hold of a session-scoped advisory lock.
   *
   * @return {@code false} if the session did not hold it
   */
  default boolean advisoryUnlock(Connection conn, LockId id) {
    throw new UnsupportedOperationException("Advisory locks are not supported by " + name());
  }

  /**
   * Releases every advisory lock the session holds.
   */
  default void advisoryUnlockAll(Connection conn) {
    throw new UnsupportedOperationException("Advisory locks are not supported by " + name());
  }

  /**
   * Whether {@link #notify} and LISTEN/UNLISTEN are supported.
   */
  default boolean supportsNotifications() {
    return false;
  }

  /**
   * Broadcasts {@code payload} on {@code channel} to every listening session.
   */
  default void notify(Connection conn, String channel, String payload) {
    throw new UnsupportedOperationException("Notifications are not supported by " + name());
  }
}
