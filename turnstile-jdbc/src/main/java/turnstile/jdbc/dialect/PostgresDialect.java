package turnstile.jdbc.dialect;

import turnstile.jdbc.JdbcTemplate;
import turnstile.lock.LockId;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL dialect: two-int advisory locks, LISTEN/NOTIFY and single-statement
 * claims via {@code ON CONFLICT} and {@code RETURNING}.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void insertLeaseIfAbsent(Connection conn, String table, String name) {
    String sql = "INSERT INTO " + table + " (lease_name, claimed_at) VALUES (?, ?) " +
        "ON CONFLICT (lease_name) DO NOTHING";
    JdbcTemplate.update(conn, sql, name, NEVER_CLAIMED);
  }

  @Override
  public boolean signLease(Connection conn, String table, String name, Instant now, Instant cutoff) {
    String sql = "UPDATE " + table + " SET claimed_at = ? " +
        "WHERE lease_name = ? AND claimed_at <= ? RETURNING lease_name";
    return !JdbcTemplate.updateReturning(conn, sql, rs -> rs.getString(1),
        Timestamp.from(now), name, Timestamp.from(cutoff)).isEmpty();
  }

  @Override
  public void initializeSequence(Connection conn, String sequenceTable, String eventTable, long buildId) {
    String sql = "INSERT INTO " + sequenceTable + " (build_id, next_sequence) " +
        "SELECT CAST(? AS BIGINT), COALESCE(MAX(sequence_id), 0) + 1 FROM " + eventTable +
        " WHERE build_id = ? ON CONFLICT (build_id) DO NOTHING";
    JdbcTemplate.update(conn, sql, buildId, buildId);
  }

  @Override
  public long nextSequence(Connection conn, String sequenceTable, long buildId) {
    String sql = "UPDATE " + sequenceTable + " SET next_sequence = next_sequence + 1 " +
        "WHERE build_id = ? RETURNING next_sequence - 1";
    List<Long> taken = JdbcTemplate.updateReturning(conn, sql, rs -> rs.getLong(1), buildId);
    return taken.isEmpty() ? -1L : taken.get(0);
  }

  @Override
  public boolean supportsAdvisoryLocks() {
    return true;
  }

  @Override
  public boolean tryAdvisoryLock(Connection conn, LockId id) {
    return booleans(conn, "SELECT pg_try_advisory_lock(?, ?)", id.namespace(), id.key()).get(0);
  }

  @Override
  public boolean advisoryUnlock(Connection conn, LockId id) {
    return booleans(conn, "SELECT pg_advisory_unlock(?, ?)", id.namespace(), id.key()).get(0);
  }

  @Override
  public void advisoryUnlockAll(Connection conn) {
    JdbcTemplate.query(conn, "SELECT pg_advisory_unlock_all()", rs -> Boolean.TRUE);
  }

  @Override
  public boolean supportsNotifications() {
    return true;
  }

  @Override
  public void notify(Connection conn, String channel, String payload) {
    JdbcTemplate.query(conn, "SELECT pg_notify(?, ?)", rs -> Boolean.TRUE, channel, payload == null ? "" : payload);
  }
}
