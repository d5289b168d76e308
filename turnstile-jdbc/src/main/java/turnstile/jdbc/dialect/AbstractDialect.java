package turnstile.jdbc.dialect;

import turnstile.StoreException;
import turnstile.jdbc.JdbcTemplate;
import turnstile.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Base dialect with portable SQL.
 *
 * <p>Subclasses override methods where the database offers a single-statement form.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final Timestamp NEVER_CLAIMED = Timestamp.from(Instant.EPOCH);

  private static final String UNIQUE_VIOLATION = "23505";

  @Override
  public void insertLeaseIfAbsent(Connection conn, String table, String name) {
    String sql = "INSERT INTO " + table + " (lease_name, claimed_at) " +
        "SELECT CAST(? AS VARCHAR(255)), CAST(? AS TIMESTAMP WITH TIME ZONE) FROM (SELECT 1 AS seed) s " +
        "WHERE NOT EXISTS (SELECT 1 FROM " + table + " WHERE lease_name = ?)";
    JdbcTemplate.update(conn, sql, name, NEVER_CLAIMED, name);
  }

  @Override
  public boolean signLease(Connection conn, String table, String name, Instant now, Instant cutoff) {
    String sql = "UPDATE " + table + " SET claimed_at = ? WHERE lease_name = ? AND claimed_at <= ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(now), name, Timestamp.from(cutoff)) == 1;
  }

  @Override
  public String renewLeaseSql(String table) {
    return "UPDATE " + table + " SET claimed_at = ? WHERE lease_name = ?";
  }

  @Override
  public void initializeSequence(Connection conn, String sequenceTable, String eventTable, long buildId) {
    long existing = JdbcTemplate.queryOne(conn,
        "SELECT COUNT(*) FROM " + sequenceTable + " WHERE build_id = ?",
        rs -> rs.getLong(1), buildId);
    if (existing > 0) {
      return;
    }
    long highest = JdbcTemplate.queryOne(conn,
        "SELECT COALESCE(MAX(sequence_id), 0) FROM " + eventTable + " WHERE build_id = ?",
        rs -> rs.getLong(1), buildId);
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO " + sequenceTable + " (build_id, next_sequence) VALUES (?, ?)",
          buildId, highest + 1);
    } catch (StoreException e) {
      // A concurrent initializer inserted the counter after our COUNT.
      if (!isUniqueViolation(e)) {
        throw e;
      }
    }
  }

  @Override
  public long nextSequence(Connection conn, String sequenceTable, long buildId) {
    // The UPDATE row-locks the counter until commit, so the SELECT sees this transaction's value.
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + sequenceTable + " SET next_sequence = next_sequence + 1 WHERE build_id = ?",
        buildId);
    if (updated == 0) {
      return -1L;
    }
    return JdbcTemplate.queryOne(conn,
        "SELECT next_sequence - 1 FROM " + sequenceTable + " WHERE build_id = ?",
        rs -> rs.getLong(1), buildId);
  }

  protected static boolean isUniqueViolation(StoreException e) {
    return e.getCause() instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState());
  }

  protected static List<Boolean> booleans(Connection conn, String sql, Object... params) {
    return JdbcTemplate.query(conn, sql, rs -> rs.getBoolean(1), params);
  }
}
