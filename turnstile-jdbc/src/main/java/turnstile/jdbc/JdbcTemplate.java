package turnstile.jdbc;

import turnstile.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Statement helpers shared by the stores, dialects and {@link turnstile.jdbc.page.KeysetQuery}.
 *
 * <p>Statements run on the caller's connection and never touch its transaction state.
 * A {@link SQLException} is rethrown as a {@link StoreException} that names the failing
 * statement and keeps the driver exception as its cause.
 */
public final class JdbcTemplate {

  /**
   * Maps the current row of a result set.
   */
  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private JdbcTemplate() {}

  /**
   * Runs an INSERT, UPDATE or DELETE.
   *
   * @return number of rows affected
   */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw failure(sql, e);
    }
  }

  /**
   * Runs a SELECT and maps every row.
   */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return rows(conn, sql, mapper, params);
  }

  /**
   * Runs a SELECT that must produce exactly one row, such as an aggregate.
   *
   * @throws StoreException if zero or several rows come back
   */
  public static <T> T queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = rows(conn, sql, mapper, params);
    if (rows.size() != 1) {
      throw new StoreException("Expected one row but got " + rows.size() + " from: " + sql);
    }
    return rows.get(0);
  }

  /**
   * Runs a data-changing statement with a {@code RETURNING} clause and maps the returned rows.
   */
  public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return rows(conn, sql, mapper, params);
  }

  private static <T> List<T> rows(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    } catch (SQLException e) {
      throw failure(sql, e);
    }
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param instanceof Long n) {
      ps.setLong(index, n);
    } else if (param instanceof Integer n) {
      ps.setInt(index, n);
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else if (param instanceof Timestamp ts) {
      ps.setTimestamp(index, ts);
    } else if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else {
      ps.setObject(index, param);
    }
  }

  private static StoreException failure(String sql, SQLException e) {
    String verb = sql.stripLeading();
    int space = verb.indexOf(' ');
    if (space > 0) {
      verb = verb.substring(0, space);
    }
    return new StoreException("Failed to execute " + verb + " statement (SQLState " + e.getSQLState() + ")", e);
  }
}
