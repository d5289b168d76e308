package turnstile.jdbc;

import turnstile.jdbc.spi.Dialect;
import turnstile.spi.LeaseStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link LeaseStore} over a table of {@code (lease_name, claimed_at)} rows.
 */
public final class JdbcLeaseStore implements LeaseStore {
  private final Dialect dialect;
  private final String table;

  public JdbcLeaseStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_LEASE_TABLE);
  }

  public JdbcLeaseStore(Dialect dialect, String table) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = TableNames.validate(table);
  }

  @Override
  public void ensureExists(Connection conn, String name) {
    dialect.insertLeaseIfAbsent(conn, table, Objects.requireNonNull(name, "name"));
  }

  @Override
  public boolean attemptSign(Connection conn, String name, Instant now, Duration interval) {
    return dialect.signLease(conn, table, name, now, now.minus(interval));
  }

  @Override
  public boolean renew(Connection conn, String name, Instant now) {
    return JdbcTemplate.update(conn, dialect.renewLeaseSql(table), Timestamp.from(now), name) == 1;
  }
}
