package turnstile.jdbc;

import turnstile.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>Pooled data sources are fine for leases, appends and cursors. Give
 * {@link JdbcLockDatabase} and {@link turnstile.jdbc.notify.PostgresNotificationListener}
 * a provider whose connections they may keep open for a long time.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }
}
