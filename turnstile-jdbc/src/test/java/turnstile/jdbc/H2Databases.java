package turnstile.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import turnstile.jdbc.dialect.Dialects;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases with the bundled schema.
 */
final class H2Databases {

  private H2Databases() {}

  static JdbcDataSource empty() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    return dataSource;
  }

  static JdbcDataSource withSchema() throws SQLException {
    JdbcDataSource dataSource = empty();
    try (Connection conn = dataSource.getConnection()) {
      Schemas.create(conn, Dialects.get("h2"));
    }
    return dataSource;
  }
}
