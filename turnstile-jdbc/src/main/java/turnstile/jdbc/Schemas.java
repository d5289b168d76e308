package turnstile.jdbc;

import turnstile.StoreException;
import turnstile.jdbc.spi.Dialect;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Creates the lease, event and sequence tables from the bundled {@code /schema/<dialect>.sql}
 * scripts. Every statement is {@code CREATE TABLE IF NOT EXISTS}, so running it twice is safe.
 */
public final class Schemas {

  private Schemas() {}

  /**
   * Creates the tables under their default names.
   */
  public static void create(Connection conn, Dialect dialect) {
    create(conn, dialect, TableNames.DEFAULT_LEASE_TABLE, TableNames.DEFAULT_EVENT_TABLE,
        TableNames.DEFAULT_SEQUENCE_TABLE);
  }

  /**
   * Creates the tables under custom names.
   */
  public static void create(Connection conn, Dialect dialect, String leaseTable, String eventTable,
      String sequenceTable) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(dialect, "dialect");
    String script = load(dialect.name())
        .replace(TableNames.DEFAULT_LEASE_TABLE, TableNames.validate(leaseTable))
        .replace(TableNames.DEFAULT_EVENT_TABLE, TableNames.validate(eventTable))
        .replace(TableNames.DEFAULT_SEQUENCE_TABLE, TableNames.validate(sequenceTable));
    try (Statement statement = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          statement.execute(sql.trim());
        }
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to create " + dialect.name() + " schema", e);
    }
  }

  private static String load(String dialectName) {
    String resource = "/schema/" + dialectName + ".sql";
    try (InputStream in = Schemas.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No bundled schema for dialect: " + dialectName);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
  }
}
