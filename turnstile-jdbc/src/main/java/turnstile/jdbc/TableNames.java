package turnstile.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation for the JDBC stores.
 *
 * <p>Table names are concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_LEASE_TABLE = "turnstile_leases";
  public static final String DEFAULT_EVENT_TABLE = "turnstile_build_events";
  public static final String DEFAULT_SEQUENCE_TABLE = "turnstile_event_sequences";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
