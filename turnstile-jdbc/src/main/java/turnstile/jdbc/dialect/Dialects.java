package turnstile.jdbc.dialect;

import turnstile.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Looks up {@link Dialect}s by name or by the JDBC URL of a database.
 *
 * <p>Dialects are discovered once through {@link ServiceLoader}; add one by listing it in
 * {@code META-INF/services/turnstile.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);                  // from connection metadata
 * Dialect dialect = Dialects.detect("jdbc:postgresql://db/ci");   // from a URL
 * Dialect dialect = Dialects.get("postgresql");                   // by name
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME = load();

  private Dialects() {}

  private static Map<String, Dialect> load() {
    Map<String, Dialect> dialects = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())) {
      Dialect previous = dialects.putIfAbsent(key(dialect.name()), dialect);
      if (previous != null) {
        throw new IllegalStateException("Dialect name '" + dialect.name() + "' is registered by both "
            + previous.getClass().getName() + " and " + dialect.getClass().getName());
      }
    }
    return Map.copyOf(dialects);
  }

  /**
   * Every registered dialect.
   */
  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * Returns the dialect called {@code name}, ignoring case.
   *
   * @throws IllegalArgumentException if none is registered under that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(key(name));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Picks the dialect for the database behind {@code dataSource}, read from the URL in
   * its connection metadata.
   *
   * @throws IllegalStateException if no connection can be opened
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot open a connection to detect the dialect", e);
    }
  }

  /**
   * Picks the dialect whose URL prefix matches {@code jdbcUrl}.
   *
   * @throws IllegalArgumentException if the URL is blank or no dialect claims it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return BY_NAME.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
            + ". Supported prefixes: " + BY_NAME.values().stream()
            .flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
