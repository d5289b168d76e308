package turnstile.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for lease claims, event appends and cursor queries.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see turnstile.jdbc.DataSourceConnectionProvider
 * @see turnstile.jdbc.RetryingConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
