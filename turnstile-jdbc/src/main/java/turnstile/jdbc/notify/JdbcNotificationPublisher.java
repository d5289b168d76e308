package turnstile.jdbc.notify;

import turnstile.StoreException;
import turnstile.jdbc.spi.Dialect;
import turnstile.spi.ConnectionProvider;
import turnstile.spi.NotificationPublisher;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link NotificationPublisher} that sends each notification on its own autocommit
 * connection, so it is delivered immediately rather than at some caller's commit.
 */
public final class JdbcNotificationPublisher implements NotificationPublisher {

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;

  public JdbcNotificationPublisher(ConnectionProvider connectionProvider, Dialect dialect) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (!dialect.supportsNotifications()) {
      throw new IllegalArgumentException("Dialect " + dialect.name() + " has no notifications");
    }
  }

  @Override
  public void publish(String channel, String payload) {
    Objects.requireNonNull(channel, "channel");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      dialect.notify(conn, channel, payload);
    } catch (SQLException e) {
      throw new StoreException("Failed to publish on " + channel, e);
    }
  }
}
