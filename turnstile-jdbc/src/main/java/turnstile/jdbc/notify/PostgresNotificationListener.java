package turnstile.jdbc.notify;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import turnstile.StoreException;
import turnstile.bus.Notification;
import turnstile.retry.RetryPolicy;
import turnstile.spi.ConnectionProvider;
import turnstile.spi.NotificationListener;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link NotificationListener} backed by PostgreSQL {@code LISTEN}/{@code NOTIFY} on one
 * dedicated connection.
 *
 * <p>When the connection fails, {@link #receive(Duration)} reports
 * {@link Notification#disconnected()} and then reconnects with backoff, re-issuing
 * {@code LISTEN} for every channel. A second disconnect signal follows the reconnect,
 * since notifications published while the connection was down are lost.
 *
 * <p>The connection is polled in short slices so that {@link #listen} and
 * {@link #unlisten} from other threads are not held up for a full receive timeout.
 */
public final class PostgresNotificationListener implements NotificationListener {
  private static final Logger logger = Logger.getLogger(PostgresNotificationListener.class.getName());

  private static final long POLL_SLICE_MS = 250;

  private final ConnectionProvider connectionProvider;
  private final RetryPolicy retryPolicy;
  private final Object connectionLock = new Object();
  private final Set<String> channels = new LinkedHashSet<>();
  private final Deque<Notification> pending = new ArrayDeque<>();
  private Connection connection;
  private boolean lost;
  private int reconnectAttempts;
  private boolean closed;

  /**
   * @param connectionProvider source of the listening connection; it is held open until
   *                           {@link #close()}, so do not hand out a short-lived pooled one
   * @param retryPolicy        delay between reconnect attempts
   */
  public PostgresNotificationListener(ConnectionProvider connectionProvider, RetryPolicy retryPolicy) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public void listen(String channel) {
    Objects.requireNonNull(channel, "channel");
    synchronized (connectionLock) {
      ensureOpen();
      if (!channels.add(channel)) {
        return;
      }
      try {
        if (connection == null) {
          connect();
        } else {
          execute(connection, "LISTEN " + quote(channel));
        }
      } catch (SQLException e) {
        channels.remove(channel);
        throw new StoreException("Failed to LISTEN on " + channel, e);
      }
    }
  }

  @Override
  public void unlisten(String channel) {
    Objects.requireNonNull(channel, "channel");
    synchronized (connectionLock) {
      if (closed || !channels.remove(channel) || connection == null) {
        return;
      }
      try {
        execute(connection, "UNLISTEN " + quote(channel));
      } catch (SQLException e) {
        // the channel is gone from the set; a dead connection is replaced on the next receive
        logger.log(Level.WARNING, "Failed to UNLISTEN on " + channel, e);
      }
    }
  }

  @Override
  public Optional<Notification> receive(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
    long reconnectDelayMs = 0;
    synchronized (connectionLock) {
      ensureOpen();
      Notification next = pending.poll();
      if (next != null) {
        return Optional.of(next);
      }
      if (connection == null && lost) {
        try {
          connect();
          return Optional.ofNullable(pending.poll());
        } catch (SQLException e) {
          reconnectAttempts++;
          reconnectDelayMs = retryPolicy.computeDelayMs(reconnectAttempts);
          logger.log(Level.WARNING, "Failed to reconnect notification listener (attempt "
              + reconnectAttempts + "), retrying in " + reconnectDelayMs + " ms", e);
        }
      }
    }
    if (reconnectDelayMs > 0) {
      long remainingMs = Math.max(0, (deadline - System.nanoTime()) / 1_000_000);
      Thread.sleep(Math.min(reconnectDelayMs, remainingMs));
      return Optional.empty();
    }
    return poll(deadline);
  }

  @Override
  public void close() {
    synchronized (connectionLock) {
      if (closed) {
        return;
      }
      closed = true;
      channels.clear();
      pending.clear();
      discardConnection();
    }
  }

  private Optional<Notification> poll(long deadline) throws InterruptedException {
    while (true) {
      if (Thread.interrupted()) {
        throw new InterruptedException();
      }
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
      synchronized (connectionLock) {
        ensureOpen();
        if (connection != null) {
          int sliceMs = (int) Math.max(1, Math.min(POLL_SLICE_MS, remainingMs));
          try {
            PGNotification[] received = connection.unwrap(PGConnection.class).getNotifications(sliceMs);
            if (received != null) {
              for (PGNotification n : received) {
                pending.add(Notification.of(n.getName(), n.getParameter()));
              }
            }
          } catch (SQLException e) {
            logger.log(Level.WARNING, "Notification connection failed; reporting disconnect", e);
            discardConnection();
            lost = true;
            return Optional.of(Notification.disconnected());
          }
          Notification next = pending.poll();
          if (next != null) {
            return Optional.of(next);
          }
          if (remainingMs <= sliceMs) {
            return Optional.empty();
          }
          continue;
        }
        if (lost || remainingMs <= 0) {
          return Optional.empty();
        }
      }
      // no channel listened yet
      Thread.sleep(Math.min(POLL_SLICE_MS, remainingMs));
    }
  }

  private void connect() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      conn.setAutoCommit(true);
      for (String channel : channels) {
        execute(conn, "LISTEN " + quote(channel));
      }
    } catch (SQLException e) {
      closeQuietly(conn);
      throw e;
    }
    connection = conn;
    reconnectAttempts = 0;
    if (lost) {
      lost = false;
      logger.info("Notification listener reconnected; listening on " + channels.size() + " channel(s)");
      pending.add(Notification.disconnected());
    }
  }

  private void discardConnection() {
    if (connection != null) {
      closeQuietly(connection);
      connection = null;
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("PostgresNotificationListener has been closed");
    }
  }

  private static void execute(Connection conn, String sql) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }

  static String quote(String channel) {
    return "\"" + channel.replace("\"", "\"\"") + "\"";
  }

  private static void closeQuietly(Connection conn) {
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close notification connection", e);
    }
  }
}
