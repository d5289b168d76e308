package turnstile.jdbc;

import turnstile.StoreException;
import turnstile.jdbc.spi.Dialect;
import turnstile.lock.LockId;
import turnstile.spi.ConnectionProvider;
import turnstile.spi.LockDatabase;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link LockDatabase} holding advisory locks on one dedicated database session.
 *
 * <p>The session connection is opened on first use and kept until {@link #close()}. If a
 * call fails and the connection turns out to be dead, it is discarded and the next call
 * opens a new one; the database has already released every lock the old session held,
 * and the ids that were held are logged at {@link Level#SEVERE} since other processes may
 * now take them.
 *
 * <p>Use a provider whose connections may stay open indefinitely. With a pool, the
 * session occupies one pooled connection for the life of this object, and
 * {@link #close()} releases all of its locks before handing it back.
 *
 * <p>This class is thread-safe; calls are serialized on the session.
 */
public final class JdbcLockDatabase implements LockDatabase {
  private static final Logger logger = Logger.getLogger(JdbcLockDatabase.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  // Postgres advisory locks stack per session, so each id keeps its acquire count.
  private final Map<LockId, Integer> held = new LinkedHashMap<>();
  private Connection session;
  private boolean closed;

  public JdbcLockDatabase(ConnectionProvider connectionProvider, Dialect dialect) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (!dialect.supportsAdvisoryLocks()) {
      throw new IllegalArgumentException("Dialect " + dialect.name() + " has no advisory locks");
    }
  }

  @Override
  public synchronized boolean tryAcquire(LockId id) {
    boolean acquired = onSession(id, dialect::tryAdvisoryLock);
    if (acquired) {
      held.merge(id, 1, Integer::sum);
    }
    return acquired;
  }

  @Override
  public synchronized boolean release(LockId id) {
    boolean released = onSession(id, dialect::advisoryUnlock);
    if (released) {
      held.computeIfPresent(id, (k, count) -> count > 1 ? count - 1 : null);
    }
    return released;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (session == null) {
      return;
    }
    try {
      dialect.advisoryUnlockAll(session);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to release advisory locks before closing the lock session", e);
    }
    held.clear();
    closeSession();
  }

  private boolean onSession(LockId id, BiFunction<Connection, LockId, Boolean> call) {
    Objects.requireNonNull(id, "id");
    if (closed) {
      throw new IllegalStateException("JdbcLockDatabase has been closed");
    }
    Connection conn = session();
    try {
      return call.apply(conn, id);
    } catch (StoreException e) {
      discardIfDead();
      throw e;
    }
  }

  private Connection session() {
    if (session == null) {
      try {
        Connection conn = connectionProvider.getConnection();
        conn.setAutoCommit(true);
        session = conn;
      } catch (SQLException e) {
        throw new StoreException("Failed to open lock session", e);
      }
    }
    return session;
  }

  private void discardIfDead() {
    boolean alive;
    try {
      alive = session.isValid(2);
    } catch (SQLException e) {
      alive = false;
    }
    if (!alive) {
      if (held.isEmpty()) {
        logger.warning("Lock session is gone; it held no locks");
      } else {
        logger.severe("Lock session is gone; the database released " + held.keySet()
            + " which this process still treats as held, so other processes may take them");
      }
      held.clear();
      closeSession();
    }
  }

  private void closeSession() {
    try {
      session.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close lock session", e);
    } finally {
      session = null;
    }
  }
}
