package turnstile.jdbc;

import turnstile.retry.RetryPolicy;
import turnstile.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionProvider} that retries connection establishment when the server is
 * temporarily refusing connections.
 *
 * <p>Only SQLSTATE {@code 53300} (too many connections) and {@code 57P03} (cannot connect
 * now, e.g. during startup or recovery) are retried, up to {@code maxAttempts} in total,
 * waiting {@link RetryPolicy#computeDelayMs(int)} between attempts. Any other failure, and
 * the last transient one, is rethrown unchanged.
 */
public final class RetryingConnectionProvider implements ConnectionProvider {
  private static final Logger logger = Logger.getLogger(RetryingConnectionProvider.class.getName());

  static final Set<String> RETRYABLE_SQL_STATES = Set.of("53300", "57P03");

  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final ConnectionProvider delegate;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Sleeper sleeper;

  /**
   * @param delegate    provider that actually opens connections
   * @param retryPolicy delay between attempts
   * @param maxAttempts total attempts including the first; must be &gt; 0
   */
  public RetryingConnectionProvider(ConnectionProvider delegate, RetryPolicy retryPolicy, int maxAttempts) {
    this(delegate, retryPolicy, maxAttempts, Thread::sleep);
  }

  RetryingConnectionProvider(ConnectionProvider delegate, RetryPolicy retryPolicy, int maxAttempts,
      Sleeper sleeper) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    this.maxAttempts = maxAttempts;
  }

  @Override
  public Connection getConnection() throws SQLException {
    for (int attempt = 1; ; attempt++) {
      try {
        return delegate.getConnection();
      } catch (SQLException e) {
        if (!isRetryable(e) || attempt >= maxAttempts) {
          throw e;
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.WARNING, "Database refused connection (SQLState " + e.getSQLState()
            + "), attempt " + attempt + " of " + maxAttempts + "; retrying in " + delayMs + " ms");
        try {
          sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
      }
    }
  }

  /**
   * Whether {@code e}, or any exception it chains to, carries a retryable SQLSTATE.
   */
  static boolean isRetryable(SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql) {
        for (SQLException next = sql; next != null; next = next.getNextException()) {
          if (next.getSQLState() != null && RETRYABLE_SQL_STATES.contains(next.getSQLState())) {
            return true;
          }
        }
      }
    }
    return false;
  }
}
