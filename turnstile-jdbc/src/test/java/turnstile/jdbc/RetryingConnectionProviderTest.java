package turnstile.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryingConnectionProviderTest {

  private final List<Long> sleeps = new ArrayList<>();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void tooManyConnectionsIsRetried() throws SQLException {
    Connection conn = H2Databases.empty().getConnection();
    ScriptedProvider delegate = new ScriptedProvider(conn,
        new SQLException("too many clients", "53300"),
        new SQLException("too many clients", "53300"));

    RetryingConnectionProvider provider = new RetryingConnectionProvider(
        delegate, attempts -> attempts * 100L, 5, sleeps::add);

    try (Connection result = provider.getConnection()) {
      assertSame(conn, result);
    }
    assertEquals(3, delegate.calls);
    assertEquals(List.of(100L, 200L), sleeps);
  }

  @Test
  void startingUpIsRetried() throws SQLException {
    Connection conn = H2Databases.empty().getConnection();
    ScriptedProvider delegate = new ScriptedProvider(conn,
        new SQLException("the database system is starting up", "57P03"));

    RetryingConnectionProvider provider = new RetryingConnectionProvider(
        delegate, attempts -> 10L, 2, sleeps::add);

    try (Connection result = provider.getConnection()) {
      assertSame(conn, result);
    }
    assertEquals(List.of(10L), sleeps);
  }

  @Test
  void authenticationFailureIsNotRetried() {
    SQLException denied = new SQLException("password authentication failed", "28P01");
    ScriptedProvider delegate = new ScriptedProvider(null, denied);

    RetryingConnectionProvider provider = new RetryingConnectionProvider(
        delegate, attempts -> 10L, 5, sleeps::add);

    assertSame(denied, assertThrows(SQLException.class, provider::getConnection));
    assertEquals(1, delegate.calls);
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void lastTransientFailureIsRethrown() {
    SQLException last = new SQLException("too many clients", "53300");
    ScriptedProvider delegate = new ScriptedProvider(null,
        new SQLException("too many clients", "53300"),
        new SQLException("too many clients", "53300"),
        last);

    RetryingConnectionProvider provider = new RetryingConnectionProvider(
        delegate, attempts -> 1L, 3, sleeps::add);

    assertSame(last, assertThrows(SQLException.class, provider::getConnection));
    assertEquals(3, delegate.calls);
    assertEquals(2, sleeps.size());
  }

  @Test
  void interruptStopsRetrying() {
    SQLException refused = new SQLException("too many clients", "53300");
    ScriptedProvider delegate = new ScriptedProvider(null, refused, refused);

    RetryingConnectionProvider provider = new RetryingConnectionProvider(
        delegate, attempts -> 1L, 5, millis -> {
          throw new InterruptedException();
        });

    SQLException thrown = assertThrows(SQLException.class, provider::getConnection);
    assertSame(refused, thrown);
    assertInstanceOf(InterruptedException.class, thrown.getSuppressed()[0]);
    assertTrue(Thread.currentThread().isInterrupted());
    assertEquals(1, delegate.calls);
  }

  @Test
  void retryableStateIsFoundInChains() {
    SQLException wrapped = new SQLException("connect failed", "08001",
        new SQLException("too many clients", "53300"));
    SQLException chained = new SQLException("connect failed", "08001");
    chained.setNextException(new SQLException("starting up", "57P03"));

    assertTrue(RetryingConnectionProvider.isRetryable(wrapped));
    assertTrue(RetryingConnectionProvider.isRetryable(chained));
    assertFalse(RetryingConnectionProvider.isRetryable(new SQLException("no state")));
    assertFalse(RetryingConnectionProvider.isRetryable(new SQLException("bad password", "28P01")));
  }

  @Test
  void maxAttemptsMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingConnectionProvider(() -> null, attempts -> 1L, 0));
  }

  private static final class ScriptedProvider implements turnstile.spi.ConnectionProvider {
    private final Connection connection;
    private final Deque<SQLException> failures;
    int calls;

    ScriptedProvider(Connection connection, SQLException... failures) {
      this.connection = connection;
      this.failures = new ArrayDeque<>(List.of(failures));
    }

    @Override
    public Connection getConnection() throws SQLException {
      calls++;
      SQLException failure = failures.poll();
      if (failure != null) {
        throw failure;
      }
      return connection;
    }
  }
}
