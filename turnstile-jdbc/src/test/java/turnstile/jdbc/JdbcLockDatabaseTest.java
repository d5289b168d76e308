package turnstile.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import turnstile.StoreException;
import turnstile.jdbc.spi.Dialect;
import turnstile.lock.LockId;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLockDatabaseTest {

  private final Logger lockLogger = Logger.getLogger(JdbcLockDatabase.class.getName());
  private final List<LogRecord> records = new CopyOnWriteArrayList<>();
  private final Handler capture = new Handler() {
    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
  };

  private final AtomicBoolean databaseDown = new AtomicBoolean();
  private final AtomicInteger sessionsOpened = new AtomicInteger();
  private JdbcLockDatabase locks;

  @BeforeEach
  void setUp() {
    lockLogger.addHandler(capture);
    locks = new JdbcLockDatabase(this::openSession, scriptedDialect());
  }

  @AfterEach
  void tearDown() {
    lockLogger.removeHandler(capture);
    locks.close();
  }

  @Test
  void lostSessionNamesTheLocksItHeld() {
    assertTrue(locks.tryAcquire(LockId.task("gc")));
    assertTrue(locks.tryAcquire(LockId.buildTracking(12)));
    assertTrue(locks.release(LockId.buildTracking(12)));

    databaseDown.set(true);
    assertThrows(StoreException.class, () -> locks.tryAcquire(LockId.task("reaper")));

    LogRecord lost = records.stream()
        .filter(r -> r.getLevel() == Level.SEVERE)
        .findFirst()
        .orElseThrow(() -> new AssertionError("no SEVERE record in " + records));
    assertTrue(lost.getMessage().contains(LockId.task("gc").toString()), lost.getMessage());
    assertFalse(lost.getMessage().contains(LockId.buildTracking(12).toString()), lost.getMessage());
  }

  @Test
  void nextCallOpensAFreshSessionWithNothingHeld() {
    assertTrue(locks.tryAcquire(LockId.task("gc")));
    databaseDown.set(true);
    assertThrows(StoreException.class, () -> locks.tryAcquire(LockId.task("reaper")));
    databaseDown.set(false);

    assertTrue(locks.tryAcquire(LockId.task("reaper")));
    databaseDown.set(true);
    assertThrows(StoreException.class, () -> locks.release(LockId.task("reaper")));

    List<LogRecord> severe = records.stream().filter(r -> r.getLevel() == Level.SEVERE).toList();
    assertEquals(2, sessionsOpened.get());
    assertEquals(2, severe.size());
    assertFalse(severe.get(1).getMessage().contains(LockId.task("gc").toString()));
    assertTrue(severe.get(1).getMessage().contains(LockId.task("reaper").toString()));
  }

  @Test
  void lostSessionWithoutLocksIsOnlyAWarning() {
    assertTrue(locks.tryAcquire(LockId.task("gc")));
    assertTrue(locks.release(LockId.task("gc")));

    databaseDown.set(true);
    assertThrows(StoreException.class, () -> locks.tryAcquire(LockId.task("gc")));

    assertTrue(records.stream().noneMatch(r -> r.getLevel() == Level.SEVERE));
    assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING));
  }

  private Connection openSession() {
    sessionsOpened.incrementAndGet();
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> switch (method.getName()) {
          case "isValid" -> !databaseDown.get();
          case "isClosed" -> false;
          default -> null;
        });
  }

  private Dialect scriptedDialect() {
    return (Dialect) Proxy.newProxyInstance(
        Dialect.class.getClassLoader(),
        new Class<?>[]{Dialect.class},
        (proxy, method, args) -> switch (method.getName()) {
          case "name" -> "scripted";
          case "supportsAdvisoryLocks" -> true;
          case "tryAdvisoryLock", "advisoryUnlock" -> {
            if (databaseDown.get()) {
              throw new StoreException("connection reset");
            }
            yield true;
          }
          default -> null;
        });
  }
}
