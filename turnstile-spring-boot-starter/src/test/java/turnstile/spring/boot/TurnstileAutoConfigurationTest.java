package turnstile.spring.boot;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import turnstile.bus.NotificationBus;
import turnstile.events.BuildEvent;
import turnstile.events.BuildEventLog;
import turnstile.events.BuildStatus;
import turnstile.jdbc.DataSourceConnectionProvider;
import turnstile.jdbc.JdbcBuildEventStore;
import turnstile.jdbc.JdbcLeaseStore;
import turnstile.jdbc.JdbcLockDatabase;
import turnstile.jdbc.RetryingConnectionProvider;
import turnstile.jdbc.dialect.H2Dialect;
import turnstile.jdbc.spi.Dialect;
import turnstile.lock.Lock;
import turnstile.lock.LockCoordinator;
import turnstile.spi.BuildEventStore;
import turnstile.spi.ConnectionProvider;
import turnstile.spi.LeaseStore;
import turnstile.spi.LockDatabase;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TurnstileAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(TurnstileAutoConfiguration.class))
      .withUserConfiguration(H2Config.class)
      .withPropertyValues("turnstile.initialize-schema=true");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("turnstileDialect"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("lockDatabase"));
      assertTrue(ctx.containsBean("lockCoordinator"));
      assertTrue(ctx.containsBean("notificationBus"));
      assertTrue(ctx.containsBean("buildEventLog"));

      assertInstanceOf(H2Dialect.class, ctx.getBean(Dialect.class));
      assertInstanceOf(RetryingConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcLeaseStore.class, ctx.getBean(LeaseStore.class));
      assertInstanceOf(JdbcBuildEventStore.class, ctx.getBean(BuildEventStore.class));
      assertFalse(ctx.getBean(LockDatabase.class) instanceof JdbcLockDatabase);
      assertFalse(ctx.getBean(NotificationBus.class).isClosed());
    });
  }

  @Test
  void connectionRetryCanBeDisabled() {
    runner.withPropertyValues("turnstile.connection-retry.enabled=false").run(ctx ->
        assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class)));
  }

  @Test
  void locksAndLeasesWorkOnH2() {
    runner.run(ctx -> {
      LockCoordinator coordinator = ctx.getBean(LockCoordinator.class);

      Optional<Lock> tracking = coordinator.acquireTrackingLock(7L);
      assertTrue(tracking.isPresent());
      assertTrue(coordinator.acquireTrackingLock(7L).isEmpty());
      tracking.get().release();
      assertTrue(coordinator.acquireTrackingLock(7L).isPresent());

      assertTrue(coordinator.acquireSchedulingLock(3, Duration.ofMinutes(1)).isPresent());
    });
  }

  @Test
  void eventLogRoundTripOnH2() {
    runner.run(ctx -> {
      BuildEventLog log = ctx.getBean(BuildEventLog.class);
      log.start(42L);
      log.finish(42L, BuildStatus.SUCCEEDED);

      List<BuildEvent> events = log.events(42L, 1, 10);
      assertEquals(2, events.size());
      assertEquals(1L, events.get(0).sequence());
      assertEquals(2L, events.get(1).sequence());
    });
  }

  @Test
  void customTableNames() {
    runner
        .withPropertyValues("turnstile.tables.event=ci_events",
            "turnstile.tables.sequence=ci_sequences",
            "turnstile.tables.lease=ci_leases")
        .run(ctx -> {
          BuildEventLog log = ctx.getBean(BuildEventLog.class);
          log.start(1L);
          assertEquals(1, log.events(1L, 1, 10).size());

          DataSource ds = ctx.getBean(DataSource.class);
          try (var conn = ds.getConnection();
               var rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM ci_events")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
          }
        });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(TurnstileAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("lockCoordinator"));
          assertFalse(ctx.containsBean("buildEventLog"));
        });
  }

  @Test
  void invalidTableNameFailsStartup() {
    runner.withPropertyValues("turnstile.tables.event=bad-name").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class H2Config {
    @Bean
    DataSource dataSource() {
      JdbcDataSource ds = new JdbcDataSource();
      ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
      return ds;
    }
  }
}
