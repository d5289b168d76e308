package turnstile.spring.boot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import turnstile.StoreException;
import turnstile.bus.NotificationBus;
import turnstile.events.BuildEventLog;
import turnstile.events.EventCodec;
import turnstile.jdbc.DataSourceConnectionProvider;
import turnstile.jdbc.JdbcBuildEventStore;
import turnstile.jdbc.JdbcLeaseStore;
import turnstile.jdbc.JdbcLockDatabase;
import turnstile.jdbc.RetryingConnectionProvider;
import turnstile.jdbc.Schemas;
import turnstile.jdbc.dialect.Dialects;
import turnstile.jdbc.notify.JdbcNotificationPublisher;
import turnstile.jdbc.notify.PostgresNotificationListener;
import turnstile.jdbc.spi.Dialect;
import turnstile.lock.LockCoordinator;
import turnstile.memory.InMemoryLockServer;
import turnstile.memory.InMemoryNotificationHub;
import turnstile.retry.ExponentialBackoffRetryPolicy;
import turnstile.spi.BuildEventStore;
import turnstile.spi.ConnectionProvider;
import turnstile.spi.LeaseStore;
import turnstile.spi.LockDatabase;
import turnstile.spi.MetricsExporter;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Auto-configuration for turnstile.
 *
 * <p>Wires a {@link LockCoordinator}, a started {@link NotificationBus} and a
 * {@link BuildEventLog} from a {@link DataSource} and {@link TurnstileProperties}.
 * On PostgreSQL, locks are advisory locks and notifications use LISTEN/NOTIFY. On
 * databases without those features, an in-process lock server and notification hub are
 * used instead, which coordinate only within this JVM.
 *
 * @see TurnstileProperties
 * @see TurnstileMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(LockCoordinator.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TurnstileProperties.class)
public class TurnstileAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(TurnstileAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Dialect turnstileDialect(DataSource dataSource) {
    Dialect dialect = Dialects.detect(dataSource);
    log.info("Using turnstile dialect '{}'", dialect.name());
    return dialect;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider connectionProvider(DataSource dataSource, TurnstileProperties props) {
    ConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
    TurnstileProperties.ConnectionRetry retry = props.getConnectionRetry();
    if (!retry.isEnabled()) {
      return provider;
    }
    return new RetryingConnectionProvider(provider,
        new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs()),
        retry.getMaxAttempts());
  }

  @Bean
  @ConditionalOnMissingBean
  public TurnstileSchemaInitializer turnstileSchemaInitializer(ConnectionProvider connectionProvider,
      Dialect dialect, TurnstileProperties props) {
    return new TurnstileSchemaInitializer(connectionProvider, dialect, props);
  }

  @Bean
  @ConditionalOnMissingBean
  public LeaseStore leaseStore(Dialect dialect, TurnstileProperties props,
      TurnstileSchemaInitializer schema) {
    return new JdbcLeaseStore(dialect, props.getTables().getLease());
  }

  @Bean
  @ConditionalOnMissingBean
  public BuildEventStore buildEventStore(Dialect dialect, TurnstileProperties props,
      TurnstileSchemaInitializer schema) {
    return new JdbcBuildEventStore(dialect, props.getTables().getEvent(), props.getTables().getSequence());
  }

  // Owned and closed by the LockCoordinator.
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public LockDatabase lockDatabase(ConnectionProvider connectionProvider, Dialect dialect) {
    if (dialect.supportsAdvisoryLocks()) {
      return new JdbcLockDatabase(connectionProvider, dialect);
    }
    log.warn("Dialect '{}' has no advisory locks; locks coordinate within this JVM only", dialect.name());
    return new InMemoryLockServer().openSession();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public LockCoordinator lockCoordinator(LockDatabase lockDatabase,
      ConnectionProvider connectionProvider,
      LeaseStore leaseStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = LockCoordinator.builder()
        .lockDatabase(lockDatabase)
        .connectionProvider(connectionProvider)
        .leaseStore(leaseStore);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public NotificationBus notificationBus(ConnectionProvider connectionProvider,
      Dialect dialect,
      TurnstileProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    TurnstileProperties.Bus busProps = props.getBus();
    var builder = NotificationBus.builder().receiveTimeout(busProps.getReceiveTimeout());
    if (dialect.supportsNotifications()) {
      builder.listener(new PostgresNotificationListener(connectionProvider,
              new ExponentialBackoffRetryPolicy(busProps.getReconnectBaseDelayMs(), busProps.getReconnectMaxDelayMs())))
          .publisher(new JdbcNotificationPublisher(connectionProvider, dialect));
    } else {
      log.warn("Dialect '{}' has no notifications; notifications reach this JVM only", dialect.name());
      InMemoryNotificationHub hub = new InMemoryNotificationHub();
      builder.listener(hub.openListener()).publisher(hub);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    NotificationBus bus = builder.build();
    bus.start();
    return bus;
  }

  @Bean
  @ConditionalOnMissingBean
  public BuildEventLog buildEventLog(ConnectionProvider connectionProvider,
      BuildEventStore buildEventStore,
      NotificationBus notificationBus,
      TurnstileProperties props,
      ObjectProvider<EventCodec> codecProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = BuildEventLog.builder()
        .connectionProvider(connectionProvider)
        .eventStore(buildEventStore)
        .bus(notificationBus)
        .batchSize(props.getEventLog().getBatchSize());
    EventCodec codec = codecProvider.getIfAvailable();
    if (codec != null) {
      builder.codec(codec);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  /**
   * Creates the turnstile tables when {@code turnstile.initialize-schema} is set.
   */
  public static class TurnstileSchemaInitializer {

    TurnstileSchemaInitializer(ConnectionProvider connectionProvider, Dialect dialect,
        TurnstileProperties props) {
      if (!props.isInitializeSchema()) {
        return;
      }
      TurnstileProperties.Tables tables = props.getTables();
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        Schemas.create(conn, dialect, tables.getLease(), tables.getEvent(), tables.getSequence());
      } catch (SQLException e) {
        throw new StoreException("Failed to initialize turnstile schema", e);
      }
      log.info("Initialized turnstile schema ({}, {}, {})",
          tables.getLease(), tables.getEvent(), tables.getSequence());
    }
  }
}
