/**
 * Database-backed coordination for a horizontally scaled build service.
 *
 * <p>Every replica of the service talks to one shared database, and the database is the
 * only coordination medium: no extra broker, no consensus service.
 *
 * <h2>Core Design</h2>
 * <p>{@linkplain turnstile.lock.LockCoordinator Locks} are session-scoped advisory locks
 * keyed by a {@linkplain turnstile.lock.LockId two-part id}. A process never takes the
 * same lock twice: the coordinator's in-process registry turns a second attempt into a
 * plain "not acquired". {@linkplain turnstile.lock.Lease Leases} add a time window on top
 * of a lock, so a periodic task runs at most once per interval across all replicas.
 *
 * <p>Change notifications travel on one database listening stream per process. The
 * {@linkplain turnstile.bus.NotificationBus bus} fans each one out to single-slot
 * {@linkplain turnstile.bus.Sink sinks}; bursts coalesce, and a lost stream wakes every
 * waiter so it rechecks state. A notification carries no state of its own.
 *
 * <p>The {@linkplain turnstile.events.BuildEventLog build event log} appends gaplessly
 * numbered events per build and lets any number of readers follow a build live until it
 * finishes.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>turnstile-core</b> - locks, leases, notification bus, event log, pagination,
 *       in-memory lock server and hub</li>
 *   <li><b>turnstile-jdbc</b> - {@linkplain turnstile.jdbc JDBC stores}, dialects
 *       (PostgreSQL, H2), LISTEN/NOTIFY transport, keyset queries</li>
 *   <li><b>turnstile-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>turnstile-spring-boot-starter</b> - auto-configuration</li>
 * </ul>
 *
 * <h2>Wiring</h2>
 * <pre>{@code
 * var dialect = Dialects.detect(dataSource);
 * var connections = new DataSourceConnectionProvider(dataSource);
 *
 * var coordinator = LockCoordinator.builder()
 *     .lockDatabase(new JdbcLockDatabase(connections, dialect))
 *     .connectionProvider(connections)
 *     .leaseStore(new JdbcLeaseStore(dialect))
 *     .build();
 *
 * var bus = NotificationBus.builder()
 *     .listener(new PostgresNotificationListener(connections,
 *         new ExponentialBackoffRetryPolicy(200, 10_000)))
 *     .publisher(new JdbcNotificationPublisher(connections, dialect))
 *     .build();
 * bus.start();
 *
 * var eventLog = BuildEventLog.builder()
 *     .connectionProvider(connections)
 *     .eventStore(new JdbcBuildEventStore(dialect))
 *     .bus(bus)
 *     .build();
 *
 * coordinator.acquireSchedulingLock(42, Duration.ofSeconds(10)).ifPresent(lease -> {
 *   // schedule pipeline 42
 * });
 * }</pre>
 *
 * @see turnstile.lock.LockCoordinator
 * @see turnstile.bus.NotificationBus
 * @see turnstile.events.BuildEventLog
 */
package turnstile;
