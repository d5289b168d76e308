package turnstile.events;

import turnstile.StoreException;
import turnstile.bus.Channels;
import turnstile.bus.ConditionNotifier;
import turnstile.bus.NotificationBus;
import turnstile.spi.BuildEventStore;
import turnstile.spi.ConnectionProvider;
import turnstile.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable, strictly ordered, append-only event log per build, with live tailing.
 *
 * <p>Appends take their sequence numbers from the build's counter row inside the inserting
 * transaction, so numbers are gapless and never reused. After commit the build's
 * {@linkplain Channels#buildEvents(long) events channel} is notified; a reader woken by it
 * is guaranteed to find the new rows. A notification failure is logged and never undoes
 * a committed append.
 *
 * <p>Per build: {@link #start} (or {@link #initialize}), any number of {@link #append}
 * calls, then exactly one {@link #finish} or {@link #markFailed}. Appending after that is
 * rejected with {@link IllegalStateException}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * BuildEventLog log = BuildEventLog.builder()
 *     .connectionProvider(connectionProvider)
 *     .eventStore(new JdbcBuildEventStore(dialect))
 *     .bus(bus)
 *     .build();
 *
 * log.start(buildId);
 * log.append(buildId, new LogEvent("compile", "ok\n", now));
 * log.finish(buildId, BuildStatus.SUCCEEDED);
 *
 * try (EventCursor cursor = log.subscribe(buildId, 0)) {
 *     for (var e = cursor.next(); e.isPresent(); e = cursor.next()) {
 *         render(log.decode(e.get()));
 *     }
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class BuildEventLog {
    private static final Logger logger = Logger.getLogger(BuildEventLog.class.getName());

    private final ConnectionProvider connectionProvider;
    private final BuildEventStore eventStore;
    private final NotificationBus bus;
    private final EventCodec codec;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final int batchSize;

    private BuildEventLog(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
        this.bus = Objects.requireNonNull(builder.bus, "bus");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.codec = builder.codec != null ? builder.codec : new JacksonEventCodec();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates the build's sequence counter. Idempotent while the build is running.
     *
     * @throws IllegalStateException if the build has already finished
     */
    public void initialize(long buildId) {
        inTransaction("Failed to initialize event sequence of build " + buildId, conn -> {
            eventStore.initialize(conn, buildId);
            return null;
        });
    }

    /**
     * Initializes the build and appends a {@code started} status event, then notifies
     * {@link Channels#BUILD_STARTED}.
     *
     * @return the stored status event
     */
    public BuildEvent start(long buildId) {
        initialize(buildId);
        BuildEvent started = append(buildId, new StatusEvent(BuildStatus.STARTED, now()));
        notifySafely(Channels.BUILD_STARTED);
        return started;
    }

    /**
     * Appends one event.
     *
     * @return the stored row
     * @throws EventCodecException   if the event cannot be serialized; nothing is written
     * @throws IllegalStateException if the build is not initialized or already finished
     * @throws StoreException        if the database fails; nothing is written
     */
    public BuildEvent append(long buildId, Event event) {
        return append(buildId, List.of(event)).get(0);
    }

    /**
     * Appends several events in one transaction with consecutive sequence numbers.
     *
     * @return the stored rows, in order
     * @throws EventCodecException   if any event cannot be serialized; nothing is written
     * @throws IllegalStateException if the build is not initialized or already finished
     * @throws StoreException        if the database fails; nothing is written
     */
    public List<BuildEvent> append(long buildId, List<? extends Event> events) {
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return List.of();
        }
        List<Encoded> encoded = encodeAll(events);
        List<BuildEvent> stored = inTransaction("Failed to append events to build " + buildId,
            conn -> insertAll(conn, buildId, encoded));
        metrics.incrementEventsAppended(stored.size());
        notifySafely(Channels.buildEvents(buildId));
        return stored;
    }

    /**
     * Appends the terminal status event and drops the build's counter in one transaction.
     *
     * @return the stored status event
     * @throws IllegalArgumentException if {@code status} is not terminal
     * @throws IllegalStateException    if the build is not initialized or already finished
     */
    public BuildEvent finish(long buildId, BuildStatus status) {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal, got: " + status.value());
        }
        List<Encoded> encoded = encodeAll(List.of(new StatusEvent(status, now())));
        BuildEvent stored = inTransaction("Failed to finish build " + buildId, conn -> {
            BuildEvent event = insertAll(conn, buildId, encoded).get(0);
            eventStore.finalizeSequence(conn, buildId);
            return event;
        });
        metrics.incrementEventsAppended(1);
        metrics.incrementBuildsFinished();
        notifySafely(Channels.buildEvents(buildId));
        return stored;
    }

    /**
     * Appends an {@code error} event describing {@code cause}, then finishes the build as
     * {@link BuildStatus#ERRORED}.
     *
     * @return the stored terminal status event
     */
    public BuildEvent markFailed(long buildId, Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        append(buildId, new ErrorEvent(message, now()));
        return finish(buildId, BuildStatus.ERRORED);
    }

    /**
     * Signals the build's {@linkplain Channels#buildAbort(long) abort channel} so every
     * {@link #abortNotifier} rechecks. Recording the abort request durably is up to the
     * caller and must happen before this call.
     *
     * @throws StoreException if the notification cannot be published
     */
    public void markAborted(long buildId) {
        bus.notify(Channels.buildAbort(buildId));
    }

    /**
     * Opens a notifier that waits until {@code aborted} reports the build as aborted.
     */
    public ConditionNotifier abortNotifier(long buildId, ConditionNotifier.Condition aborted) {
        return ConditionNotifier.open(bus, Channels.buildAbort(buildId), aborted);
    }

    /**
     * Opens a cursor yielding every event with {@code sequence >= fromSequence}, replaying
     * stored rows first and then following live appends until the terminal status.
     */
    public EventCursor subscribe(long buildId, long fromSequence) {
        return new EventCursor(this, bus, buildId, fromSequence);
    }

    /**
     * Reads up to {@code limit} stored events with {@code sequence >= fromSequence}.
     */
    public List<BuildEvent> events(long buildId, long fromSequence, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return eventStore.eventsSince(conn, buildId, fromSequence, limit);
        } catch (SQLException e) {
            throw new StoreException("Failed to read events for build " + buildId, e);
        }
    }

    /**
     * Deletes every stored event and counter of the given builds.
     *
     * @return number of event rows deleted
     */
    public int delete(Collection<Long> buildIds) {
        Objects.requireNonNull(buildIds, "buildIds");
        if (buildIds.isEmpty()) {
            return 0;
        }
        return inTransaction("Failed to delete events of builds " + buildIds,
            conn -> eventStore.delete(conn, buildIds));
    }

    /**
     * Decodes a stored row with the configured codec.
     */
    public Event decode(BuildEvent event) {
        return codec.decode(event);
    }

    List<BuildEvent> fetch(long buildId, long fromSequence) {
        return events(buildId, fromSequence, batchSize);
    }

    boolean isFinished(long buildId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return eventStore.isFinished(conn, buildId);
        } catch (SQLException e) {
            throw new StoreException("Failed to read state of build " + buildId, e);
        }
    }

    boolean isTerminal(BuildEvent event) {
        if (!StatusEvent.TYPE.equals(event.type())) {
            return false;
        }
        return codec.decode(event) instanceof StatusEvent status && status.status().isTerminal();
    }

    private List<Encoded> encodeAll(List<? extends Event> events) {
        List<Encoded> encoded = new ArrayList<>(events.size());
        for (Event event : events) {
            Objects.requireNonNull(event, "event");
            encoded.add(new Encoded(event.type(), event.version(), codec.encode(event)));
        }
        return encoded;
    }

    private List<BuildEvent> insertAll(Connection conn, long buildId, List<Encoded> encoded) {
        List<BuildEvent> stored = new ArrayList<>(encoded.size());
        for (Encoded e : encoded) {
            long sequence = eventStore.nextSequence(conn, buildId);
            BuildEvent event = new BuildEvent(buildId, sequence, e.type(), e.version(), e.payload());
            eventStore.insert(conn, event);
            stored.add(event);
        }
        return stored;
    }

    private <T> T inTransaction(String failureMessage, TransactionWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException(failureMessage, e);
        }
    }

    private void notifySafely(String channel) {
        try {
            bus.notify(channel);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to notify " + channel + "; readers catch up on their next wake", e);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    @FunctionalInterface
    private interface TransactionWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private record Encoded(String type, String version, String payload) {
    }

    /**
     * Builder for {@link BuildEventLog}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private BuildEventStore eventStore;
        private NotificationBus bus;
        private EventCodec codec;
        private MetricsExporter metrics;
        private Clock clock;
        private int batchSize = 100;

        private Builder() {
        }

        /**
         * Sets the connection provider for appends and cursor queries.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the event persistence backend.
         *
         * <p><b>Required.</b>
         *
         * @param eventStore the event store
         * @return this builder
         */
        public Builder eventStore(BuildEventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Sets the notification bus used to wake cursors.
         *
         * <p><b>Required.</b> The bus must be started for cursors to follow live appends.
         *
         * @param bus the notification bus
         * @return this builder
         */
        public Builder bus(NotificationBus bus) {
            this.bus = bus;
            return this;
        }

        /**
         * Sets the payload codec.
         *
         * <p>Optional. Defaults to a new {@link JacksonEventCodec}.
         *
         * @param codec the codec
         * @return this builder
         */
        public Builder codec(EventCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used to timestamp status and error events.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets how many rows a cursor fetches per query.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param batchSize rows per cursor query
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Builds the event log.
         *
         * @return a new {@link BuildEventLog}
         * @throws NullPointerException     if {@code connectionProvider}, {@code eventStore}
         *                                  or {@code bus} is null
         * @throws IllegalArgumentException if {@code batchSize <= 0}
         */
        public BuildEventLog build() {
            return new BuildEventLog(this);
        }
    }
}
