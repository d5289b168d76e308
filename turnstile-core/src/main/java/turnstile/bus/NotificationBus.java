package turnstile.bus;

import turnstile.spi.MetricsExporter;
import turnstile.spi.NotificationListener;
import turnstile.spi.NotificationPublisher;
import turnstile.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Multiplexes one database notification stream into many in-process subscriptions.
 *
 * <p>The first {@link #listen(String)} on a channel subscribes the underlying
 * {@link NotificationListener}; the last {@link #unlisten(String, Sink)} unsubscribes it.
 * One dispatch thread receives notifications and offers a wake to every sink of the
 * channel. Offers never block: a sink with a pending wake is skipped. The dispatch thread
 * never queries the database; waiters recheck state on their own threads.
 *
 * <p>When the stream reports a disconnect, every sink on every channel is woken, since
 * notifications may have been lost.
 *
 * <p>Fan-out and {@link #unlisten} are serialized: once {@code unlisten} returns, no
 * further wake reaches that sink. A wake deposited before that stays in the sink.
 *
 * <p>Create via {@link #builder()}, then call {@link #start()}. This class is thread-safe.
 *
 * @see ConditionNotifier
 * @see Channels
 */
public final class NotificationBus implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(NotificationBus.class.getName());

    private final NotificationListener listener;
    private final NotificationPublisher publisher;
    private final MetricsExporter metrics;
    private final Duration receiveTimeout;

    private final Object subscriptionLock = new Object();
    private final Map<String, Set<Sink>> subscriptions = new HashMap<>();
    private int sinkCount;

    private ExecutorService dispatcher;
    private volatile boolean closed;

    private NotificationBus(Builder builder) {
        this.listener = Objects.requireNonNull(builder.listener, "listener");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        Duration receiveTimeout = builder.receiveTimeout != null ? builder.receiveTimeout : Duration.ofSeconds(1);
        if (receiveTimeout.isNegative() || receiveTimeout.isZero()) {
            throw new IllegalArgumentException("receiveTimeout must be positive");
        }
        this.receiveTimeout = receiveTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the dispatch thread. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        ensureOpen();
        if (dispatcher != null) {
            return;
        }
        dispatcher = Executors.newSingleThreadExecutor(new DaemonThreadFactory("turnstile-notifications-"));
        dispatcher.execute(this::dispatchLoop);
    }

    /**
     * Registers a new sink for {@code channel}, subscribing the stream on first use.
     *
     * @throws turnstile.StoreException if the underlying subscribe fails; nothing is registered
     */
    public Sink listen(String channel) {
        Objects.requireNonNull(channel, "channel");
        ensureOpen();
        Sink sink = new Sink(channel);
        synchronized (subscriptionLock) {
            Set<Sink> sinks = subscriptions.get(channel);
            if (sinks == null) {
                listener.listen(channel);
                sinks = new LinkedHashSet<>();
                subscriptions.put(channel, sinks);
            }
            sinks.add(sink);
            sinkCount++;
            metrics.recordActiveSubscriptions(sinkCount);
        }
        return sink;
    }

    /**
     * Deregisters {@code sink}, unsubscribing the stream when it was the last one.
     * Unknown sinks are ignored.
     */
    public void unlisten(String channel, Sink sink) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(sink, "sink");
        synchronized (subscriptionLock) {
            Set<Sink> sinks = subscriptions.get(channel);
            if (sinks == null || !sinks.remove(sink)) {
                return;
            }
            sinkCount--;
            metrics.recordActiveSubscriptions(sinkCount);
            if (sinks.isEmpty()) {
                subscriptions.remove(channel);
                if (!closed) {
                    listener.unlisten(channel);
                }
            }
        }
    }

    /**
     * Asks the database to broadcast on {@code channel}. Local sinks are woken
     * asynchronously when the notification comes back through the stream.
     */
    public void notify(String channel) {
        notify(channel, "");
    }

    /**
     * Asks the database to broadcast {@code payload} on {@code channel}.
     */
    public void notify(String channel, String payload) {
        Objects.requireNonNull(channel, "channel");
        publisher.publish(channel, payload);
    }

    /**
     * Number of distinct channels with at least one sink.
     */
    public int channelCount() {
        synchronized (subscriptionLock) {
            return subscriptions.size();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void dispatchLoop() {
        while (!closed) {
            try {
                Optional<Notification> received = listener.receive(receiveTimeout);
                received.ifPresent(this::dispatch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                if (closed) {
                    return;
                }
                logger.log(Level.SEVERE, "Notification stream failed; waking all subscribers", e);
                dispatch(Notification.disconnected());
                try {
                    Thread.sleep(receiveTimeout.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    void dispatch(Notification notification) {
        synchronized (subscriptionLock) {
            if (notification.healthy()) {
                Set<Sink> sinks = subscriptions.get(notification.channel());
                if (sinks != null) {
                    offerAll(sinks, notification);
                }
            } else {
                for (Set<Sink> sinks : subscriptions.values()) {
                    offerAll(sinks, notification);
                }
            }
        }
    }

    private void offerAll(Set<Sink> sinks, Notification notification) {
        for (Sink sink : sinks) {
            if (sink.offer(notification)) {
                metrics.incrementNotificationDispatched();
            } else {
                metrics.incrementNotificationCoalesced();
            }
        }
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("NotificationBus has been closed");
        }
    }

    /**
     * Stops the dispatch thread, wakes every remaining sink so blocked waiters can observe
     * the shutdown, and closes the listener.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (dispatcher != null) {
            dispatcher.shutdownNow();
            try {
                dispatcher.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        List<Sink> remaining = new ArrayList<>();
        synchronized (subscriptionLock) {
            subscriptions.values().forEach(remaining::addAll);
        }
        for (Sink sink : remaining) {
            sink.offer(Notification.disconnected());
        }
        listener.close();
    }

    /**
     * Builder for {@link NotificationBus}.
     */
    public static final class Builder {
        private NotificationListener listener;
        private NotificationPublisher publisher;
        private MetricsExporter metrics;
        private Duration receiveTimeout;

        private Builder() {
        }

        /**
         * Sets the notification stream. The bus takes ownership and closes it.
         *
         * <p><b>Required.</b>
         *
         * @param listener the notification stream
         * @return this builder
         */
        public Builder listener(NotificationListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Sets the publisher used by {@link NotificationBus#notify(String)}.
         *
         * <p><b>Required.</b>
         *
         * @param publisher the publisher
         * @return this builder
         */
        public Builder publisher(NotificationPublisher publisher) {
            this.publisher = publisher;
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
         * Sets how long one receive call on the stream may block. Bounds how quickly
         * {@link NotificationBus#close()} takes effect.
         *
         * <p>Optional. Defaults to 1 second. Must be positive.
         *
         * @param receiveTimeout receive timeout
         * @return this builder
         */
        public Builder receiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = receiveTimeout;
            return this;
        }

        /**
         * Builds the bus. Call {@link NotificationBus#start()} to begin dispatching.
         *
         * @return a new {@link NotificationBus}
         * @throws NullPointerException     if {@code listener} or {@code publisher} is null
         * @throws IllegalArgumentException if {@code receiveTimeout} is not positive
         */
        public NotificationBus build() {
            return new NotificationBus(this);
        }
    }
}
