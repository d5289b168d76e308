package turnstile.events;

import turnstile.bus.Channels;
import turnstile.bus.NotificationBus;
import turnstile.bus.Sink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads one build's events in sequence order, replaying stored rows and then following
 * live appends.
 *
 * <p>The cursor subscribes to the build's events channel before its first query, so an
 * append committed after that query always produces a wake. When caught up it blocks on
 * the wake, re-queries past the last delivered sequence and continues. The stream ends
 * after the terminal status event has been returned, or when the build has already
 * finished and nothing at or past the starting sequence is left.
 *
 * <p>Cursors are independent of each other. One cursor is meant for one reading thread;
 * to stop a reader blocked in {@link #next()}, interrupt it.
 */
public final class EventCursor implements AutoCloseable {

    private final BuildEventLog log;
    private final NotificationBus bus;
    private final long buildId;
    private final String channel;
    private final Sink sink;
    private final Deque<BuildEvent> buffer = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private long nextSequence;

    EventCursor(BuildEventLog log, NotificationBus bus, long buildId, long fromSequence) {
        this.log = log;
        this.bus = bus;
        this.buildId = buildId;
        this.channel = Channels.buildEvents(buildId);
        this.nextSequence = fromSequence;
        this.sink = bus.listen(channel);
    }

    /**
     * Returns the next event, blocking until one is appended.
     *
     * @return the next event, or empty once the stream has ended or the cursor was closed
     * @throws InterruptedException  if the reading thread is interrupted while waiting
     * @throws IllegalStateException if the notification bus is closed while waiting
     */
    public synchronized Optional<BuildEvent> next() throws InterruptedException {
        while (!closed.get()) {
            BuildEvent event = buffer.poll();
            if (event != null) {
                nextSequence = event.sequence() + 1;
                if (log.isTerminal(event)) {
                    close();
                }
                return Optional.of(event);
            }

            if (refill()) {
                continue;
            }
            // Finishing writes the terminal event and drops the counter in one transaction,
            // so once the build reads as finished a second query sees everything.
            if (log.isFinished(buildId) && !refill()) {
                close();
                return Optional.empty();
            }
            if (!buffer.isEmpty()) {
                continue;
            }

            sink.await();
            if (bus.isClosed()) {
                throw new IllegalStateException("NotificationBus has been closed");
            }
        }
        return Optional.empty();
    }

    /**
     * Sequence number the next returned event will have at least.
     */
    public synchronized long position() {
        return nextSequence;
    }

    public long buildId() {
        return buildId;
    }

    /**
     * Unsubscribes. Subsequent {@link #next()} calls return empty.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unlisten(channel, sink);
        }
    }

    private boolean refill() {
        List<BuildEvent> batch = log.fetch(buildId, nextSequence);
        buffer.addAll(batch);
        return !batch.isEmpty();
    }
}
