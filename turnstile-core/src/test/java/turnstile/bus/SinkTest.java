package turnstile.bus;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SinkTest {

    @Test
    void holdsAtMostOneWake() {
        Sink sink = new Sink("build_events_1");

        assertTrue(sink.offer(Notification.of("build_events_1", "")));
        assertFalse(sink.offer(Notification.of("build_events_1", "")));
        assertTrue(sink.isPending());

        assertTrue(sink.poll().isPresent());
        assertFalse(sink.isPending());
        assertTrue(sink.poll().isEmpty());
    }

    @Test
    void timedAwaitReturnsEmptyWithoutWake() throws InterruptedException {
        Sink sink = new Sink("c");

        assertTrue(sink.await(Duration.ofMillis(20)).isEmpty());
    }

    @Test
    void awaitConsumesPendingWake() throws InterruptedException {
        Sink sink = new Sink("c");
        sink.offer(Notification.disconnected());

        Notification wake = sink.await();

        assertFalse(wake.healthy());
        assertFalse(sink.isPending());
    }
}
