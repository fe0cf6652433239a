package io.trading.feed.gateway.supervisor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void testDoublesUntilCap() {
        Backoff backoff = new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);

        long[] expected = {1, 2, 4, 8, 16, 32, 60, 60};
        for (long seconds : expected) {
            assertEquals(Duration.ofSeconds(seconds), backoff.next());
        }
        assertEquals(expected.length, backoff.attempts());
    }

    @Test
    void testResetStartsOver() {
        Backoff backoff = new Backoff(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);
        backoff.next();
        backoff.next();

        backoff.reset();

        assertEquals(0, backoff.attempts());
        assertEquals(Duration.ofMillis(100), backoff.next());
    }

    @Test
    void testFromDefaults() {
        Backoff backoff = Backoff.from(SupervisorSettings.DEFAULT);
        assertEquals(Duration.ofSeconds(1), backoff.next());
        assertEquals(Duration.ofSeconds(2), backoff.next());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ZERO, Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 0.5));
    }
}
