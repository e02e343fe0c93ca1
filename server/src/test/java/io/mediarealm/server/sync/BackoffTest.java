package io.mediarealm.server.sync;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void delay_doubles_and_stays_within_jitter_window() {
        var b = new Backoff(Duration.ofMillis(100), Duration.ofSeconds(10), new Random(7));
        for (int attempt = 1; attempt <= 6; attempt++) {
            long cap = 100L << (attempt - 1);
            for (int i = 0; i < 50; i++) {
                long d = b.delay(attempt).toMillis();
                assertTrue(d >= cap / 2 && d <= cap, "attempt " + attempt + " gave " + d);
            }
        }
    }

    @Test
    void delay_is_capped() {
        var b = new Backoff(Duration.ofMillis(100), Duration.ofSeconds(1), new Random(1));
        for (int attempt = 5; attempt < 100; attempt += 7) {
            long d = b.delay(attempt).toMillis();
            assertTrue(d >= 500 && d <= 1000, "got " + d);
        }
    }

    @Test
    void rejects_bad_arguments() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new Backoff(Duration.ofMillis(10), Duration.ofMillis(20)).delay(0));
    }
}
