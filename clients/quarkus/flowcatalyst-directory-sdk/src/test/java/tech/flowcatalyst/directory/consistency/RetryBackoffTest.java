package tech.flowcatalyst.directory.consistency;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryBackoff.
 */
class RetryBackoffTest {

    @Test
    void delay_doublesPerAttempt() {
        var backoff = new RetryBackoff(8, 1000, 16000, Duration.ofMinutes(5));

        assertEquals(1000, backoff.delayFor(1));
        assertEquals(2000, backoff.delayFor(2));
        assertEquals(4000, backoff.delayFor(3));
        assertEquals(8000, backoff.delayFor(4));
    }

    @Test
    void delay_isCappedAtMaxDelay() {
        var backoff = new RetryBackoff(8, 1000, 16000, Duration.ofMinutes(5));

        assertEquals(16000, backoff.delayFor(5));
        assertEquals(16000, backoff.delayFor(7));
        assertEquals(16000, backoff.delayFor(100));
    }

    @Test
    void zeroInitialDelay_staysZero() {
        var backoff = new RetryBackoff(3, 0, 0, Duration.ofSeconds(1));

        assertEquals(0, backoff.delayFor(3));
    }

    @Test
    void invalidBounds_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(0, 10, 20, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(3, 50, 20, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(3, -1, 20, Duration.ZERO));
    }
}
