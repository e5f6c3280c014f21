package com.ryuqq.poller.core.attempt;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Attempt Record 테스트.
 *
 * @author Poller Team
 * @since 1.0.0
 */
class AttemptTest {

    @Test
    void success_CreatesSuccessAttempt() {
        // When
        Attempt attempt = Attempt.success(3, Duration.ofMillis(250));

        // Then
        assertEquals(3, attempt.attemptNumber());
        assertEquals(Duration.ofMillis(250), attempt.elapsed());
        assertEquals(AttemptKind.SUCCESS, attempt.kind());
        assertNull(attempt.reason());
        assertFalse(attempt.hasError());
    }

    @Test
    void continued_KeepsReason() {
        // When
        Attempt attempt = Attempt.continued(1, Duration.ZERO, "still running");

        // Then
        assertEquals(AttemptKind.CONTINUE, attempt.kind());
        assertEquals("still running", attempt.reason());
        assertTrue(attempt.kind().isRetryable());
    }

    @Test
    void broken_IsNotRetryable() {
        // When
        Attempt attempt = Attempt.broken(2, Duration.ofSeconds(1), "rejected", null);

        // Then
        assertEquals(AttemptKind.BREAK, attempt.kind());
        assertFalse(attempt.kind().isRetryable());
    }

    @Test
    void errored_CapturesCauseAndMessage() {
        // Given
        IOException cause = new IOException("timeout");

        // When
        Attempt attempt = Attempt.errored(4, Duration.ofSeconds(2), cause);

        // Then
        assertTrue(attempt.hasError());
        assertSame(cause, attempt.cause());
        assertEquals("timeout", attempt.reason());
        assertTrue(attempt.kind().isRetryable());
    }

    @Test
    void errored_NullCause_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Attempt.errored(1, Duration.ZERO, null)
        );
        assertTrue(exception.getMessage().contains("cause cannot be null"));
    }

    @Test
    void constructor_ZeroAttemptNumber_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Attempt.success(0, Duration.ZERO)
        );
        assertTrue(exception.getMessage().contains("attemptNumber must be positive (current: 0)"));
    }

    @Test
    void constructor_NullElapsed_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Attempt.success(1, null));
    }

    @Test
    void constructor_NegativeElapsed_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Attempt.success(1, Duration.ofMillis(-1)));
    }

    @Test
    void constructor_NullKind_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new Attempt(1, Duration.ZERO, null, null, null));
    }
}
