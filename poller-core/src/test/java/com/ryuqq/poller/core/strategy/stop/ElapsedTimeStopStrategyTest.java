package com.ryuqq.poller.core.strategy.stop;

import com.ryuqq.poller.core.attempt.Attempt;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ElapsedTimeStopStrategy 테스트.
 *
 * @author Poller Team
 * @since 1.0.0
 */
class ElapsedTimeStopStrategyTest {

    @Test
    void shouldStop_BeforeDeadline_ReturnsFalse() {
        // Given
        ElapsedTimeStopStrategy strategy = new ElapsedTimeStopStrategy(Duration.ofSeconds(1));

        // When & Then
        assertFalse(strategy.shouldStop(Attempt.continued(10, Duration.ofMillis(999), null)));
    }

    @Test
    void shouldStop_AtDeadline_ReturnsTrue() {
        // Given
        ElapsedTimeStopStrategy strategy = new ElapsedTimeStopStrategy(Duration.ofSeconds(1));

        // When & Then
        assertTrue(strategy.shouldStop(Attempt.continued(1, Duration.ofSeconds(1), null)));
        assertTrue(strategy.shouldStop(Attempt.continued(1, Duration.ofSeconds(5), null)));
    }

    @Test
    void shouldStop_ZeroBudget_StopsImmediately() {
        // When & Then
        assertTrue(new ElapsedTimeStopStrategy(Duration.ZERO).shouldStop(Attempt.continued(1, Duration.ZERO, null)));
    }

    @Test
    void constructor_NegativeBudget_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new ElapsedTimeStopStrategy(Duration.ofSeconds(-1)));
    }
}
