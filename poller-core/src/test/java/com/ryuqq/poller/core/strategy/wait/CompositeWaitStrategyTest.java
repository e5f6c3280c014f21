package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CompositeWaitStrategy 테스트.
 *
 * @author Poller Team
 * @since 1.0.0
 */
class CompositeWaitStrategyTest {

    private static final Attempt THIRD = Attempt.continued(3, Duration.ZERO, null);

    @Test
    void computeDelay_SumsAllDelays() {
        // Given: fixed 1s + exponential 100ms*2^(3-1)
        CompositeWaitStrategy strategy = new CompositeWaitStrategy(List.of(
            new FixedWaitStrategy(Duration.ofSeconds(1)),
            new ExponentialWaitStrategy(Duration.ofMillis(100), 2.0, Duration.ofMinutes(1))
        ));

        // When
        Duration delay = strategy.computeDelay(THIRD);

        // Then
        assertThat(delay).isEqualTo(Duration.ofMillis(1400));
    }

    @Test
    void computeDelay_SaturatesInsteadOfOverflowing() {
        // Given
        Duration huge = Duration.ofNanos(Long.MAX_VALUE);
        CompositeWaitStrategy strategy = new CompositeWaitStrategy(List.of(
            new FixedWaitStrategy(huge),
            new FixedWaitStrategy(huge)
        ));

        // When & Then
        assertThat(strategy.computeDelay(THIRD)).isEqualTo(huge);
    }

    @Test
    void computeDelay_NegativeDelayFromCustomStrategy_ThrowsIllegalState() {
        // Given
        WaitStrategy broken = attempt -> Duration.ofMillis(-1);
        CompositeWaitStrategy strategy = new CompositeWaitStrategy(List.of(broken));

        // When & Then
        assertThatThrownBy(() -> strategy.computeDelay(THIRD))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("invalid delay");
    }

    @Test
    void constructor_EmptyList_ThrowsException() {
        assertThatThrownBy(() -> new CompositeWaitStrategy(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or empty");
    }

    @Test
    void constructor_NullElement_ThrowsException() {
        assertThatThrownBy(() -> new CompositeWaitStrategy(Arrays.asList(new FixedWaitStrategy(Duration.ZERO), null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot contain null");
    }

    @Test
    void computeDelay_ForeverDelay_SaturatesInsteadOfOverflowing() {
        // Given
        CompositeWaitStrategy strategy = new CompositeWaitStrategy(List.of(
            new FixedWaitStrategy(Duration.ofSeconds(1)),
            new FixedWaitStrategy(ChronoUnit.FOREVER.getDuration())
        ));

        // When & Then
        assertThat(strategy.computeDelay(THIRD)).isEqualTo(Duration.ofNanos(Long.MAX_VALUE));
    }
}
