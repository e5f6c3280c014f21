package com.ryuqq.poller.core.strategy;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.wait.CompositeWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.ExponentialWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.FibonacciWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.FixedWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.IncrementingWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.RandomWaitStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WaitStrategies 팩토리 테스트.
 *
 * @author Poller Team
 * @since 1.0.0
 */
class WaitStrategiesTest {

    private static final Attempt FIRST = Attempt.continued(1, Duration.ZERO, null);

    @Test
    void noWait_ReturnsZero() {
        assertThat(WaitStrategies.noWait().computeDelay(FIRST)).isEqualTo(Duration.ZERO);
    }

    @Test
    void factories_CreateExpectedTypes() {
        assertThat(WaitStrategies.fixedWait(Duration.ofSeconds(1))).isInstanceOf(FixedWaitStrategy.class);
        assertThat(WaitStrategies.randomWait(Duration.ZERO, Duration.ofSeconds(1))).isInstanceOf(RandomWaitStrategy.class);
        assertThat(WaitStrategies.exponentialWait(Duration.ofMillis(1), 2.0, Duration.ofSeconds(1)))
            .isInstanceOf(ExponentialWaitStrategy.class);
        assertThat(WaitStrategies.fibonacciWait(Duration.ofMillis(1), Duration.ofSeconds(1)))
            .isInstanceOf(FibonacciWaitStrategy.class);
        assertThat(WaitStrategies.incrementingWait(Duration.ZERO, Duration.ofMillis(10), Duration.ofSeconds(1)))
            .isInstanceOf(IncrementingWaitStrategy.class);
    }

    @Test
    void join_MultipleStrategies_SumsDelays() {
        // Given: fixed 500ms + random jitter in [0, 0]
        WaitStrategy joined = WaitStrategies.join(
            WaitStrategies.fixedWait(Duration.ofMillis(500)),
            WaitStrategies.randomWait(Duration.ZERO, Duration.ZERO)
        );

        // Then
        assertThat(joined).isInstanceOf(CompositeWaitStrategy.class);
        assertThat(joined.computeDelay(FIRST)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void join_SingleStrategy_ReturnsItAsIs() {
        WaitStrategy fixed = WaitStrategies.fixedWait(Duration.ofMillis(10));

        assertThat(WaitStrategies.join(fixed)).isSameAs(fixed);
    }

    @Test
    void join_NullElement_ThrowsException() {
        assertThatThrownBy(() -> WaitStrategies.join(WaitStrategies.noWait(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
