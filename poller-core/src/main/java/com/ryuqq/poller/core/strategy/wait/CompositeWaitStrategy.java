package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.time.Duration;
import java.util.List;

/**
 * 여러 WaitStrategy의 지연을 합산하는 WaitStrategy.
 *
 * <p>각 전략이 계산한 지연의 합을 반환합니다. 합이 {@code Long.MAX_VALUE} 나노초를
 * 넘으면 그 값으로 고정됩니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class CompositeWaitStrategy implements WaitStrategy {

    private static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    private final List<WaitStrategy> strategies;

    /**
     * 생성자.
     *
     * @param strategies 합산할 전략 목록 (1개 이상, null 원소 불가)
     * @throws IllegalArgumentException 목록이 null/빈 목록이거나 null 원소를 포함하는 경우
     */
    public CompositeWaitStrategy(List<WaitStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("strategies cannot be null or empty");
        }
        for (WaitStrategy strategy : strategies) {
            if (strategy == null) {
                throw new IllegalArgumentException("strategies cannot contain null");
            }
        }
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public Duration computeDelay(Attempt lastAttempt) {
        Duration total = Duration.ZERO;
        for (WaitStrategy strategy : strategies) {
            Duration delay = strategy.computeDelay(lastAttempt);
            if (delay == null || delay.isNegative()) {
                throw new IllegalStateException(
                    strategy + " returned an invalid delay (current: " + delay + ")"
                );
            }
            if (delay.compareTo(MAX_DELAY) >= 0) {
                return MAX_DELAY;
            }
            total = total.plus(delay);
            if (total.compareTo(MAX_DELAY) >= 0) {
                return MAX_DELAY;
            }
        }
        return total;
    }

    public List<WaitStrategy> getStrategies() {
        return strategies;
    }

    @Override
    public String toString() {
        return "CompositeWaitStrategy" + strategies;
    }
}
