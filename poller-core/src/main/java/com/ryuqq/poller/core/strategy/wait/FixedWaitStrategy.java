package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.time.Duration;

/**
 * 고정 지연 WaitStrategy.
 *
 * <p>시도 횟수와 관계없이 항상 같은 시간을 대기합니다.
 * {@link Duration#ZERO}는 대기 없이 즉시 재시도를 의미합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class FixedWaitStrategy implements WaitStrategy {

    private final Duration delay;

    /**
     * 생성자.
     *
     * @param delay 대기 시간 (0 이상)
     * @throws IllegalArgumentException delay가 null이거나 음수인 경우
     */
    public FixedWaitStrategy(Duration delay) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        this.delay = delay;
    }

    @Override
    public Duration computeDelay(Attempt lastAttempt) {
        return delay;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return "FixedWaitStrategy{delay=" + delay + '}';
    }
}
