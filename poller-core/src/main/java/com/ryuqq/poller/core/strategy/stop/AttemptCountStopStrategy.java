package com.ryuqq.poller.core.strategy.stop;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.StopStrategy;

/**
 * 최대 시도 횟수 StopStrategy.
 *
 * <p>{@code attemptNumber >= maxAttempts}가 되면 중단합니다.
 * 항상 Continue를 반환하는 Operation은 정확히 maxAttempts번 호출됩니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class AttemptCountStopStrategy implements StopStrategy {

    private final long maxAttempts;

    /**
     * 생성자.
     *
     * @param maxAttempts 최대 시도 횟수 (첫 시도 포함, 1 이상)
     * @throws IllegalArgumentException maxAttempts가 양수가 아닌 경우
     */
    public AttemptCountStopStrategy(long maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public boolean shouldStop(Attempt lastAttempt) {
        return lastAttempt.attemptNumber() >= maxAttempts;
    }

    public long getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "AttemptCountStopStrategy{maxAttempts=" + maxAttempts + '}';
    }
}
