package com.ryuqq.poller.core.strategy.stop;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.StopStrategy;

import java.time.Duration;

/**
 * 최대 경과 시간 StopStrategy.
 *
 * <p>poll run 시작부터 직전 시도 종료까지의 경과 시간이 maxElapsed 이상이면 중단합니다.
 * 진행 중인 대기는 잘라내지 않으므로 실제 총 소요 시간은 maxElapsed를 넘을 수 있습니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class ElapsedTimeStopStrategy implements StopStrategy {

    private final Duration maxElapsed;

    /**
     * 생성자.
     *
     * @param maxElapsed 최대 경과 시간 (0 이상)
     * @throws IllegalArgumentException maxElapsed가 null이거나 음수인 경우
     */
    public ElapsedTimeStopStrategy(Duration maxElapsed) {
        if (maxElapsed == null) {
            throw new IllegalArgumentException("maxElapsed cannot be null");
        }
        if (maxElapsed.isNegative()) {
            throw new IllegalArgumentException("maxElapsed must be non-negative (current: " + maxElapsed + ")");
        }
        this.maxElapsed = maxElapsed;
    }

    @Override
    public boolean shouldStop(Attempt lastAttempt) {
        return lastAttempt.elapsed().compareTo(maxElapsed) >= 0;
    }

    public Duration getMaxElapsed() {
        return maxElapsed;
    }

    @Override
    public String toString() {
        return "ElapsedTimeStopStrategy{maxElapsed=" + maxElapsed + '}';
    }
}
