package com.ryuqq.poller.core.strategy;

import com.ryuqq.poller.core.attempt.Attempt;

/**
 * Stop Strategy SPI.
 *
 * <p>직전 시도 기록을 받아 재시도를 포기해야 하는지 판단합니다.
 * 재시도 가능한 시도(Continue, 또는 retryOnException 설정 시 예외) 이후에만 평가됩니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 * @see StopStrategies
 */
@FunctionalInterface
public interface StopStrategy {

    /**
     * 중단 여부 판단.
     *
     * @param lastAttempt 직전 시도 기록
     * @return 더 이상 시도하지 않아야 하면 true
     */
    boolean shouldStop(Attempt lastAttempt);
}
