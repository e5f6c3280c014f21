package com.ryuqq.poller.core.strategy;

import com.ryuqq.poller.core.strategy.stop.AnyOfStopStrategy;
import com.ryuqq.poller.core.strategy.stop.AttemptCountStopStrategy;
import com.ryuqq.poller.core.strategy.stop.ElapsedTimeStopStrategy;
import com.ryuqq.poller.core.strategy.stop.NeverStopStrategy;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 기본 제공 StopStrategy 팩토리.
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class StopStrategies {

    // Utility class - prevent instantiation
    private StopStrategies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 중단하지 않음 (Finished/Broken/예외/인터럽트로만 종료).
     */
    public static StopStrategy neverStop() {
        return NeverStopStrategy.INSTANCE;
    }

    /**
     * 최대 시도 횟수.
     *
     * @param maxAttempts 최대 시도 횟수 (1 이상, 첫 시도 포함)
     * @return AttemptCountStopStrategy
     */
    public static StopStrategy stopAfterAttempt(long maxAttempts) {
        return new AttemptCountStopStrategy(maxAttempts);
    }

    /**
     * 최대 경과 시간.
     *
     * @param maxElapsed poll run 시작부터의 최대 경과 시간
     * @return ElapsedTimeStopStrategy
     */
    public static StopStrategy stopAfterDelay(Duration maxElapsed) {
        return new ElapsedTimeStopStrategy(maxElapsed);
    }

    /**
     * 논리합 (하나라도 중단을 요구하면 중단).
     *
     * @param strategies 결합할 전략 (1개 이상)
     * @return 단일 전략이면 그대로, 아니면 AnyOfStopStrategy
     */
    public static StopStrategy anyOf(StopStrategy... strategies) {
        if (strategies == null) {
            throw new IllegalArgumentException("strategies cannot be null");
        }
        return anyOf(Arrays.asList(strategies));
    }

    public static StopStrategy anyOf(List<StopStrategy> strategies) {
        if (strategies != null && strategies.size() == 1 && strategies.get(0) != null) {
            return strategies.get(0);
        }
        return new AnyOfStopStrategy(strategies);
    }
}
