package com.ryuqq.poller.core.strategy.stop;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.StopStrategy;

import java.util.List;

/**
 * 논리합 StopStrategy.
 *
 * <p>구성 전략 중 하나라도 중단을 요구하면 중단합니다. 평가는 등록 순서대로 진행되며
 * 첫 번째 true에서 멈춥니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class AnyOfStopStrategy implements StopStrategy {

    private final List<StopStrategy> strategies;

    /**
     * 생성자.
     *
     * @param strategies 결합할 전략 목록 (1개 이상, null 원소 불가)
     * @throws IllegalArgumentException 목록이 null/빈 목록이거나 null 원소를 포함하는 경우
     */
    public AnyOfStopStrategy(List<StopStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("strategies cannot be null or empty");
        }
        for (StopStrategy strategy : strategies) {
            if (strategy == null) {
                throw new IllegalArgumentException("strategies cannot contain null");
            }
        }
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public boolean shouldStop(Attempt lastAttempt) {
        for (StopStrategy strategy : strategies) {
            if (strategy.shouldStop(lastAttempt)) {
                return true;
            }
        }
        return false;
    }

    public List<StopStrategy> getStrategies() {
        return strategies;
    }

    @Override
    public String toString() {
        return "AnyOfStopStrategy" + strategies;
    }
}
