package com.ryuqq.poller.core.strategy.stop;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.StopStrategy;

/**
 * StopStrategy NoOp 구현.
 *
 * <p>항상 false를 반환합니다. 폴링은 Finished, Broken, 예외, 인터럽트로만 종료됩니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class NeverStopStrategy implements StopStrategy {

    public static final NeverStopStrategy INSTANCE = new NeverStopStrategy();

    private NeverStopStrategy() {
    }

    @Override
    public boolean shouldStop(Attempt lastAttempt) {
        return false;
    }

    @Override
    public String toString() {
        return "NeverStopStrategy";
    }
}
