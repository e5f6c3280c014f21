package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.time.Duration;

/**
 * 선형 증가 WaitStrategy.
 *
 * <pre>
 * delay(n) = min(initial + increment * (n-1), cap)
 * </pre>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class IncrementingWaitStrategy implements WaitStrategy {

    private final Duration initial;
    private final Duration increment;
    private final Duration cap;

    public IncrementingWaitStrategy(Duration initial, Duration increment, Duration cap) {
        if (initial == null || increment == null || cap == null) {
            throw new IllegalArgumentException("initial, increment and cap cannot be null");
        }
        if (initial.isNegative()) {
            throw new IllegalArgumentException("initial must be non-negative (current: " + initial + ")");
        }
        if (increment.isNegative()) {
            throw new IllegalArgumentException("increment must be non-negative (current: " + increment + ")");
        }
        if (cap.compareTo(initial) < 0) {
            throw new IllegalArgumentException(
                "cap must be >= initial (initial: " + initial + ", cap: " + cap + ")"
            );
        }
        this.initial = initial;
        this.increment = increment;
        this.cap = cap;
    }

    @Override
    public Duration computeDelay(Attempt lastAttempt) {
        long steps = lastAttempt.attemptNumber() - 1;
        long incrementNanos = DelayNanos.saturated(increment);
        if (steps == 0 || incrementNanos == 0) {
            return initial;
        }
        long initialNanos = DelayNanos.saturated(initial);
        long headroom = DelayNanos.saturated(cap) - initialNanos;
        if (steps > headroom / incrementNanos) {
            return cap;
        }
        return Duration.ofNanos(initialNanos + incrementNanos * steps);
    }

    @Override
    public String toString() {
        return "IncrementingWaitStrategy{initial=" + initial + ", increment=" + increment + ", cap=" + cap + '}';
    }
}
