package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.time.Duration;

/**
 * 피보나치 백오프 WaitStrategy.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(n) = min(base * fib(n), cap)
 * fib(1) = fib(2) = 1, fib(n) = fib(n-1) + fib(n-2)
 * </pre>
 *
 * <p>지수 백오프보다 완만하게 증가합니다 (base=100ms: 100, 100, 200, 300, 500, 800ms ...).</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class FibonacciWaitStrategy implements WaitStrategy {

    private final Duration base;
    private final Duration cap;

    /**
     * 생성자.
     *
     * @param base 단위 대기 시간 (양수여야 함)
     * @param cap 최대 대기 시간 (base 이상이어야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FibonacciWaitStrategy(Duration base, Duration cap) {
        if (base == null || cap == null) {
            throw new IllegalArgumentException("base and cap cannot be null");
        }
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive (current: " + base + ")");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException(
                "cap must be >= base (base: " + base + ", cap: " + cap + ")"
            );
        }
        this.base = base;
        this.cap = cap;
    }

    @Override
    public Duration computeDelay(Attempt lastAttempt) {
        long baseNanos = DelayNanos.saturated(base);
        long maxFactor = DelayNanos.saturated(cap) / baseNanos;

        long previous = 0;
        long current = 1;
        for (long i = 1; i < lastAttempt.attemptNumber(); i++) {
            long next = previous + current;
            previous = current;
            current = next;
            // cap 도달 시 조기 종료 (overflow 방지)
            if (current > maxFactor) {
                return cap;
            }
        }
        return Duration.ofNanos(baseNanos * current);
    }

    public Duration getBase() {
        return base;
    }

    public Duration getCap() {
        return cap;
    }

    @Override
    public String toString() {
        return "FibonacciWaitStrategy{base=" + base + ", cap=" + cap + '}';
    }
}
