package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.time.Duration;

/**
 * 지수 백오프 WaitStrategy.
 *
 * <p>재시도 간격을 지수적으로 증가시키되 상한(cap)을 넘지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(n) = min(base * multiplier^(n-1), cap)
 * n = 직전 시도 번호 (1부터 시작)
 * </pre>
 *
 * <p><strong>예시 (base=100ms, multiplier=2.0, cap=1s):</strong></p>
 * <ul>
 *   <li>1회 시도 후: 100ms</li>
 *   <li>2회 시도 후: 200ms</li>
 *   <li>3회 시도 후: 400ms</li>
 *   <li>4회 시도 후: 800ms</li>
 *   <li>5회 시도 후: 1000ms (cap)</li>
 * </ul>
 *
 * <p>Jitter가 필요하면 {@link RandomWaitStrategy}와 {@link CompositeWaitStrategy}로 합산합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class ExponentialWaitStrategy implements WaitStrategy {

    private final Duration base;
    private final double multiplier;
    private final Duration cap;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param base 첫 번째 대기 시간 (양수여야 함)
     * @param multiplier 증가 배수 (1.0 이상의 유한한 값)
     * @param cap 최대 대기 시간 (base 이상이어야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialWaitStrategy(Duration base, double multiplier, Duration cap) {
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
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be a finite value >= 1.0 (current: " + multiplier + ")"
            );
        }
        this.base = base;
        this.multiplier = multiplier;
        this.cap = cap;
    }

    @Override
    public Duration computeDelay(Attempt lastAttempt) {
        long attemptNumber = lastAttempt.attemptNumber();

        // overflow 시 Infinity가 되어 cap으로 수렴
        double exponential = DelayNanos.saturated(base) * Math.pow(multiplier, attemptNumber - 1);
        long capNanos = DelayNanos.saturated(cap);
        if (exponential >= capNanos) {
            return cap;
        }
        return Duration.ofNanos((long) exponential);
    }

    public Duration getBase() {
        return base;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getCap() {
        return cap;
    }

    @Override
    public String toString() {
        return "ExponentialWaitStrategy{base=" + base + ", multiplier=" + multiplier + ", cap=" + cap + '}';
    }
}
