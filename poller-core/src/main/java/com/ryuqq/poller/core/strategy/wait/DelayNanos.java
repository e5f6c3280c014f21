package com.ryuqq.poller.core.strategy.wait;

import java.time.Duration;

/**
 * Duration → 나노초 변환 (포화).
 *
 * <p>{@link Duration#toNanos()}는 약 292년을 넘으면 ArithmeticException을 던지므로,
 * 지연 계산에서는 {@link Long#MAX_VALUE}로 포화시킵니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
final class DelayNanos {

    // Utility class - prevent instantiation
    private DelayNanos() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 음수가 아닌 Duration을 나노초로 변환.
     *
     * @param duration 변환할 Duration (0 이상)
     * @return 나노초 (표현 범위를 넘으면 Long.MAX_VALUE)
     */
    static long saturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
