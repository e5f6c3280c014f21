package com.ryuqq.poller.core.strategy.wait;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * 무작위 지연 WaitStrategy.
 *
 * <p>[minimum, maximum] 구간(양 끝 포함)에서 나노초 단위 균등 분포로 대기 시간을 선택합니다.
 * 여러 클라이언트가 같은 주기로 폴링하여 부하가 몰리는 것(Thundering Herd)을 줄일 때 사용합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class RandomWaitStrategy implements WaitStrategy {

    private final Duration minimum;
    private final Duration maximum;
    private final Supplier<RandomGenerator> random;

    /**
     * 생성자 ({@link ThreadLocalRandom} 사용).
     *
     * @param minimum 최소 대기 시간 (0 이상)
     * @param maximum 최대 대기 시간 (minimum 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RandomWaitStrategy(Duration minimum, Duration maximum) {
        this(minimum, maximum, ThreadLocalRandom::current);
    }

    /**
     * 생성자 (난수 생성기 주입).
     *
     * @param minimum 최소 대기 시간 (0 이상)
     * @param maximum 최대 대기 시간 (minimum 이상)
     * @param random 난수 생성기 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RandomWaitStrategy(Duration minimum, Duration maximum, Supplier<RandomGenerator> random) {
        if (minimum == null || maximum == null) {
            throw new IllegalArgumentException("minimum and maximum cannot be null");
        }
        if (minimum.isNegative()) {
            throw new IllegalArgumentException("minimum must be non-negative (current: " + minimum + ")");
        }
        if (maximum.compareTo(minimum) < 0) {
            throw new IllegalArgumentException(
                "maximum must be >= minimum (minimum: " + minimum + ", maximum: " + maximum + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.minimum = minimum;
        this.maximum = maximum;
        this.random = random;
    }

    @Override
    public Duration computeDelay(Attempt lastAttempt) {
        long minNanos = DelayNanos.saturated(minimum);
        long maxNanos = DelayNanos.saturated(maximum);
        if (minNanos == maxNanos) {
            return minimum;
        }
        // bound는 exclusive이므로 maxNanos를 포함하려면 +1 (overflow 시 maxNanos 제외)
        long bound = maxNanos == Long.MAX_VALUE ? maxNanos : maxNanos + 1;
        return Duration.ofNanos(random.get().nextLong(minNanos, bound));
    }

    public Duration getMinimum() {
        return minimum;
    }

    public Duration getMaximum() {
        return maximum;
    }

    @Override
    public String toString() {
        return "RandomWaitStrategy{minimum=" + minimum + ", maximum=" + maximum + '}';
    }
}
