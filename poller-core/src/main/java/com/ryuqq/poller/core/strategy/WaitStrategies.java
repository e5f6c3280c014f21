package com.ryuqq.poller.core.strategy;

import com.ryuqq.poller.core.strategy.wait.CompositeWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.ExponentialWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.FibonacciWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.FixedWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.IncrementingWaitStrategy;
import com.ryuqq.poller.core.strategy.wait.RandomWaitStrategy;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 기본 제공 WaitStrategy 팩토리.
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class WaitStrategies {

    private static final WaitStrategy NO_WAIT = new FixedWaitStrategy(Duration.ZERO);

    // Utility class - prevent instantiation
    private WaitStrategies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대기 없이 즉시 재시도.
     */
    public static WaitStrategy noWait() {
        return NO_WAIT;
    }

    /**
     * 고정 지연.
     *
     * @param delay 매 시도 사이 대기 시간
     * @return FixedWaitStrategy
     */
    public static WaitStrategy fixedWait(Duration delay) {
        return new FixedWaitStrategy(delay);
    }

    /**
     * [minimum, maximum] 범위의 균등 분포 무작위 지연.
     */
    public static WaitStrategy randomWait(Duration minimum, Duration maximum) {
        return new RandomWaitStrategy(minimum, maximum);
    }

    /**
     * 지수 백오프: {@code min(base * multiplier^(n-1), cap)}.
     *
     * @param base 첫 번째 대기 시간
     * @param multiplier 증가 배수 (1.0 이상)
     * @param cap 최대 대기 시간
     * @return ExponentialWaitStrategy
     */
    public static WaitStrategy exponentialWait(Duration base, double multiplier, Duration cap) {
        return new ExponentialWaitStrategy(base, multiplier, cap);
    }

    /**
     * 피보나치 백오프: {@code min(base * fib(n), cap)}.
     */
    public static WaitStrategy fibonacciWait(Duration base, Duration cap) {
        return new FibonacciWaitStrategy(base, cap);
    }

    /**
     * 선형 증가: {@code min(initial + increment * (n-1), cap)}.
     */
    public static WaitStrategy incrementingWait(Duration initial, Duration increment, Duration cap) {
        return new IncrementingWaitStrategy(initial, increment, cap);
    }

    /**
     * 여러 전략의 지연 합계.
     *
     * <p>예: 고정 지연 + 무작위 jitter</p>
     *
     * @param strategies 합산할 전략 (1개 이상)
     * @return 단일 전략이면 그대로, 아니면 CompositeWaitStrategy
     */
    public static WaitStrategy join(WaitStrategy... strategies) {
        if (strategies == null) {
            throw new IllegalArgumentException("strategies cannot be null");
        }
        return join(Arrays.asList(strategies));
    }

    public static WaitStrategy join(List<WaitStrategy> strategies) {
        if (strategies != null && strategies.size() == 1 && strategies.get(0) != null) {
            return strategies.get(0);
        }
        return new CompositeWaitStrategy(strategies);
    }
}
