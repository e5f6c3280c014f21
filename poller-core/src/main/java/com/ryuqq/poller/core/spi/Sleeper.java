package com.ryuqq.poller.core.spi;

import java.time.Duration;

/**
 * 시도 간 대기 SPI.
 *
 * <p>poll run에서 유일한 블로킹 지점입니다. 구현체는 반드시 인터럽트에 반응하여
 * {@link InterruptedException}을 던져야 하며, 남은 대기 시간을 기다려서는 안 됩니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 주어진 시간만큼 대기.
     *
     * @param duration 대기 시간 (0 이상)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep} 기반 기본 구현.
     *
     * @return ThreadSleeper
     */
    static Sleeper threadSleeper() {
        return ThreadSleeper.INSTANCE;
    }
}
