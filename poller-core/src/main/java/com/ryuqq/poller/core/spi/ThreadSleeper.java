package com.ryuqq.poller.core.spi;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 현재 스레드를 재우는 기본 Sleeper.
 *
 * <p>대기 시간이 0이어도 인터럽트 플래그를 확인하여, 취소된 스레드가 대기 없이
 * 계속 시도하지 않도록 합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    static final ThreadSleeper INSTANCE = new ThreadSleeper();

    private ThreadSleeper() {
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long nanos = toNanosSaturated(duration);
        if (nanos == 0) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted before zero-length wait");
            }
            return;
        }
        TimeUnit.NANOSECONDS.sleep(nanos);
    }

    private static long toNanosSaturated(Duration duration) {
        if (duration.isNegative()) {
            return 0;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
