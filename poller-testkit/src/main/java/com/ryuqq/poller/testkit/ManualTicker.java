package com.ryuqq.poller.testkit;

import com.ryuqq.poller.core.spi.Ticker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 수동으로 진행시키는 Ticker.
 *
 * <p>실제 시간이 흐르지 않아도 경과 시간 기반 StopStrategy를 검증할 수 있습니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class ManualTicker implements Ticker {

    private final AtomicLong nanos;

    /**
     * 임의의 기준점에서 시작 (엔진이 절대값에 의존하지 않음을 검증하기 위해 0이 아님).
     */
    public ManualTicker() {
        this(1_000_000_000L);
    }

    public ManualTicker(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long read() {
        return nanos.get();
    }

    /**
     * 시간 진행.
     *
     * @param duration 진행할 시간 (0 이상)
     * @throws IllegalArgumentException duration이 null이거나 음수인 경우
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        nanos.addAndGet(duration.toNanos());
    }
}
