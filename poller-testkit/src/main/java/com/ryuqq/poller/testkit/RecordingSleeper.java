package com.ryuqq.poller.testkit;

import com.ryuqq.poller.core.spi.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 대기 요청을 기록하는 Sleeper.
 *
 * <p>실제로 잠들지 않고 요청된 지연을 기록합니다. {@link ManualTicker}를 함께 주면
 * 대기한 만큼 시간을 진행시킵니다.</p>
 *
 * <p><strong>인터럽트 시뮬레이션:</strong> {@link #interruptOnSleep(int)}로 지정한 n번째 대기에서
 * {@link InterruptedException}을 던집니다 (그 대기는 기록되지만 시간은 진행되지 않음).</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final ManualTicker ticker;
    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private volatile int interruptOnSleep = -1;

    public RecordingSleeper() {
        this(null);
    }

    /**
     * 생성자.
     *
     * @param ticker 대기한 만큼 진행시킬 Ticker (null이면 시간 진행 없음)
     */
    public RecordingSleeper(ManualTicker ticker) {
        this.ticker = ticker;
    }

    /**
     * n번째 대기(1부터 시작)에서 인터럽트 발생.
     *
     * @param sleepNumber 인터럽트할 대기 순번
     * @return this
     */
    public RecordingSleeper interruptOnSleep(int sleepNumber) {
        if (sleepNumber < 1) {
            throw new IllegalArgumentException("sleepNumber must be positive (current: " + sleepNumber + ")");
        }
        this.interruptOnSleep = sleepNumber;
        return this;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        delays.add(duration);
        if (delays.size() == interruptOnSleep) {
            throw new InterruptedException("Simulated interrupt on sleep " + interruptOnSleep);
        }
        if (ticker != null) {
            ticker.advance(duration);
        }
    }

    /**
     * 기록된 지연 목록 (요청 순서).
     */
    public List<Duration> getDelays() {
        return List.copyOf(delays);
    }

    public int getSleepCount() {
        return delays.size();
    }

    public Duration getTotalSlept() {
        Duration total = Duration.ZERO;
        for (Duration delay : delays) {
            total = total.plus(delay);
        }
        return total;
    }
}
