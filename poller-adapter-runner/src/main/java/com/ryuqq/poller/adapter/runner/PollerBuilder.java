package com.ryuqq.poller.adapter.runner;

import com.ryuqq.poller.application.poller.Poller;
import com.ryuqq.poller.core.spi.AttemptListener;
import com.ryuqq.poller.core.spi.Operation;
import com.ryuqq.poller.core.spi.Sleeper;
import com.ryuqq.poller.core.spi.Ticker;
import com.ryuqq.poller.core.strategy.StopStrategies;
import com.ryuqq.poller.core.strategy.StopStrategy;
import com.ryuqq.poller.core.strategy.WaitStrategies;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Poller 생성 빌더.
 *
 * <p>여러 WaitStrategy는 지연이 합산되고, 여러 StopStrategy는 논리합(OR)으로 결합됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Poller&lt;String&gt; poller = PollerBuilder.&lt;String&gt;newBuilder()
 *     .name("export-job")
 *     .operation(() -&gt; {
 *         ExportStatus status = client.status(jobId);
 *         return switch (status.phase()) {
 *             case DONE -&gt; Outcome.finishWith(status.downloadUrl());
 *             case FAILED -&gt; Outcome.breakFor(status.error());
 *             default -&gt; Outcome.continueFor(status.phase().name());
 *         };
 *     })
 *     .waitStrategies(
 *         WaitStrategies.fibonacciWait(Duration.ofMillis(200), Duration.ofSeconds(10)),
 *         WaitStrategies.randomWait(Duration.ZERO, Duration.ofMillis(100)))
 *     .stopStrategies(
 *         StopStrategies.stopAfterAttempt(30),
 *         StopStrategies.stopAfterDelay(Duration.ofMinutes(2)))
 *     .executor(pollingPool)
 *     .build();
 * </pre>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class PollerBuilder<V> {

    private String name = PollerConfig.DEFAULT_NAME;
    private Operation<V> operation;
    private final List<WaitStrategy> waitStrategies = new ArrayList<>();
    private final List<StopStrategy> stopStrategies = new ArrayList<>();
    private ExecutorService executor;
    private boolean retryOnException;
    private final List<AttemptListener> listeners = new ArrayList<>();
    private Ticker ticker = Ticker.systemTicker();
    private Sleeper sleeper = Sleeper.threadSleeper();

    private PollerBuilder() {
    }

    public static <V> PollerBuilder<V> newBuilder() {
        return new PollerBuilder<>();
    }

    public PollerBuilder<V> name(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        return this;
    }

    public PollerBuilder<V> operation(Operation<V> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        this.operation = operation;
        return this;
    }

    /**
     * WaitStrategy 추가 (여러 번 호출하면 지연이 합산됨).
     */
    public PollerBuilder<V> waitStrategy(WaitStrategy waitStrategy) {
        if (waitStrategy == null) {
            throw new IllegalArgumentException("waitStrategy cannot be null");
        }
        this.waitStrategies.add(waitStrategy);
        return this;
    }

    public PollerBuilder<V> waitStrategies(WaitStrategy... waitStrategies) {
        if (waitStrategies == null) {
            throw new IllegalArgumentException("waitStrategies cannot be null");
        }
        for (WaitStrategy waitStrategy : waitStrategies) {
            waitStrategy(waitStrategy);
        }
        return this;
    }

    /**
     * StopStrategy 추가 (여러 번 호출하면 하나라도 true일 때 중단).
     */
    public PollerBuilder<V> stopStrategy(StopStrategy stopStrategy) {
        if (stopStrategy == null) {
            throw new IllegalArgumentException("stopStrategy cannot be null");
        }
        this.stopStrategies.add(stopStrategy);
        return this;
    }

    public PollerBuilder<V> stopStrategies(StopStrategy... stopStrategies) {
        if (stopStrategies == null) {
            throw new IllegalArgumentException("stopStrategies cannot be null");
        }
        for (StopStrategy stopStrategy : stopStrategies) {
            stopStrategy(stopStrategy);
        }
        return this;
    }

    /**
     * 비동기 실행 컨텍스트 지정 (null이면 동기 실행).
     *
     * <p>ExecutorService의 생명주기는 호출자가 관리합니다.</p>
     */
    public PollerBuilder<V> executor(ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    /**
     * Operation 예외를 Continue처럼 취급하여 시도/시간 예산 안에서 재시도할지 여부.
     */
    public PollerBuilder<V> retryOnException(boolean retryOnException) {
        this.retryOnException = retryOnException;
        return this;
    }

    public PollerBuilder<V> listener(AttemptListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listeners.add(listener);
        return this;
    }

    public PollerBuilder<V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    public PollerBuilder<V> sleeper(Sleeper sleeper) {
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.sleeper = sleeper;
        return this;
    }

    /**
     * 설정 생성.
     *
     * @return PollerConfig
     * @throws IllegalArgumentException operation이 지정되지 않은 경우
     */
    public PollerConfig<V> buildConfig() {
        WaitStrategy waitStrategy = waitStrategies.isEmpty()
            ? WaitStrategies.noWait()
            : WaitStrategies.join(waitStrategies);
        StopStrategy stopStrategy = stopStrategies.isEmpty()
            ? StopStrategies.neverStop()
            : StopStrategies.anyOf(stopStrategies);

        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy,
            executor, retryOnException, listeners, ticker, sleeper);
    }

    /**
     * Poller 생성.
     *
     * @return RetryingPoller
     * @throws IllegalArgumentException operation이 지정되지 않은 경우
     */
    public Poller<V> build() {
        return new RetryingPoller<>(buildConfig());
    }
}
