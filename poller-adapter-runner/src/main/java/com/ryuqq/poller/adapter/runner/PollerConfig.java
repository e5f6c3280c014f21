package com.ryuqq.poller.adapter.runner;

import com.ryuqq.poller.core.spi.AttemptListener;
import com.ryuqq.poller.core.spi.Operation;
import com.ryuqq.poller.core.spi.Sleeper;
import com.ryuqq.poller.core.spi.Ticker;
import com.ryuqq.poller.core.strategy.StopStrategies;
import com.ryuqq.poller.core.strategy.StopStrategy;
import com.ryuqq.poller.core.strategy.WaitStrategies;
import com.ryuqq.poller.core.strategy.WaitStrategy;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * RetryingPoller 설정 (불변 record).
 *
 * <p>이 record는 하나의 Poller가 poll run마다 사용하는 설정값을 담고 있습니다.
 * 직접 생성하기보다 {@link PollerBuilder}를 사용하는 것을 권장합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 로그/예외 메시지에 쓰이는 이름 (기본 "poller")</li>
 *   <li>operation: 폴링 대상 (필수)</li>
 *   <li>waitStrategy: 시도 간 대기 (기본 대기 없음)</li>
 *   <li>stopStrategy: 중단 조건 (기본 중단 안 함)</li>
 *   <li>executor: 비동기 실행 컨텍스트 (null이면 동기 실행)</li>
 *   <li>retryOnException: Operation 예외를 Continue처럼 취급할지 여부 (기본 false)</li>
 *   <li>listeners: 시도 완료 리스너 (기본 없음)</li>
 *   <li>ticker / sleeper: 시간원과 대기 구현 (기본 System.nanoTime / Thread sleep)</li>
 * </ul>
 *
 * @author Poller Team
 * @since 1.0.0
 * @param <V> 완료 값 타입
 * @param name poller 이름 (null/blank 불가)
 * @param operation 폴링 대상 Operation (null 불가)
 * @param waitStrategy 대기 전략 (null 불가)
 * @param stopStrategy 중단 전략 (null 불가)
 * @param executor 비동기 실행 컨텍스트 (null이면 동기)
 * @param retryOnException 예외 재시도 여부
 * @param listeners 시도 리스너 목록 (null 불가, 불변 복사됨)
 * @param ticker 시간원 (null 불가)
 * @param sleeper 대기 구현 (null 불가)
 */
public record PollerConfig<V>(
    String name,
    Operation<V> operation,
    WaitStrategy waitStrategy,
    StopStrategy stopStrategy,
    ExecutorService executor,
    boolean retryOnException,
    List<AttemptListener> listeners,
    Ticker ticker,
    Sleeper sleeper
) {

    static final String DEFAULT_NAME = "poller";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="poller", 대기 없음, 중단 안 함, 동기 실행, retryOnException=false</p>
     *
     * @param operation 폴링 대상 Operation
     */
    public PollerConfig(Operation<V> operation) {
        this(DEFAULT_NAME, operation, WaitStrategies.noWait(), StopStrategies.neverStop(),
            null, false, List.of(), Ticker.systemTicker(), Sleeper.threadSleeper());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (waitStrategy == null) {
            throw new IllegalArgumentException("waitStrategy cannot be null");
        }
        if (stopStrategy == null) {
            throw new IllegalArgumentException("stopStrategy cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        for (AttemptListener listener : listeners) {
            if (listener == null) {
                throw new IllegalArgumentException("listeners cannot contain null");
            }
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        listeners = List.copyOf(listeners);
    }

    /**
     * 비동기 실행 여부.
     *
     * @return executor가 설정된 경우 true
     */
    public boolean isAsync() {
        return executor != null;
    }

    public PollerConfig<V> withName(String name) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }

    public PollerConfig<V> withWaitStrategy(WaitStrategy waitStrategy) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }

    public PollerConfig<V> withStopStrategy(StopStrategy stopStrategy) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }

    /**
     * executor만 변경한 새 인스턴스 생성 (null이면 동기 실행).
     */
    public PollerConfig<V> withExecutor(ExecutorService executor) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }

    public PollerConfig<V> withRetryOnException(boolean retryOnException) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }

    public PollerConfig<V> withTicker(Ticker ticker) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }

    public PollerConfig<V> withSleeper(Sleeper sleeper) {
        return new PollerConfig<>(name, operation, waitStrategy, stopStrategy, executor, retryOnException, listeners, ticker, sleeper);
    }
}
