package com.ryuqq.poller.adapter.runner;

import com.ryuqq.poller.application.poller.PollHandle;
import com.ryuqq.poller.application.poller.Poller;
import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.failure.PollerException;
import com.ryuqq.poller.core.outcome.Broken;
import com.ryuqq.poller.core.outcome.Continue;
import com.ryuqq.poller.core.outcome.Finished;
import com.ryuqq.poller.core.outcome.Outcome;
import com.ryuqq.poller.core.spi.AttemptListener;
import com.ryuqq.poller.core.statemachine.PollState;
import com.ryuqq.poller.core.statemachine.PollStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Retry Engine 구현체.
 *
 * <p>Operation을 반복 호출하여 Outcome에 따라 완료, 중단, 대기 후 재시도를 결정합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * poll() 호출
 *   ↓
 * IDLE → ATTEMPTING
 *   ↓
 * operation.attempt() → Outcome
 *   ├─ Finished(value)  → SUCCEEDED, value 반환
 *   ├─ Broken(reason)   → USER_BROKEN, 대기 없이 즉시 실패
 *   ├─ 예외             → ERRORED (retryOnException=false)
 *   └─ Continue (또는 retryOnException=true의 예외)
 *        ↓
 *      stopStrategy.shouldStop(attempt)?
 *        ├─ true  → STOP_TRIGGERED
 *        └─ false → waitStrategy.computeDelay(attempt)
 *                     ↓
 *                   WAITING: sleeper.sleep(delay)
 *                     ├─ 인터럽트 → INTERRUPTED (시도 횟수 고정)
 *                     └─ ATTEMPTING (attemptNumber + 1)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>인스턴스는 불변 설정만 가지므로 thread-safe합니다.</li>
 *   <li>시도 카운터와 경과 시간은 poll run마다 새로 생성되며 공유되지 않습니다.</li>
 *   <li>엔진은 스레드를 생성하지 않습니다. 비동기 모드는 설정된 ExecutorService만 사용합니다.</li>
 * </ul>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class RetryingPoller<V> implements Poller<V> {

    private static final Logger log = LoggerFactory.getLogger(RetryingPoller.class);

    private final PollerConfig<V> config;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RetryingPoller(PollerConfig<V> config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public V poll() {
        return new PollRun(new AtomicReference<>()).execute();
    }

    /**
     * {@inheritDoc}
     *
     * @throws java.util.concurrent.RejectedExecutionException executor가 작업을 거부한 경우 (예: shutdown 이후)
     */
    @Override
    public PollHandle<V> start() {
        ExecutorService executor = config.executor();
        if (executor == null) {
            // 동기 모드: 호출 스레드에서 끝까지 실행
            try {
                return CompletedPollHandle.succeeded(poll());
            } catch (PollerException e) {
                return CompletedPollHandle.failed(e);
            }
        }

        AtomicReference<Attempt> progress = new AtomicReference<>();
        Callable<V> task = () -> new PollRun(progress).execute();
        Future<V> future = executor.submit(task);
        log.debug("Poller '{}' submitted to {}", config.name(), executor);
        return new FuturePollHandle<>(future, config.name(), progress::get);
    }

    @Override
    public String getName() {
        return config.name();
    }

    public PollerConfig<V> getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "RetryingPoller{name=" + config.name() + ", wait=" + config.waitStrategy()
            + ", stop=" + config.stopStrategy() + ", async=" + config.isAsync() + "}";
    }

    /**
     * 단일 poll run 상태.
     *
     * <p>run마다 새로 생성되며 한 스레드에서만 사용됩니다.
     * 마지막으로 기록된 시도는 {@code progress}로 공개되어 취소된 핸들이 참조합니다.</p>
     */
    private final class PollRun {

        private final AtomicReference<Attempt> progress;

        private final long startNanos = config.ticker().read();
        private PollState state = PollState.IDLE;
        private long attemptNumber;
        private Duration lastElapsed = Duration.ZERO;
        private Throwable lastError;

        PollRun(AtomicReference<Attempt> progress) {
            this.progress = progress;
        }

        V execute() {
            while (true) {
                moveTo(PollState.ATTEMPTING);
                attemptNumber++;

                Outcome<V> outcome;
                try {
                    outcome = config.operation().attempt();
                } catch (InterruptedException e) {
                    Attempt attempt = record(Attempt.errored(attemptNumber, elapsed(), e));
                    Thread.currentThread().interrupt();
                    log.warn("Poller '{}' interrupted during attempt {}", config.name(), attemptNumber);
                    throw terminate(PollState.INTERRUPTED, PollerException.interrupted(config.name(), attempt, e));
                } catch (Exception e) {
                    Attempt attempt = record(Attempt.errored(attemptNumber, elapsed(), e));
                    if (!config.retryOnException()) {
                        log.error("Poller '{}' attempt {} threw an exception", config.name(), attemptNumber, e);
                        throw terminate(PollState.ERRORED, PollerException.uncaught(config.name(), attempt, e));
                    }
                    lastError = e;
                    log.debug("Poller '{}' attempt {} threw {}, retrying", config.name(), attemptNumber, e.toString());
                    awaitNextAttempt(attempt);
                    continue;
                }

                if (outcome == null) {
                    IllegalStateException error = new IllegalStateException("operation returned a null outcome");
                    Attempt attempt = record(Attempt.errored(attemptNumber, elapsed(), error));
                    log.error("Poller '{}' attempt {} returned a null outcome", config.name(), attemptNumber);
                    throw terminate(PollState.ERRORED, PollerException.uncaught(config.name(), attempt, error));
                }

                if (outcome instanceof Finished<V> finished) {
                    Attempt attempt = record(Attempt.success(attemptNumber, elapsed()));
                    moveTo(PollState.SUCCEEDED);
                    log.info("Poller '{}' finished after {} attempt(s) in {}ms",
                        config.name(), attemptNumber, attempt.elapsed().toMillis());
                    return finished.value();
                }

                if (outcome instanceof Broken<V> broken) {
                    Attempt attempt = record(Attempt.broken(attemptNumber, elapsed(), broken.reason(), broken.cause()));
                    log.warn("Poller '{}' broken at attempt {}: {}", config.name(), attemptNumber, broken.reason());
                    throw terminate(PollState.USER_BROKEN,
                        PollerException.userBreak(config.name(), attempt, broken.reason(), broken.cause()));
                }

                Continue<V> continued = (Continue<V>) outcome;
                Attempt attempt = record(Attempt.continued(attemptNumber, elapsed(), continued.reason()));
                log.debug("Poller '{}' attempt {} continuing: {}", config.name(), attemptNumber, continued.reason());
                awaitNextAttempt(attempt);
            }
        }

        /**
         * 재시도 가능한 시도 이후 처리: 중단 조건 평가 → 대기.
         *
         * @param attempt 직전 시도
         * @throws PollerException STOP_TRIGGERED 또는 INTERRUPTED
         */
        private void awaitNextAttempt(Attempt attempt) {
            if (config.stopStrategy().shouldStop(attempt)) {
                log.warn("Poller '{}' stopped by {} after {} attempt(s) in {}ms",
                    config.name(), config.stopStrategy(), attempt.attemptNumber(), attempt.elapsed().toMillis());
                throw terminate(PollState.STOP_TRIGGERED,
                    PollerException.stopTriggered(config.name(), attempt, lastError));
            }

            // 시도 도중 취소된 경우 대기 전에 종료
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Poller '{}' interrupted after attempt {}", config.name(), attempt.attemptNumber());
                throw terminate(PollState.INTERRUPTED, PollerException.interrupted(config.name(), attempt, null));
            }

            Duration delay = config.waitStrategy().computeDelay(attempt);
            if (delay == null || delay.isNegative()) {
                throw new IllegalStateException(
                    config.waitStrategy() + " returned an invalid delay (current: " + delay + ")"
                );
            }

            moveTo(PollState.WAITING);
            log.debug("Poller '{}' waiting {} before attempt {}",
                config.name(), delay, attempt.attemptNumber() + 1);
            try {
                config.sleeper().sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Poller '{}' interrupted while waiting after attempt {}",
                    config.name(), attempt.attemptNumber());
                throw terminate(PollState.INTERRUPTED, PollerException.interrupted(config.name(), attempt, e));
            }
        }

        /**
         * 경과 시간 계산 (단조 증가 보장).
         */
        private Duration elapsed() {
            Duration now = Duration.ofNanos(Math.max(0, config.ticker().read() - startNanos));
            if (now.compareTo(lastElapsed) > 0) {
                lastElapsed = now;
            }
            return lastElapsed;
        }

        private Attempt record(Attempt attempt) {
            progress.set(attempt);
            for (AttemptListener listener : config.listeners()) {
                try {
                    listener.onAttempt(attempt);
                } catch (RuntimeException e) {
                    log.warn("AttemptListener {} failed for poller '{}' at attempt {}",
                        listener, config.name(), attempt.attemptNumber(), e);
                }
            }
            return attempt;
        }

        private void moveTo(PollState next) {
            state = PollStateTransition.transition(state, next);
        }

        private PollerException terminate(PollState terminal, PollerException failure) {
            moveTo(terminal);
            return failure;
        }
    }
}
