package com.ryuqq.poller.adapter.runner;

import com.ryuqq.poller.application.poller.PollHandle;
import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.failure.PollerException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 워커에서 진행 중인 poll run의 핸들 (비동기 실행 모드).
 *
 * <p>{@link Future}를 감싸 poll run 실패를 동기 모드와 같은 형태로 전달합니다.</p>
 *
 * <p><strong>예외 변환 규칙:</strong></p>
 * <ul>
 *   <li>워커가 던진 PollerException → 그대로 전달</li>
 *   <li>워커가 던진 Error → 그대로 전달</li>
 *   <li>그 외 RuntimeException (엔진의 프로그래밍 오류) → 그대로 전달 (동기 모드와 동일)</li>
 *   <li>그 외 워커 예외 → UNCAUGHT</li>
 *   <li>취소된 핸들 → INTERRUPTED (마지막으로 기록된 시도 포함)</li>
 *   <li>get() 대기 중 호출 스레드 인터럽트 → INTERRUPTED (인터럽트 플래그 복원)</li>
 * </ul>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
final class FuturePollHandle<V> implements PollHandle<V> {

    private final Future<V> future;
    private final String pollerName;
    private final Supplier<Attempt> lastAttempt;

    /**
     * 생성자.
     *
     * @param future 워커 작업
     * @param pollerName Poller 이름
     * @param lastAttempt 워커가 마지막으로 기록한 시도 (아직 없으면 null 반환)
     */
    FuturePollHandle(Future<V> future, String pollerName, Supplier<Attempt> lastAttempt) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        if (lastAttempt == null) {
            throw new IllegalArgumentException("lastAttempt cannot be null");
        }
        this.future = future;
        this.pollerName = pollerName;
        this.lastAttempt = lastAttempt;
    }

    @Override
    public V get() {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw PollerException.interrupted(pollerName, lastAttempt.get(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PollerException.interrupted(pollerName, lastAttempt.get(), e);
        }
    }

    @Override
    public V get(long timeout, TimeUnit unit) throws TimeoutException {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw PollerException.interrupted(pollerName, lastAttempt.get(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PollerException.interrupted(pollerName, lastAttempt.get(), e);
        }
    }

    /**
     * 워커를 인터럽트하여 취소.
     *
     * <p>대기 중이면 즉시 깨어나 INTERRUPTED로 종료되며,
     * Operation 호출 중이면 호출이 반환된 직후 종료됩니다.</p>
     */
    @Override
    public boolean cancel() {
        return future.cancel(true);
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public boolean isCancelled() {
        return future.isCancelled();
    }

    private RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        // PollerException 포함
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return PollerException.uncaught(pollerName, lastAttempt.get(), cause == null ? e : cause);
    }

    @Override
    public String toString() {
        return "FuturePollHandle{poller=" + pollerName + ", done=" + future.isDone()
            + ", cancelled=" + future.isCancelled() + "}";
    }
}
