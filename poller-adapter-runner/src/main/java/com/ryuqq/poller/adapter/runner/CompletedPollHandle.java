package com.ryuqq.poller.adapter.runner;

import com.ryuqq.poller.application.poller.PollHandle;
import com.ryuqq.poller.core.failure.PollerException;

import java.util.concurrent.TimeUnit;

/**
 * 이미 종료된 poll run의 핸들 (동기 실행 모드).
 *
 * <p>성공 값 또는 실패 예외 중 정확히 하나를 가집니다. 취소할 수 없습니다.</p>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
final class CompletedPollHandle<V> implements PollHandle<V> {

    private final V value;
    private final PollerException failure;

    private CompletedPollHandle(V value, PollerException failure) {
        this.value = value;
        this.failure = failure;
    }

    static <V> CompletedPollHandle<V> succeeded(V value) {
        return new CompletedPollHandle<>(value, null);
    }

    static <V> CompletedPollHandle<V> failed(PollerException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null for failed handle");
        }
        return new CompletedPollHandle<>(null, failure);
    }

    @Override
    public V get() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    @Override
    public V get(long timeout, TimeUnit unit) {
        return get();
    }

    @Override
    public boolean cancel() {
        return false;
    }

    @Override
    public boolean isDone() {
        return true;
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public String toString() {
        if (failure != null) {
            return "CompletedPollHandle{failed=" + failure.getKind() + "}";
        }
        return "CompletedPollHandle{value=" + value + "}";
    }
}
