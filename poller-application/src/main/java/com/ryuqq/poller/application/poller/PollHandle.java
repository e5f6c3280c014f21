package com.ryuqq.poller.application.poller;

import com.ryuqq.poller.core.failure.PollerException;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Poll run 핸들.
 *
 * <p>{@link Poller#start()}가 반환하며, 결과 대기와 취소를 제공합니다.</p>
 *
 * <p><strong>취소 의미:</strong> 협력적 취소만 지원합니다. {@link #cancel()}은 워커 스레드를
 * 인터럽트하여 시도 사이 대기를 즉시 끝내지만, 이미 진행 중인 Operation 호출을 강제로
 * 중단하지는 않습니다.</p>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public interface PollHandle<V> {

    /**
     * 종료까지 대기 후 결과 반환.
     *
     * @return 완료 값
     * @throws PollerException poll run이 실패했거나, 취소되었거나(INTERRUPTED),
     *                         대기 중인 호출 스레드가 인터럽트된 경우(INTERRUPTED)
     */
    V get();

    /**
     * 최대 timeout 동안 대기 후 결과 반환.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 완료 값
     * @throws TimeoutException 시간 내에 종료되지 않은 경우 (poll run은 계속 진행됨)
     * @throws PollerException {@link #get()}과 동일
     */
    V get(long timeout, TimeUnit unit) throws TimeoutException;

    /**
     * Poll run 취소 (워커 인터럽트).
     *
     * @return 취소 요청이 받아들여진 경우 true (이미 종료된 경우 false)
     */
    boolean cancel();

    boolean isDone();

    boolean isCancelled();
}
