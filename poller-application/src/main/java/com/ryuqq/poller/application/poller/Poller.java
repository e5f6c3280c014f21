package com.ryuqq.poller.application.poller;

import com.ryuqq.poller.core.failure.PollerException;

/**
 * Poll run 실행 API.
 *
 * <p>Operation을 설정된 WaitStrategy/StopStrategy에 따라 반복 호출하여
 * 완료 값을 얻거나 종료 실패를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 동기 (호출 스레드가 poll run 전체를 블로킹)
 * String url = poller.poll();
 *
 * // 비동기 (설정된 ExecutorService에서 실행, 핸들 즉시 반환)
 * PollHandle&lt;String&gt; handle = poller.start();
 * ...
 * String url = handle.get(30, TimeUnit.SECONDS);
 * </pre>
 *
 * <p><strong>동시성:</strong> 하나의 Poller로 여러 poll run을 동시에 실행할 수 있으며,
 * 각 run은 자신만의 시도 카운터와 경과 시간을 가집니다.</p>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public interface Poller<V> {

    /**
     * 호출 스레드에서 poll run 실행 (블로킹).
     *
     * @return Operation이 Finished로 반환한 값 (null 가능)
     * @throws PollerException USER_BREAK, STOP_TRIGGERED, UNCAUGHT, INTERRUPTED 중 하나로 종료된 경우
     */
    V poll();

    /**
     * Poll run 시작.
     *
     * <p>실행 컨텍스트(ExecutorService)가 설정된 경우 즉시 반환되며 실행은 워커에서 진행됩니다.
     * 설정되지 않은 경우 호출 스레드에서 끝까지 실행한 뒤 이미 완료된 핸들을 반환합니다.
     * 어느 경우든 실패는 {@link PollHandle#get()}에서 던져집니다.</p>
     *
     * @return PollHandle
     */
    PollHandle<V> start();

    /**
     * Poller 이름 (로그/예외 메시지용).
     *
     * @return 이름
     */
    String getName();
}
