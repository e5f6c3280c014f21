package com.ryuqq.poller.core.spi;

import com.ryuqq.poller.core.outcome.Outcome;

/**
 * 폴링 대상 Operation.
 *
 * <p>호출될 때마다 한 번의 시도를 수행하고 {@link Outcome}을 반환합니다.
 * Outcome 프로토콜 밖에서 던진 예외는 기본적으로 즉시 UNCAUGHT 실패가 됩니다.</p>
 *
 * @param <V> 완료 시 반환 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<V> {

    /**
     * 한 번의 시도 수행.
     *
     * @return 시도 결과 (null 불가)
     * @throws Exception 시도 중 발생한 예외
     */
    Outcome<V> attempt() throws Exception;
}
