package com.ryuqq.poller.core.outcome;

/**
 * 폴링 완료.
 *
 * <p>기다리던 조건이 충족되었음을 나타내며, 엔진은 {@code value}를 반환하고
 * 더 이상 시도하지 않습니다.</p>
 *
 * @param value 반환 값 (null 허용)
 * @param <V> 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public record Finished<V>(V value) implements Outcome<V> {
}
