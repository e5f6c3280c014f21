package com.ryuqq.poller.core.attempt;

/**
 * 시도 결과 분류.
 *
 * @author Poller Team
 * @since 1.0.0
 */
public enum AttemptKind {

    /**
     * Operation이 Finished를 반환함.
     */
    SUCCESS,

    /**
     * Operation이 Continue를 반환함.
     */
    CONTINUE,

    /**
     * Operation이 Broken을 반환함.
     */
    BREAK,

    /**
     * Operation이 예외를 던짐.
     */
    ERROR;

    /**
     * 이 분류 이후에 재시도가 가능한지 확인.
     *
     * <p>CONTINUE는 항상, ERROR는 retryOnException이 켜진 경우에만 재시도 대상이 됩니다.</p>
     *
     * @return CONTINUE 또는 ERROR인 경우 true
     */
    public boolean isRetryable() {
        return this == CONTINUE || this == ERROR;
    }
}
