package com.ryuqq.poller.core.statemachine;

/**
 * Poll run의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼
 * ATTEMPTING ◄──────┐
 *    │              │
 *    ├─► WAITING ───┘
 *    │      │
 *    │      └─► INTERRUPTED
 *    │
 *    ├─► SUCCEEDED       (Finished)
 *    ├─► USER_BROKEN     (Broken)
 *    ├─► STOP_TRIGGERED  (StopStrategy)
 *    ├─► ERRORED         (예외)
 *    └─► INTERRUPTED     (시도 직후 인터럽트 감지)
 *
 * 종료 상태에서는 어떤 전이도 불가 ❌
 * </pre>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public enum PollState {

    /**
     * 아직 첫 시도 전.
     */
    IDLE,

    /**
     * Operation 호출 중.
     */
    ATTEMPTING,

    /**
     * 다음 시도 전 대기 중.
     */
    WAITING,

    /**
     * 완료 (Finished).
     */
    SUCCEEDED,

    /**
     * 사용자 중단 (Broken).
     */
    USER_BROKEN,

    /**
     * StopStrategy에 의해 중단.
     */
    STOP_TRIGGERED,

    /**
     * Operation 예외로 실패.
     */
    ERRORED,

    /**
     * 인터럽트/취소.
     */
    INTERRUPTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, USER_BROKEN, STOP_TRIGGERED, ERRORED, INTERRUPTED인 경우 true
     */
    public boolean isTerminal() {
        return this != IDLE && this != ATTEMPTING && this != WAITING;
    }
}
