package com.ryuqq.poller.core.failure;

import com.ryuqq.poller.core.statemachine.PollState;

/**
 * Poll run 실패 분류.
 *
 * <p>각 분류는 하나의 종료 상태({@link PollState})에 대응합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * Operation이 Broken을 반환함 (재시도 안 함).
     */
    USER_BREAK(PollState.USER_BROKEN),

    /**
     * StopStrategy가 중단을 요구함 (시도/시간 예산 소진).
     */
    STOP_TRIGGERED(PollState.STOP_TRIGGERED),

    /**
     * Operation이 Outcome 프로토콜 밖에서 예외를 던짐.
     */
    UNCAUGHT(PollState.ERRORED),

    /**
     * 대기 중 인터럽트 또는 취소됨.
     */
    INTERRUPTED(PollState.INTERRUPTED);

    private final PollState terminalState;

    FailureKind(PollState terminalState) {
        this.terminalState = terminalState;
    }

    /**
     * 이 실패에 대응하는 종료 상태.
     *
     * @return 종료 상태
     */
    public PollState terminalState() {
        return terminalState;
    }
}
