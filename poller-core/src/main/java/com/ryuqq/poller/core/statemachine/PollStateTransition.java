package com.ryuqq.poller.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → ATTEMPTING</li>
 *   <li>ATTEMPTING → WAITING, SUCCEEDED, USER_BROKEN, STOP_TRIGGERED, ERRORED, INTERRUPTED</li>
 *   <li>WAITING → ATTEMPTING, INTERRUPTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class PollStateTransition {

    // Utility class - prevent instantiation
    private PollStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PollState from, PollState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case IDLE -> to == PollState.ATTEMPTING;
            case ATTEMPTING -> to == PollState.WAITING || to.isTerminal();
            case WAITING -> to == PollState.ATTEMPTING || to == PollState.INTERRUPTED;
            default -> false; // 종료 상태 (위에서 이미 체크했지만 명시적 표현)
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PollState transition(PollState current, PollState next) {
        validate(current, next);
        return next;
    }
}
