package com.ryuqq.poller.core.attempt;

import java.time.Duration;

/**
 * 단일 시도 기록.
 *
 * <p>매 시도마다 새로 생성되는 불변 객체이며, WaitStrategy와 StopStrategy의 입력이 됩니다.</p>
 *
 * <p><strong>불변식 (단일 poll run 내):</strong></p>
 * <ul>
 *   <li>attemptNumber는 1부터 시작하여 1씩 증가</li>
 *   <li>elapsed는 감소하지 않음</li>
 * </ul>
 *
 * @param attemptNumber 시도 번호 (1 이상)
 * @param elapsed poll run 시작 후 이 시도가 끝날 때까지의 경과 시간 (0 이상)
 * @param kind 결과 분류
 * @param reason Continue/Broken 사유 (선택, null 가능)
 * @param cause 포착된 예외 또는 Broken 원인 (선택, null 가능)
 *
 * @author Poller Team
 * @since 1.0.0
 */
public record Attempt(
    long attemptNumber,
    Duration elapsed,
    AttemptKind kind,
    String reason,
    Throwable cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Attempt {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be non-negative (current: " + elapsed + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    public static Attempt success(long attemptNumber, Duration elapsed) {
        return new Attempt(attemptNumber, elapsed, AttemptKind.SUCCESS, null, null);
    }

    public static Attempt continued(long attemptNumber, Duration elapsed, String reason) {
        return new Attempt(attemptNumber, elapsed, AttemptKind.CONTINUE, reason, null);
    }

    public static Attempt broken(long attemptNumber, Duration elapsed, String reason, Throwable cause) {
        return new Attempt(attemptNumber, elapsed, AttemptKind.BREAK, reason, cause);
    }

    /**
     * 예외로 끝난 시도 생성.
     *
     * @param attemptNumber 시도 번호
     * @param elapsed 경과 시간
     * @param cause 포착된 예외
     * @return Attempt 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static Attempt errored(long attemptNumber, Duration elapsed, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null for errored attempt");
        }
        return new Attempt(attemptNumber, elapsed, AttemptKind.ERROR, cause.getMessage(), cause);
    }

    /**
     * 예외가 포착된 시도인지 확인.
     *
     * @return ERROR 분류인 경우 true
     */
    public boolean hasError() {
        return kind == AttemptKind.ERROR;
    }
}
