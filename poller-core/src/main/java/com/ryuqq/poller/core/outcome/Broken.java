package com.ryuqq.poller.core.outcome;

/**
 * 복구 불가능한 중단.
 *
 * <p>Operation이 명시적으로 더 이상 진행할 수 없다고 판단한 경우입니다.
 * 남은 시도 횟수나 시간 예산과 관계없이 즉시 종료되며, 대기하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>작업이 REJECTED/CANCELLED 상태로 종료됨</li>
 *   <li>권한 없음 (403 Forbidden)</li>
 *   <li>리소스 없음 (404 Not Found)</li>
 * </ul>
 *
 * @param reason 중단 사유
 * @param cause 원인 (선택, null 가능)
 * @param <V> 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public record Broken<V>(
    String reason,
    Throwable cause
) implements Outcome<V> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Broken {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        // cause는 null 허용
    }
}
