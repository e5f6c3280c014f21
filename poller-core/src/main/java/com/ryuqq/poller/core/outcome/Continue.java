package com.ryuqq.poller.core.outcome;

/**
 * 아직 완료되지 않음 (재시도 대상).
 *
 * <p>엔진은 StopStrategy를 평가한 뒤, 중단 조건이 아니면 WaitStrategy가 계산한 시간만큼
 * 대기하고 다시 시도합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>배치 작업이 아직 RUNNING 상태</li>
 *   <li>파일이 아직 업로드되지 않음</li>
 *   <li>외부 시스템이 일시적으로 503 응답</li>
 * </ul>
 *
 * @param reason 계속 진행 사유 (선택, null 가능)
 * @param <V> 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public record Continue<V>(String reason) implements Outcome<V> {
}
