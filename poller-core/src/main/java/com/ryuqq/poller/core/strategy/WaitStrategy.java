package com.ryuqq.poller.core.strategy;

import com.ryuqq.poller.core.attempt.Attempt;

import java.time.Duration;

/**
 * Wait Strategy SPI.
 *
 * <p>직전 시도 기록을 받아 다음 시도 전까지 대기할 시간을 계산합니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>반환값은 null이 아니고 음수가 아니어야 합니다.</li>
 *   <li>외부 상태를 변경하지 않는 순수 함수여야 합니다 (무작위 지연 제외).</li>
 *   <li>동시에 여러 poll run에서 호출될 수 있으므로 thread-safe해야 합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * WaitStrategy custom = attempt -> attempt.hasError()
 *     ? Duration.ofSeconds(5)
 *     : Duration.ofMillis(200);
 * }</pre>
 *
 * @author Poller Team
 * @since 1.0.0
 * @see WaitStrategies
 */
@FunctionalInterface
public interface WaitStrategy {

    /**
     * 다음 시도 전 대기 시간 계산.
     *
     * @param lastAttempt 직전 시도 기록
     * @return 대기 시간 (0 이상)
     */
    Duration computeDelay(Attempt lastAttempt);
}
