package com.ryuqq.poller.core.spi;

import com.ryuqq.poller.core.attempt.Attempt;

/**
 * 시도 완료 리스너.
 *
 * <p>매 시도가 끝난 직후(마지막 시도 포함) 폴링 스레드에서 호출됩니다.
 * 리스너가 던진 예외는 로그로만 남고 poll run에 영향을 주지 않습니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AttemptListener {

    void onAttempt(Attempt attempt);

    AttemptListener NONE = attempt -> { };
}
