package com.ryuqq.poller.core.failure;

import com.ryuqq.poller.core.attempt.Attempt;

/**
 * Poll run 종료 실패.
 *
 * <p>모든 종료 실패는 이 예외 하나로 호출자에게 전달됩니다.
 * {@link #getKind()}로 실패 분류를, {@link #getCause()}로 원래 원인을 확인합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     String url = poller.poll();
 * } catch (PollerException e) {
 *     switch (e.getKind()) {
 *         case STOP_TRIGGERED -&gt; log.warn("gave up after {} attempts", e.getLastAttempt().attemptNumber());
 *         case INTERRUPTED -&gt; Thread.currentThread().interrupt();
 *         default -&gt; throw e;
 *     }
 * }
 * </pre>
 *
 * @author Poller Team
 * @since 1.0.0
 */
public class PollerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;
    private final String pollerName;
    private final transient Attempt lastAttempt;

    /**
     * 생성자.
     *
     * @param kind 실패 분류
     * @param pollerName poller 이름
     * @param lastAttempt 마지막 시도 (첫 시도 전에 인터럽트된 경우 null)
     * @param message 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public PollerException(FailureKind kind, String pollerName, Attempt lastAttempt, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.pollerName = pollerName;
        this.lastAttempt = lastAttempt;
    }

    public static PollerException userBreak(String pollerName, Attempt lastAttempt, String reason, Throwable cause) {
        return new PollerException(FailureKind.USER_BREAK, pollerName, lastAttempt,
            "Poller '" + pollerName + "' broken at attempt " + attemptNumberOf(lastAttempt) + ": " + reason, cause);
    }

    public static PollerException stopTriggered(String pollerName, Attempt lastAttempt, Throwable lastError) {
        return new PollerException(FailureKind.STOP_TRIGGERED, pollerName, lastAttempt,
            "Poller '" + pollerName + "' stopped after " + attemptNumberOf(lastAttempt)
                + " attempt(s) in " + (lastAttempt == null ? "?" : lastAttempt.elapsed().toMillis() + "ms"),
            lastError);
    }

    public static PollerException uncaught(String pollerName, Attempt lastAttempt, Throwable cause) {
        return new PollerException(FailureKind.UNCAUGHT, pollerName, lastAttempt,
            "Poller '" + pollerName + "' failed at attempt " + attemptNumberOf(lastAttempt) + ": " + cause, cause);
    }

    public static PollerException interrupted(String pollerName, Attempt lastAttempt, Throwable cause) {
        return new PollerException(FailureKind.INTERRUPTED, pollerName, lastAttempt,
            "Poller '" + pollerName + "' interrupted after " + attemptNumberOf(lastAttempt) + " attempt(s)", cause);
    }

    // 시도 정보가 없으면 (예: 첫 시도 기록 전 취소) 횟수를 단정하지 않음
    private static String attemptNumberOf(Attempt attempt) {
        return attempt == null ? "?" : String.valueOf(attempt.attemptNumber());
    }

    /**
     * 실패 분류 조회.
     *
     * @return 실패 분류 (non-null)
     */
    public FailureKind getKind() {
        return kind;
    }

    public String getPollerName() {
        return pollerName;
    }

    /**
     * 마지막 시도 조회.
     *
     * <p>인터럽트로 종료된 경우 마지막으로 완료된 시도입니다 (시도 횟수가 그 시점에 고정됨).</p>
     *
     * @return 마지막 시도 또는 null (첫 시도 전에 종료된 경우)
     */
    public Attempt getLastAttempt() {
        return lastAttempt;
    }
}
