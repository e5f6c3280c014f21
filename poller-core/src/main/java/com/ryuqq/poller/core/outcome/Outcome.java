package com.ryuqq.poller.core.outcome;

/**
 * 단일 시도(Attempt)의 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Finished}: 폴링 완료, 값을 반환하고 즉시 종료</li>
 *   <li>{@link Continue}: 아직 완료되지 않음, 대기 후 재시도</li>
 *   <li>{@link Broken}: 복구 불가능한 상황, 재시도 없이 즉시 종료</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용된 구현은 위 세 가지뿐입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation&lt;String&gt; operation = () -&gt; {
 *     JobStatus status = client.fetchStatus(jobId);
 *     if (status.isDone()) {
 *         return Outcome.finishWith(status.resultUrl());
 *     }
 *     if (status.isRejected()) {
 *         return Outcome.breakFor("job rejected: " + status.reason());
 *     }
 *     return Outcome.continueFor("job still running");
 * };
 * </pre>
 *
 * @param <V> 완료 시 반환되는 값의 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public sealed interface Outcome<V> permits Finished, Continue, Broken {

    /**
     * 값과 함께 완료.
     *
     * @param value 반환할 값 (null 허용)
     * @param <V> 값 타입
     * @return Finished 인스턴스
     */
    static <V> Outcome<V> finishWith(V value) {
        return new Finished<>(value);
    }

    /**
     * 값 없이 완료 (결과는 null).
     *
     * @param <V> 값 타입
     * @return Finished 인스턴스
     */
    static <V> Outcome<V> finishWithNull() {
        return new Finished<>(null);
    }

    /**
     * 사유 없이 계속 진행.
     *
     * @param <V> 값 타입
     * @return Continue 인스턴스
     */
    static <V> Outcome<V> justContinue() {
        return new Continue<>(null);
    }

    /**
     * 사유와 함께 계속 진행.
     *
     * @param reason 계속 진행하는 사유 (로그/진단용)
     * @param <V> 값 타입
     * @return Continue 인스턴스
     */
    static <V> Outcome<V> continueFor(String reason) {
        return new Continue<>(reason);
    }

    /**
     * 즉시 중단.
     *
     * @param reason 중단 사유
     * @param <V> 값 타입
     * @return Broken 인스턴스
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    static <V> Outcome<V> breakFor(String reason) {
        return new Broken<>(reason, null);
    }

    /**
     * 원인 예외와 함께 즉시 중단.
     *
     * @param reason 중단 사유
     * @param cause 원인 (null 허용)
     * @param <V> 값 타입
     * @return Broken 인스턴스
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    static <V> Outcome<V> breakFor(String reason, Throwable cause) {
        return new Broken<>(reason, cause);
    }

    /**
     * 완료 결과인지 확인.
     *
     * @return 완료 여부
     */
    default boolean isFinished() {
        return this instanceof Finished;
    }

    /**
     * 계속 진행 결과인지 확인.
     *
     * @return 계속 진행 여부
     */
    default boolean isContinue() {
        return this instanceof Continue;
    }

    /**
     * 중단 결과인지 확인.
     *
     * @return 중단 여부
     */
    default boolean isBroken() {
        return this instanceof Broken;
    }
}
