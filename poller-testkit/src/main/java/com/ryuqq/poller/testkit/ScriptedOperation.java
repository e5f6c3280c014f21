package com.ryuqq.poller.testkit;

import com.ryuqq.poller.core.outcome.Outcome;
import com.ryuqq.poller.core.spi.Operation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 미리 정한 순서대로 Outcome/예외를 재생하는 Operation.
 *
 * <p>스크립트가 끝나면 마지막 단계를 계속 반복합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedOperation&lt;String&gt; operation = ScriptedOperation.&lt;String&gt;create()
 *     .thenContinue(2)
 *     .thenFinish("done");
 *
 * // 1, 2번째 호출: Continue, 3번째 이후: Finished("done")
 * </pre>
 *
 * @param <V> 완료 값 타입
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class ScriptedOperation<V> implements Operation<V> {

    @FunctionalInterface
    private interface Step<V> {
        Outcome<V> run() throws Exception;
    }

    private final List<Step<V>> steps = new ArrayList<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private ManualTicker ticker;
    private Duration costPerCall = Duration.ZERO;

    private ScriptedOperation() {
    }

    public static <V> ScriptedOperation<V> create() {
        return new ScriptedOperation<>();
    }

    /**
     * 항상 Continue를 반환하는 Operation.
     */
    public static <V> ScriptedOperation<V> alwaysContinue() {
        return ScriptedOperation.<V>create().thenContinue(1);
    }

    public ScriptedOperation<V> then(Outcome<V> outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        steps.add(() -> outcome);
        return this;
    }

    public ScriptedOperation<V> thenContinue(int times) {
        if (times < 1) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        for (int i = 0; i < times; i++) {
            then(Outcome.continueFor("scripted continue"));
        }
        return this;
    }

    public ScriptedOperation<V> thenFinish(V value) {
        return then(Outcome.finishWith(value));
    }

    public ScriptedOperation<V> thenBreak(String reason) {
        return then(Outcome.breakFor(reason));
    }

    public ScriptedOperation<V> thenThrow(Exception exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        steps.add(() -> {
            throw exception;
        });
        return this;
    }

    /**
     * 호출마다 ticker를 진행시켜 Operation 자체의 소요 시간을 시뮬레이션.
     *
     * @param ticker 진행시킬 Ticker
     * @param costPerCall 호출당 소요 시간
     * @return this
     */
    public ScriptedOperation<V> advancing(ManualTicker ticker, Duration costPerCall) {
        if (ticker == null || costPerCall == null) {
            throw new IllegalArgumentException("ticker and costPerCall cannot be null");
        }
        this.ticker = ticker;
        this.costPerCall = costPerCall;
        return this;
    }

    @Override
    public Outcome<V> attempt() throws Exception {
        if (steps.isEmpty()) {
            throw new IllegalStateException("ScriptedOperation has no steps");
        }
        int index = invocations.getAndIncrement();
        if (ticker != null) {
            ticker.advance(costPerCall);
        }
        return steps.get(Math.min(index, steps.size() - 1)).run();
    }

    /**
     * 지금까지의 호출 횟수.
     */
    public int getInvocations() {
        return invocations.get();
    }
}
