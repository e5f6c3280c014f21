package com.ryuqq.poller.testkit;

import com.ryuqq.poller.core.outcome.Broken;
import com.ryuqq.poller.core.outcome.Finished;
import com.ryuqq.poller.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptedOperation 테스트.
 *
 * @author Poller Team
 * @since 1.0.0
 */
class ScriptedOperationTest {

    @Test
    void attempt_ReplaysScriptThenRepeatsLastStep() throws Exception {
        ScriptedOperation<String> operation = ScriptedOperation.<String>create()
            .thenContinue(2)
            .thenFinish("done");

        assertThat(operation.attempt().isContinue()).isTrue();
        assertThat(operation.attempt().isContinue()).isTrue();
        Outcome<String> third = operation.attempt();
        Outcome<String> fourth = operation.attempt();

        assertThat(third).isEqualTo(new Finished<>("done"));
        assertThat(fourth).isEqualTo(third);
        assertThat(operation.getInvocations()).isEqualTo(4);
    }

    @Test
    void thenThrow_ThrowsGivenException() throws Exception {
        IOException failure = new IOException("boom");
        ScriptedOperation<String> operation = ScriptedOperation.<String>create()
            .thenBreak("nope")
            .thenThrow(failure);

        assertThat(operation.attempt()).isInstanceOf(Broken.class);
        assertThatThrownBy(operation::attempt).isSameAs(failure);
        assertThat(operation.getInvocations()).isEqualTo(2);
    }

    @Test
    void advancing_AdvancesTickerPerCall() throws Exception {
        ManualTicker ticker = new ManualTicker(0);
        ScriptedOperation<String> operation = ScriptedOperation.<String>alwaysContinue()
            .advancing(ticker, Duration.ofMillis(30));

        operation.attempt();
        operation.attempt();

        assertThat(ticker.read()).isEqualTo(Duration.ofMillis(60).toNanos());
    }

    @Test
    void attempt_EmptyScript_ThrowsIllegalState() {
        ScriptedOperation<String> operation = ScriptedOperation.create();

        assertThatThrownBy(operation::attempt)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no steps");
    }

    @Test
    void thenContinue_NonPositive_ThrowsException() {
        assertThatThrownBy(() -> ScriptedOperation.<String>create().thenContinue(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
