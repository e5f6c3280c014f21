package com.ryuqq.poller.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome sealed interface 테스트.
 *
 * @author Poller Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void finishWith_Value_CreatesFinished() {
        // When
        Outcome<String> outcome = Outcome.finishWith("job-42");

        // Then
        assertInstanceOf(Finished.class, outcome);
        assertEquals("job-42", ((Finished<String>) outcome).value());
        assertTrue(outcome.isFinished());
        assertFalse(outcome.isContinue());
        assertFalse(outcome.isBroken());
    }

    @Test
    void finishWithNull_CreatesFinishedWithNullValue() {
        // When
        Outcome<String> outcome = Outcome.finishWithNull();

        // Then
        assertTrue(outcome.isFinished());
        assertNull(((Finished<String>) outcome).value());
    }

    @Test
    void justContinue_CreatesContinueWithoutReason() {
        // When
        Outcome<String> outcome = Outcome.justContinue();

        // Then
        assertInstanceOf(Continue.class, outcome);
        assertNull(((Continue<String>) outcome).reason());
        assertTrue(outcome.isContinue());
    }

    @Test
    void continueFor_Reason_CreatesContinueWithReason() {
        // When
        Outcome<String> outcome = Outcome.continueFor("status=PENDING");

        // Then
        assertEquals("status=PENDING", ((Continue<String>) outcome).reason());
    }

    @Test
    void breakFor_Reason_CreatesBrokenWithoutCause() {
        // When
        Outcome<String> outcome = Outcome.breakFor("job rejected");

        // Then
        assertInstanceOf(Broken.class, outcome);
        Broken<String> broken = (Broken<String>) outcome;
        assertEquals("job rejected", broken.reason());
        assertNull(broken.cause());
        assertTrue(outcome.isBroken());
    }

    @Test
    void breakFor_ReasonAndCause_CreatesBrokenWithCause() {
        // Given
        RuntimeException cause = new RuntimeException("404");

        // When
        Outcome<String> outcome = Outcome.breakFor("resource gone", cause);

        // Then
        assertSame(cause, ((Broken<String>) outcome).cause());
    }

    @Test
    void instanceofPattern_CoversAllVariants() {
        // Given
        Outcome<Integer> outcome = Outcome.continueFor("not yet");

        // When
        String label = describe(outcome);

        // Then
        assertEquals("continue: not yet", label);
        assertEquals("finished: 7", describe(Outcome.finishWith(7)));
        assertEquals("broken: stop", describe(Outcome.breakFor("stop")));
    }

    private static String describe(Outcome<Integer> outcome) {
        if (outcome instanceof Finished<Integer> finished) {
            return "finished: " + finished.value();
        }
        if (outcome instanceof Continue<Integer> continued) {
            return "continue: " + continued.reason();
        }
        return "broken: " + ((Broken<Integer>) outcome).reason();
    }
}
