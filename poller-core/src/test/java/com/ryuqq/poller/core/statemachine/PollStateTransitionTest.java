package com.ryuqq.poller.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.poller.core.statemachine.PollState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PollStateTransition 테스트.
 *
 * <ul>
 *   <li>IDLE → ATTEMPTING → (WAITING ↔ ATTEMPTING) → 종료 상태</li>
 *   <li>종료 상태에서의 전이는 IllegalStateException</li>
 *   <li>역방향 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Poller Team
 * @since 1.0.0
 */
class PollStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_IdleToAttempting_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> PollStateTransition.validate(IDLE, ATTEMPTING));
    }

    @Test
    void validate_AttemptingToWaiting_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> PollStateTransition.validate(ATTEMPTING, WAITING));
    }

    @Test
    void validate_WaitingToAttempting_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> PollStateTransition.validate(WAITING, ATTEMPTING));
    }

    @Test
    void validate_WaitingToInterrupted_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> PollStateTransition.validate(WAITING, INTERRUPTED));
    }

    @ParameterizedTest
    @EnumSource(value = PollState.class, names = {"SUCCEEDED", "USER_BROKEN", "STOP_TRIGGERED", "ERRORED", "INTERRUPTED"})
    void validate_AttemptingToAnyTerminal_Succeeds(PollState terminal) {
        // When & Then
        assertDoesNotThrow(() -> PollStateTransition.validate(ATTEMPTING, terminal));
    }

    @Test
    void transition_RetryCycleToSuccess_Succeeds() {
        // Given
        PollState state = IDLE;

        // When
        state = PollStateTransition.transition(state, ATTEMPTING);
        state = PollStateTransition.transition(state, WAITING);
        state = PollStateTransition.transition(state, ATTEMPTING);
        state = PollStateTransition.transition(state, SUCCEEDED);

        // Then
        assertEquals(SUCCEEDED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 비정상 전이 테스트 ==========

    @ParameterizedTest
    @EnumSource(value = PollState.class, names = {"SUCCEEDED", "USER_BROKEN", "STOP_TRIGGERED", "ERRORED", "INTERRUPTED"})
    void validate_FromTerminal_ThrowsException(PollState terminal) {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PollStateTransition.validate(terminal, ATTEMPTING)
        );
        assertTrue(exception.getMessage().contains("Cannot transition from terminal state"));
    }

    @Test
    void validate_AttemptingToIdle_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PollStateTransition.validate(ATTEMPTING, IDLE)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_IdleToWaiting_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> PollStateTransition.validate(IDLE, WAITING));
    }

    @Test
    void validate_WaitingToSucceeded_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> PollStateTransition.validate(WAITING, SUCCEEDED));
    }

    @Test
    void validate_AttemptingToAttempting_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> PollStateTransition.validate(ATTEMPTING, ATTEMPTING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> PollStateTransition.validate(null, ATTEMPTING));
        assertThrows(IllegalArgumentException.class, () -> PollStateTransition.validate(IDLE, null));
    }
}
