package com.ryuqq.fleet.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.fleet.core.statemachine.RunState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        // Given
        RunState state = IDLE;

        // When
        state = StateTransition.transition(state, EVALUATING);
        state = StateTransition.transition(state, PLANNED);
        state = StateTransition.transition(state, EXECUTING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_ExecutingToAborted_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(EXECUTING, ABORTED));
    }

    @Test
    void validate_EvaluatingToAborted_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(EVALUATING, ABORTED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_IdleToExecuting_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(IDLE, EXECUTING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_EvaluatingToExecuting_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(EVALUATING, EXECUTING));
    }

    @Test
    void validate_PlannedToEvaluating_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PLANNED, EVALUATING));
    }

    @Test
    void validate_FromTerminal_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(COMPLETED, EXECUTING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(ABORTED, IDLE));
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, IDLE));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(IDLE, null));
    }
}
