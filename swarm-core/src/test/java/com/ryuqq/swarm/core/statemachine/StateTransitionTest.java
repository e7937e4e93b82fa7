package com.ryuqq.swarm.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== Task 정상 전이 ==========

    @Test
    void validate_TaskQueuedToAssigned_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(TaskStatus.QUEUED, TaskStatus.ASSIGNED));
    }

    @Test
    void transition_TaskNormalFlowToCompleted_Succeeds() {
        // Given
        TaskStatus status = TaskStatus.QUEUED;

        // When
        status = StateTransition.transition(status, TaskStatus.ASSIGNED);
        status = StateTransition.transition(status, TaskStatus.IN_PROGRESS);
        status = StateTransition.transition(status, TaskStatus.COMPLETED);

        // Then
        assertEquals(TaskStatus.COMPLETED, status);
    }

    @Test
    void validate_TaskFailedToQueued_AllowedForRetry() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(TaskStatus.FAILED, TaskStatus.QUEUED));
    }

    @Test
    void validate_TaskAssignedToQueued_AllowedForRejectedDispatch() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(TaskStatus.ASSIGNED, TaskStatus.QUEUED));
    }

    // ========== Task 금지 전이 ==========

    @Test
    void validate_TaskQueuedToInProgress_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(TaskStatus.QUEUED, TaskStatus.IN_PROGRESS)
        );
        assertTrue(exception.getMessage().contains("Invalid task state transition"));
    }

    @Test
    void validate_TaskCompletedToQueued_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(TaskStatus.COMPLETED, TaskStatus.QUEUED)
        );
    }

    @Test
    void validate_TaskCancelledToAssigned_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(TaskStatus.CANCELLED, TaskStatus.ASSIGNED)
        );
    }

    @Test
    void validate_TaskFailedToInProgress_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(TaskStatus.FAILED, TaskStatus.IN_PROGRESS)
        );
    }

    // ========== Session ==========

    @Test
    void transition_SessionNormalFlowToCompleted_Succeeds() {
        // Given
        SessionStatus status = SessionStatus.INITIALIZING;

        // When
        status = StateTransition.transition(status, SessionStatus.ACTIVE);
        status = StateTransition.transition(status, SessionStatus.COMPLETING);
        status = StateTransition.transition(status, SessionStatus.COMPLETED);

        // Then
        assertEquals(SessionStatus.COMPLETED, status);
    }

    @Test
    void validate_SessionInitializingToCompleting_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(SessionStatus.INITIALIZING, SessionStatus.COMPLETING)
        );
    }

    @Test
    void validate_SessionFromTerminal_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(SessionStatus.CANCELLED, SessionStatus.ACTIVE)
        );
        assertTrue(exception.getMessage().contains("terminal"));
    }

    // ========== Agent ==========

    @Test
    void validate_AgentIdleToBusyAndBack_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(AgentStatus.IDLE, AgentStatus.BUSY));
        assertDoesNotThrow(() -> StateTransition.validate(AgentStatus.BUSY, AgentStatus.IDLE));
    }

    @Test
    void validate_AgentBusyToBusy_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(AgentStatus.BUSY, AgentStatus.BUSY)
        );
    }

    @Test
    void validate_AgentOfflineToBusy_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(AgentStatus.OFFLINE, AgentStatus.BUSY)
        );
    }

    // ========== Null 검증 ==========

    @Test
    void validate_NullFrom_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> StateTransition.validate(null, TaskStatus.QUEUED)
        );
    }
}
