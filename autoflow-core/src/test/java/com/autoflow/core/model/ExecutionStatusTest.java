package com.autoflow.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatusTest {

    @Test
    void terminalStates_shouldBeIdentifiedCorrectly() {
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.TIMEOUT.isTerminal());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());

        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertFalse(ExecutionStatus.PENDING_APPROVAL.isTerminal());
        assertFalse(ExecutionStatus.FAILED.isTerminal());
        assertFalse(ExecutionStatus.RETRYING.isTerminal());
    }

    @Test
    void pending_canTransitionToRunningOrCancelled() {
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.CANCELLED));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
    }

    @Test
    void running_canReachAllWalkOutcomes() {
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PENDING_APPROVAL));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.TIMEOUT));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.CANCELLED));
        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.RETRYING));
    }

    @Test
    void pendingApproval_resumesOrCancels() {
        assertTrue(ExecutionStatus.PENDING_APPROVAL.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.PENDING_APPROVAL.canTransitionTo(ExecutionStatus.CANCELLED));
        assertFalse(ExecutionStatus.PENDING_APPROVAL.canTransitionTo(ExecutionStatus.COMPLETED));
    }

    @Test
    void failed_retriesThroughRetrying() {
        assertTrue(ExecutionStatus.FAILED.canTransitionTo(ExecutionStatus.RETRYING));
        assertFalse(ExecutionStatus.FAILED.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.RETRYING.canTransitionTo(ExecutionStatus.RUNNING));
    }

    @Test
    void terminalStates_shouldNotTransition() {
        for (ExecutionStatus target : ExecutionStatus.values()) {
            assertFalse(ExecutionStatus.COMPLETED.canTransitionTo(target));
            assertFalse(ExecutionStatus.TIMEOUT.canTransitionTo(target));
            assertFalse(ExecutionStatus.CANCELLED.canTransitionTo(target));
        }
    }

    @Test
    void timeout_isNeverRetried() {
        assertFalse(ExecutionStatus.TIMEOUT.canTransitionTo(ExecutionStatus.RETRYING));
        assertFalse(ExecutionStatus.TIMEOUT.canTransitionTo(ExecutionStatus.RUNNING));
    }
}
