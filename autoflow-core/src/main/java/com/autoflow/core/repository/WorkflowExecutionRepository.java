package com.autoflow.core.repository;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.WorkflowExecution;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow executions.
 * Every change after insert goes through {@link #compareAndSetStatus}, so an executor
 * finishing a walk and a supervisor timing it out can never overwrite each other.
 */
public interface WorkflowExecutionRepository {

    /**
     * Insert a new execution.
     */
    void save(WorkflowExecution execution);

    /**
     * Find an execution by ID.
     */
    Optional<WorkflowExecution> findById(UUID executionId);

    /**
     * Replace the stored execution only if its current status equals {@code expected}.
     *
     * @param executionId the execution to update
     * @param expected    status the caller last observed
     * @param updated     full replacement record
     * @return true if the write happened
     */
    boolean compareAndSetStatus(UUID executionId, ExecutionStatus expected, WorkflowExecution updated);

    /**
     * Find executions by status, oldest first.
     */
    List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit);

    /**
     * Find RUNNING executions not updated for longer than their running timeout,
     * or than {@code defaultTimeout} when they carry none. Least recently updated first.
     */
    List<WorkflowExecution> findRunningTimedOut(Instant now, Duration defaultTimeout, int limit);

    /**
     * Find executions in a status created before the cutoff.
     * Used for stale PENDING detection.
     */
    List<WorkflowExecution> findByStatusCreatedBefore(ExecutionStatus status, Instant cutoff, int limit);

    /**
     * Find RETRYING executions whose scheduled attempt is before the cutoff.
     */
    List<WorkflowExecution> findRetryingDueBefore(Instant cutoff, int limit);

    /**
     * Find FAILED executions with retries left, least recently updated first.
     */
    List<WorkflowExecution> findRetryableFailed(int limit);

    /**
     * Find FAILED executions with no retries left whose last update falls in {@code (after, until]},
     * least recently updated first.
     */
    List<WorkflowExecution> findExhaustedUpdatedBetween(Instant after, Instant until, int limit);

    /**
     * Find the execution waiting on the given approval request.
     */
    Optional<WorkflowExecution> findByApprovalId(UUID approvalId);

    /**
     * Find executions of a workflow, newest first.
     */
    List<WorkflowExecution> findByWorkflowId(String workflowId, int limit);

    /**
     * Count executions per status.
     */
    Map<ExecutionStatus, Long> countByStatus();

    /**
     * Delete terminal executions completed before the given time.
     *
     * @return ids of deleted executions
     */
    List<UUID> deleteTerminalBefore(Instant completedBefore);
}
