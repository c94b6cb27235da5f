package com.autoflow.engine.service;

import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.StepRecord;
import com.autoflow.core.model.WorkflowExecution;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Execution control: start, inspect and cancel workflow executions.
 */
public interface ExecutionService {

    /**
     * Create an execution of a workflow and dispatch it.
     *
     * @param request the start request
     * @return the created execution, still PENDING when returned
     * @throws com.autoflow.core.exception.NotFoundException if the workflow is unknown
     * @throws com.autoflow.core.exception.WorkflowValidationException if the workflow is disabled
     */
    WorkflowExecution startExecution(StartExecutionRequest request);

    /**
     * @throws com.autoflow.core.exception.NotFoundException if the execution is unknown
     */
    WorkflowExecution getExecution(UUID executionId);

    /**
     * Step records of an execution across all attempts.
     */
    List<StepRecord> getSteps(UUID executionId);

    List<WorkflowExecution> queryExecutions(ExecutionQuery query);

    /**
     * Move a non-terminal execution to CANCELLED.
     * A running walk notices at its next connection boundary.
     *
     * @return false if the execution was already terminal
     */
    boolean cancelExecution(UUID executionId);

    /**
     * Claim a dispatchable execution and walk it in the background.
     *
     * @return false if the execution could not be claimed
     */
    boolean dispatch(UUID executionId);

    /**
     * Carry out a resolved approval on the execution parked on it: an approval resumes
     * the execution, a rejection cancels it.
     *
     * @return false if the execution is no longer waiting, is already in flight here,
     *         or the request is still pending
     */
    boolean resumeDecided(UUID executionId, ApprovalRequest decision);

    /**
     * Request to start an execution. A null version starts the latest one.
     * A null maxRetries or runningTimeout leaves the engine and supervisor defaults in place.
     */
    record StartExecutionRequest(
        String workflowId,
        Integer version,
        JsonNode triggerPayload,
        UUID actionId,
        Integer maxRetries,
        Duration runningTimeout
    ) {
        public StartExecutionRequest(String workflowId, Integer version, JsonNode triggerPayload, UUID actionId) {
            this(workflowId, version, triggerPayload, actionId, null, null);
        }

        public static StartExecutionRequest of(String workflowId, JsonNode triggerPayload) {
            return new StartExecutionRequest(workflowId, null, triggerPayload, null);
        }
    }

    /**
     * Query criteria for executions. Null fields do not filter.
     */
    record ExecutionQuery(
        String workflowId,
        ExecutionStatus status,
        int limit
    ) {
        public ExecutionQuery {
            if (limit <= 0) {
                limit = 50;
            }
        }
    }
}
