package com.autoflow.api.rest;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.StepRecord;
import com.autoflow.core.model.StepStatus;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.engine.service.ExecutionService;
import com.autoflow.engine.service.ExecutionService.ExecutionQuery;
import com.autoflow.engine.service.ExecutionService.StartExecutionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for starting, inspecting and cancelling executions.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private final ExecutionService executionService;

    public ExecutionController(ExecutionService executionService) {
        this.executionService = executionService;
    }

    /**
     * Start an execution of the latest, or a pinned, version of a workflow.
     */
    @PostMapping
    public ResponseEntity<ExecutionResponse> startExecution(@RequestBody StartExecutionDto request) {
        WorkflowExecution execution = executionService.startExecution(new StartExecutionRequest(
            request.workflowId(),
            request.version(),
            request.triggerPayload(),
            null
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(ExecutionResponse.from(execution));
    }

    @GetMapping
    public ResponseEntity<List<ExecutionResponse>> queryExecutions(
            @RequestParam(name = "workflow_id", required = false) String workflowId,
            @RequestParam(required = false) ExecutionStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        List<ExecutionResponse> responses = executionService
            .queryExecutions(new ExecutionQuery(workflowId, status, limit))
            .stream()
            .map(ExecutionResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionResponse> getExecution(@PathVariable UUID executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(executionService.getExecution(executionId)));
    }

    /**
     * Step records across all attempts, in execution order.
     */
    @GetMapping("/{executionId}/steps")
    public ResponseEntity<List<StepRecordResponse>> getSteps(@PathVariable UUID executionId) {
        executionService.getExecution(executionId);
        List<StepRecordResponse> steps = executionService.getSteps(executionId).stream()
            .map(StepRecordResponse::from)
            .toList();
        return ResponseEntity.ok(steps);
    }

    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<CancelResponse> cancelExecution(@PathVariable UUID executionId) {
        boolean cancelled = executionService.cancelExecution(executionId);
        WorkflowExecution execution = executionService.getExecution(executionId);
        return ResponseEntity.ok(new CancelResponse(cancelled, ExecutionResponse.from(execution)));
    }

    // ========== DTOs ==========

    public record StartExecutionDto(
        String workflowId,
        Integer version,
        JsonNode triggerPayload
    ) {}

    public record CancelResponse(boolean cancelled, ExecutionResponse execution) {}

    public record ExecutionResponse(
        UUID executionId,
        String workflowId,
        int workflowVersion,
        ExecutionStatus status,
        String checkpointStepId,
        JsonNode triggerPayload,
        JsonNode result,
        UUID actionId,
        UUID approvalId,
        String error,
        String errorCode,
        int retryCount,
        int maxRetries,
        Instant nextAttemptAt,
        Instant createdAt,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt
    ) {
        public static ExecutionResponse from(WorkflowExecution execution) {
            return new ExecutionResponse(
                execution.executionId(),
                execution.workflowId(),
                execution.workflowVersion(),
                execution.status(),
                execution.checkpointStepId(),
                execution.triggerPayload(),
                execution.result(),
                execution.actionId(),
                execution.approvalId(),
                execution.error(),
                execution.errorCode(),
                execution.retryCount(),
                execution.maxRetries(),
                execution.nextAttemptAt(),
                execution.createdAt(),
                execution.startedAt(),
                execution.updatedAt(),
                execution.completedAt()
            );
        }
    }

    public record StepRecordResponse(
        UUID recordId,
        String stepId,
        StepType stepType,
        int attempt,
        StepStatus status,
        Instant startedAt,
        Instant completedAt,
        JsonNode result,
        String error,
        String errorCode
    ) {
        public static StepRecordResponse from(StepRecord record) {
            return new StepRecordResponse(
                record.recordId(),
                record.stepId(),
                record.stepType(),
                record.attempt(),
                record.status(),
                record.startedAt(),
                record.completedAt(),
                record.result(),
                record.error(),
                record.errorCode()
            );
        }
    }
}
