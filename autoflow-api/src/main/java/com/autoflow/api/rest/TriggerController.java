package com.autoflow.api.rest;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.core.model.TriggerSource;
import com.autoflow.engine.coordinator.IntakeCoordinator;
import com.autoflow.engine.coordinator.IntakeCoordinator.IntakeResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for raw events: classified, compiled to an action and routed to a workflow.
 */
@RestController
@RequestMapping("/api/v1/triggers")
public class TriggerController {

    private final IntakeCoordinator intakeCoordinator;

    public TriggerController(IntakeCoordinator intakeCoordinator) {
        this.intakeCoordinator = intakeCoordinator;
    }

    @PostMapping
    public ResponseEntity<TriggerResponse> submit(@RequestBody TriggerRequest request) {
        IntakeResult result = intakeCoordinator.submit(new TriggerEvent(
            request.content(),
            resolveSource(request.source()),
            request.userId(),
            request.metadata()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(TriggerResponse.from(result));
    }

    private static TriggerSource resolveSource(String source) {
        if (source == null) {
            return null;
        }
        return TriggerSource.find(source).orElseThrow(() ->
            new WorkflowValidationException("Trigger event", List.of("source is unknown: " + source)));
    }

    // ========== DTOs ==========

    public record TriggerRequest(
        String content,
        String source,
        String userId,
        JsonNode metadata
    ) {}

    public record TriggerResponse(
        String category,
        UUID actionId,
        ActionKind actionKind,
        String operation,
        ActionPriority priority,
        UUID approvalId,
        ApprovalStatus approvalStatus,
        String approverId,
        double confidenceScore,
        UUID executionId,
        String workflowId,
        ExecutionStatus executionStatus
    ) {
        public static TriggerResponse from(IntakeResult result) {
            return new TriggerResponse(
                result.category(),
                result.action().id(),
                result.action().kind(),
                result.action().operation(),
                result.action().priority(),
                result.approval().id(),
                result.approval().status(),
                result.approval().approverId(),
                result.approval().confidenceScore(),
                result.execution().executionId(),
                result.execution().workflowId(),
                result.execution().status()
            );
        }
    }
}
