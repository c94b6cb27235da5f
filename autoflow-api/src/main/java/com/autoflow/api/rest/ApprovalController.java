package com.autoflow.api.rest;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.engine.approval.ApprovalManager;
import com.autoflow.engine.coordinator.ApprovalCoordinator;
import com.autoflow.engine.coordinator.ApprovalCoordinator.ApprovalCallback;
import com.autoflow.engine.coordinator.ApprovalCoordinator.DecisionOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for approvers: pending work, history and the decision callback.
 */
@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

    private final ApprovalManager approvalManager;
    private final ApprovalCoordinator approvalCoordinator;

    public ApprovalController(ApprovalManager approvalManager, ApprovalCoordinator approvalCoordinator) {
        this.approvalManager = approvalManager;
        this.approvalCoordinator = approvalCoordinator;
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ApprovalResponse>> pending(@RequestParam(name = "approver_id") String approverId) {
        return ResponseEntity.ok(approvalManager.pendingFor(approverId).stream()
            .map(ApprovalResponse::from)
            .toList());
    }

    /**
     * Requests raised by, or assigned to, a user.
     */
    @GetMapping("/history")
    public ResponseEntity<List<ApprovalResponse>> history(@RequestParam(name = "user_id") String userId) {
        return ResponseEntity.ok(approvalManager.historyFor(userId).stream()
            .map(ApprovalResponse::from)
            .toList());
    }

    /**
     * Apply an approver's decision. A decision that does not apply (wrong approver,
     * already resolved) is answered with {@code applied: false}.
     */
    @PostMapping("/callback")
    public ResponseEntity<DecisionResponse> callback(@RequestBody CallbackRequest request) {
        if (request.approvalId() == null) {
            throw new WorkflowValidationException("approval_id is required");
        }
        DecisionOutcome outcome = approvalCoordinator.decide(new ApprovalCallback(
            request.approvalId(),
            request.approverId(),
            request.decision(),
            request.reason()
        ));
        ApprovalStatus status = approvalManager.find(request.approvalId())
            .map(ApprovalRequest::status)
            .orElse(null);
        return ResponseEntity.ok(new DecisionResponse(outcome.applied(), status, outcome.executionId()));
    }

    // ========== DTOs ==========

    public record CallbackRequest(
        UUID approvalId,
        String approverId,
        String decision,
        String reason
    ) {}

    public record DecisionResponse(
        boolean applied,
        ApprovalStatus status,
        UUID executionId
    ) {}

    public record ApprovalResponse(
        UUID id,
        UUID actionId,
        ActionKind actionKind,
        String requesterId,
        String approverId,
        String description,
        ActionPriority priority,
        JsonNode payload,
        double confidenceScore,
        String reasoning,
        ApprovalStatus status,
        Instant createdAt,
        Instant respondedAt,
        String responseReason
    ) {
        public static ApprovalResponse from(ApprovalRequest request) {
            return new ApprovalResponse(
                request.id(),
                request.actionId(),
                request.actionKind(),
                request.requesterId(),
                request.approverId(),
                request.description(),
                request.priority(),
                request.payload(),
                request.confidenceScore(),
                request.reasoning(),
                request.status(),
                request.createdAt(),
                request.respondedAt(),
                request.responseReason()
            );
        }
    }
}
