package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of a human approval decision for one action.
 *
 * Invariants:
 * - exactly one request per gated action
 * - confidenceScore in [0, 1]
 * - respondedAt set iff status is resolved
 * - only the named approver may resolve a PENDING request
 */
public record ApprovalRequest(
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
    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    /**
     * Check if the given user took part in this request as requester or approver.
     */
    public boolean involves(String userId) {
        return userId != null && (userId.equals(requesterId) || userId.equals(approverId));
    }

    /**
     * Create a resolved copy.
     */
    public ApprovalRequest resolve(ApprovalStatus newStatus, String reason, Instant respondedAt) {
        return new ApprovalRequest(
            id, actionId, actionKind, requesterId, approverId, description, priority,
            payload, confidenceScore, reasoning, newStatus, createdAt, respondedAt, reason
        );
    }
}
