package com.autoflow.core.repository;

import com.autoflow.core.model.ApprovalRequest;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store for approval requests. The pending index is the set of requests in PENDING status.
 */
public interface ApprovalRequestRepository {

    /**
     * Insert a request. Every request is kept, so this is also the approval history.
     */
    void save(ApprovalRequest request);

    Optional<ApprovalRequest> findById(UUID approvalId);

    /**
     * Find a pending request. Resolved requests are invisible here.
     */
    Optional<ApprovalRequest> findPending(UUID approvalId);

    /**
     * Replace a request only if it is still PENDING.
     * The first caller wins; later callers observe false.
     */
    boolean resolvePending(ApprovalRequest resolved);

    /**
     * Pending requests routed to an approver, oldest first.
     */
    List<ApprovalRequest> findPendingByApprover(String approverId);

    /**
     * Requests where the user is requester or approver, newest first.
     */
    List<ApprovalRequest> findByParticipant(String userId);

    /**
     * Resolved requests, auto-approvals included, whose response time falls in
     * {@code (after, until]}, earliest response first.
     */
    List<ApprovalRequest> findResolvedBetween(Instant after, Instant until, int limit);

    long countPending();
}
