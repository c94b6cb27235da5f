package com.autoflow.engine.approval;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionStatus;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.repository.ActionRepository;
import com.autoflow.core.repository.ApprovalRequestRepository;
import com.autoflow.engine.logging.LoggingContext;
import com.autoflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates approval requests for actions and records approver decisions.
 * This is the only component that changes an approval's status.
 *
 * Decisions are compare-and-set on the PENDING status: of two concurrent
 * decisions on the same request, exactly one succeeds.
 */
public class ApprovalManager {

    private static final Logger log = LoggerFactory.getLogger(ApprovalManager.class);

    public static final double DEFAULT_AUTO_APPROVAL_THRESHOLD = 0.8;

    static final String AUTO_APPROVED_REASON = "Auto-approved based on high confidence score";
    static final String DEFAULT_APPROVE_REASON = "Approved by approver";
    static final String DEFAULT_REJECT_REASON = "Rejected by approver";

    private final ApprovalRequestRepository approvalRepository;
    private final ActionRepository actionRepository;
    private final ApproverPolicy approverPolicy;
    private final ApprovalChannel approvalChannel;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final double autoApprovalThreshold;

    public ApprovalManager(
            ApprovalRequestRepository approvalRepository,
            ActionRepository actionRepository,
            ApproverPolicy approverPolicy,
            ApprovalChannel approvalChannel,
            WorkflowMetrics metrics,
            Clock clock,
            double autoApprovalThreshold) {
        if (autoApprovalThreshold < 0.0 || autoApprovalThreshold > 1.0) {
            throw new IllegalArgumentException("autoApprovalThreshold must be within [0, 1]");
        }
        this.approvalRepository = approvalRepository;
        this.actionRepository = actionRepository;
        this.approverPolicy = approverPolicy;
        this.approvalChannel = approvalChannel;
        this.metrics = metrics;
        this.clock = clock;
        this.autoApprovalThreshold = autoApprovalThreshold;
    }

    /**
     * Create the approval request for an action.
     * Auto-approves when the confidence reaches the effective threshold and the action
     * does not demand a human decision. Otherwise the request is stored as PENDING.
     *
     * A pending request is not sent to the approver here: the caller links it to the
     * waiting execution first and then calls {@link #publish(ApprovalRequest)}.
     */
    public ApprovalRequest requestApproval(Action action, String requesterId) {
        Instant now = clock.instant();
        double confidence = ConfidenceScorer.score(action);
        double threshold = Math.max(autoApprovalThreshold, action.approvalConfidenceThreshold());
        boolean autoApprove = confidence >= threshold && !action.requiresApproval();

        ApprovalRequest request = new ApprovalRequest(
            UUID.randomUUID(),
            action.id(),
            action.kind(),
            requesterId,
            approverPolicy.approverFor(action, requesterId),
            describe(action),
            action.priority(),
            action.payload(),
            confidence,
            ConfidenceScorer.reasoning(action.kind()),
            autoApprove ? ApprovalStatus.AUTO_APPROVED : ApprovalStatus.PENDING,
            now,
            autoApprove ? now : null,
            autoApprove ? AUTO_APPROVED_REASON : null
        );
        approvalRepository.save(request);

        try (var ctx = LoggingContext.forApproval(request.id())) {
            if (autoApprove) {
                actionRepository.updateStatus(action.id(), ActionStatus.APPROVED);
                metrics.approvalAutoApproved();
                log.info("Action {} ({}) auto-approved with confidence {}",
                    action.id(), action.kind(), confidence);
            } else {
                actionRepository.updateStatus(action.id(), ActionStatus.AWAITING_APPROVAL);
                metrics.approvalPending();
                log.info("Action {} ({}) awaiting approval by {} (confidence {}, threshold {})",
                    action.id(), action.kind(), request.approverId(), confidence, threshold);
            }
        }
        return request;
    }

    /**
     * Send a pending request to the approver channel. Requests that are no longer
     * pending are skipped. A channel failure is logged and the request stays pending.
     */
    public void publish(ApprovalRequest request) {
        if (request.status() != ApprovalStatus.PENDING) {
            return;
        }
        try (var ctx = LoggingContext.forApproval(request.id())) {
            approvalChannel.publish(request);
        } catch (RuntimeException e) {
            // Still listed for the approver
            log.error("Failed to publish approval {} to {}", request.id(), request.approverId(), e);
        }
    }

    /**
     * Approve a pending request.
     *
     * @return false if the request is not pending or the approver does not match
     */
    public boolean approve(UUID approvalId, String approverId, String reason) {
        return decide(approvalId, approverId, ApprovalStatus.APPROVED,
            isBlank(reason) ? DEFAULT_APPROVE_REASON : reason);
    }

    /**
     * Reject a pending request.
     *
     * @return false if the request is not pending or the approver does not match
     */
    public boolean reject(UUID approvalId, String approverId, String reason) {
        return decide(approvalId, approverId, ApprovalStatus.REJECTED,
            isBlank(reason) ? DEFAULT_REJECT_REASON : reason);
    }

    public Optional<ApprovalRequest> find(UUID approvalId) {
        return approvalRepository.findById(approvalId);
    }

    /**
     * Pending requests assigned to an approver.
     */
    public List<ApprovalRequest> pendingFor(String approverId) {
        return approvalRepository.findPendingByApprover(approverId);
    }

    /**
     * Requests where the user is requester or approver, newest first.
     */
    public List<ApprovalRequest> historyFor(String userId) {
        return approvalRepository.findByParticipant(userId);
    }

    // ========== Internal Methods ==========

    private boolean decide(UUID approvalId, String approverId, ApprovalStatus decision, String reason) {
        try (var ctx = LoggingContext.forApproval(approvalId)) {
            Optional<ApprovalRequest> pending = approvalRepository.findPending(approvalId);
            if (pending.isEmpty()) {
                log.debug("Approval {} is not pending, ignoring {}", approvalId, decision);
                return false;
            }
            ApprovalRequest request = pending.get();
            if (!request.approverId().equals(approverId)) {
                metrics.approverMismatch();
                log.warn("Approver mismatch on {}: expected {}, got {}",
                    approvalId, request.approverId(), approverId);
                return false;
            }

            ApprovalRequest resolved = request.resolve(decision, reason, clock.instant());
            if (!approvalRepository.resolvePending(resolved)) {
                log.debug("Approval {} was resolved concurrently", approvalId);
                return false;
            }

            if (decision == ApprovalStatus.APPROVED) {
                actionRepository.updateStatus(request.actionId(), ActionStatus.APPROVED);
                metrics.approvalApproved();
            } else {
                actionRepository.updateStatus(request.actionId(), ActionStatus.REJECTED);
                metrics.approvalRejected();
            }
            log.info("Approval {} {} by {}: {}", approvalId, decision, approverId, reason);
            return true;
        }
    }

    private static String describe(Action action) {
        String title = action.payload().path("title").asText("");
        if (!title.isBlank()) {
            return title;
        }
        return action.kind().name().toLowerCase(Locale.ROOT) + " action: " + action.operation();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
