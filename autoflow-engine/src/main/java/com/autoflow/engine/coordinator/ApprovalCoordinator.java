package com.autoflow.engine.coordinator;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.WorkflowExecutionRepository;
import com.autoflow.engine.approval.ApprovalManager;
import com.autoflow.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Inbound side of the approval channel. Applies an approver's decision and then
 * resumes or cancels the execution waiting on it.
 *
 * A decision can land while the walk that requested it is still running, for example
 * when the channel answers synchronously. The decision is recorded either way, and the
 * supervisor continues the execution once it is parked.
 */
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    private final ApprovalManager approvalManager;
    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowCoordinator workflowCoordinator;

    public ApprovalCoordinator(
            ApprovalManager approvalManager,
            WorkflowExecutionRepository executionRepository,
            WorkflowCoordinator workflowCoordinator) {
        this.approvalManager = approvalManager;
        this.executionRepository = executionRepository;
        this.workflowCoordinator = workflowCoordinator;
    }

    /**
     * Apply a decision from the approval callback.
     *
     * @return whether the decision was applied, and the linked execution if any
     */
    public DecisionOutcome decide(ApprovalCallback callback) {
        Decision decision = Decision.parse(callback.decision());
        try (var ctx = LoggingContext.forApproval(callback.approvalId())) {
            boolean applied = decision == Decision.APPROVE
                ? approvalManager.approve(callback.approvalId(), callback.approverId(), callback.reason())
                : approvalManager.reject(callback.approvalId(), callback.approverId(), callback.reason());
            if (!applied) {
                return new DecisionOutcome(false, null);
            }

            ApprovalRequest resolved = approvalManager.find(callback.approvalId())
                .orElseThrow(() -> new IllegalStateException("Resolved approval vanished: " + callback.approvalId()));
            Optional<WorkflowExecution> waiting = executionRepository.findByApprovalId(callback.approvalId());
            if (waiting.isEmpty()) {
                log.info("No execution waits on approval {}", callback.approvalId());
                return new DecisionOutcome(true, null);
            }

            UUID executionId = waiting.get().executionId();
            if (!workflowCoordinator.resumeDecided(executionId, resolved)) {
                // The execution is still mid-walk here; the supervisor picks it up once it is parked
                log.info("Execution {} not continued on approval {}, left for the supervisor",
                    executionId, callback.approvalId());
            }
            return new DecisionOutcome(true, executionId);
        }
    }

    /**
     * Callback payload: {@code {approval_id, approver_id, decision, reason?}}.
     */
    public record ApprovalCallback(UUID approvalId, String approverId, String decision, String reason) {
    }

    /**
     * @param applied     false when the request was not pending or the approver did not match
     * @param executionId execution resumed or cancelled by the decision, if any
     */
    public record DecisionOutcome(boolean applied, UUID executionId) {
    }

    enum Decision {
        APPROVE,
        REJECT;

        static Decision parse(String raw) {
            if (raw == null) {
                throw new WorkflowValidationException("decision is required");
            }
            return switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "approve", "approved" -> APPROVE;
                case "reject", "rejected" -> REJECT;
                default -> throw new WorkflowValidationException(
                    "decision must be approve or reject, got '" + raw + "'");
            };
        }
    }
}
