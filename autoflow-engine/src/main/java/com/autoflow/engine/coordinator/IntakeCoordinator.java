package com.autoflow.engine.coordinator;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.Action;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.ActionRepository;
import com.autoflow.engine.approval.ApprovalManager;
import com.autoflow.engine.service.ExecutionService.StartExecutionRequest;
import com.autoflow.triage.EventClassifier;
import com.autoflow.triage.TriageResult;
import com.autoflow.triage.compiler.ActionCompilerRegistry;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an inbound trigger event into an action and, through the routing table,
 * into a workflow execution.
 *
 * classify -> compile -> persist action -> request approval -> start or park execution
 *
 * A pending approval is published only once the parked execution references it, so
 * a decision that arrives straight away always finds its execution.
 *
 * Validation, classification and compilation failures never create an execution.
 */
public class IntakeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IntakeCoordinator.class);

    private final EventClassifier classifier;
    private final ActionCompilerRegistry compilers;
    private final ActionRepository actionRepository;
    private final ApprovalManager approvalManager;
    private final ActionRoutingTable routingTable;
    private final WorkflowCoordinator workflowCoordinator;

    public IntakeCoordinator(
            EventClassifier classifier,
            ActionCompilerRegistry compilers,
            ActionRepository actionRepository,
            ApprovalManager approvalManager,
            ActionRoutingTable routingTable,
            WorkflowCoordinator workflowCoordinator) {
        this.classifier = classifier;
        this.compilers = compilers;
        this.actionRepository = actionRepository;
        this.approvalManager = approvalManager;
        this.routingTable = routingTable;
        this.workflowCoordinator = workflowCoordinator;
    }

    public IntakeResult submit(TriggerEvent event) {
        validate(event);

        TriageResult triage = classifier.triage(event);
        Action action = compilers.compile(triage, event);
        actionRepository.save(action);
        log.info("Event from {} via {} classified {} and compiled to {} action {} ({})",
            event.userId(), event.source().value(), triage.category().value(),
            action.kind(), action.id(), action.priority());

        ApprovalRequest approval = approvalManager.requestApproval(action, event.userId());

        String workflowId = routingTable.workflowFor(action.kind());
        StartExecutionRequest request = new StartExecutionRequest(
            workflowId, null, routedPayload(action, event), action.id(),
            action.maxRetries(), action.timeout());

        WorkflowExecution execution;
        if (approval.status() == ApprovalStatus.AUTO_APPROVED) {
            execution = workflowCoordinator.startExecution(request);
        } else {
            execution = workflowCoordinator.createExecution(
                request, ExecutionStatus.PENDING_APPROVAL, approval.id());
            approvalManager.publish(approval);
        }
        return new IntakeResult(triage.category().value(), action, approval, execution);
    }

    private void validate(TriggerEvent event) {
        List<String> violations = new ArrayList<>();
        if (event == null) {
            throw new WorkflowValidationException("Trigger event is required");
        }
        if (event.content() == null) {
            violations.add("content is required");
        }
        if (event.source() == null) {
            violations.add("source is required");
        }
        if (event.userId() == null || event.userId().isBlank()) {
            violations.add("user_id cannot be blank");
        }
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException("Trigger event", violations);
        }
    }

    /**
     * Action payload plus the fields that identify the action and its origin.
     */
    static ObjectNode routedPayload(Action action, TriggerEvent event) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        if (action.payload().isObject()) {
            payload.setAll((ObjectNode) action.payload().deepCopy());
        }
        payload.put("action_id", action.id().toString());
        payload.put("action_kind", action.kind().name());
        payload.put("operation", action.operation());
        payload.put("priority", action.priority().name());
        payload.put("source", event.source().value());
        payload.put("user_id", event.userId());
        payload.put("content", event.content());
        return payload;
    }

    /**
     * @param category  triage category of the event
     * @param action    compiled action
     * @param approval  approval request, auto-approved or pending
     * @param execution started execution, or one parked in PENDING_APPROVAL
     */
    public record IntakeResult(
        String category,
        Action action,
        ApprovalRequest approval,
        WorkflowExecution execution
    ) {
    }
}
