package com.autoflow.engine.executor;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.model.Connection;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.StepRecord;
import com.autoflow.core.model.StepStatus;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.ActionRepository;
import com.autoflow.core.repository.StepRecordRepository;
import com.autoflow.core.repository.WorkflowExecutionRepository;
import com.autoflow.engine.approval.ApprovalManager;
import com.autoflow.engine.logging.LoggingContext;
import com.autoflow.engine.metrics.WorkflowMetrics;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandlerRegistry;
import com.autoflow.worker.StepResult;
import com.autoflow.worker.TemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Walks a workflow definition for one execution.
 *
 * The walk starts at the trigger and repeatedly follows the first outgoing connection
 * whose guard passes, in declaration order. It ends when no connection passes.
 * Step failures, cancellation and internal errors are all reported through the
 * returned execution; the executor never throws.
 *
 * Every status change is a compare-and-set against RUNNING, so a supervisor timeout
 * or an explicit cancel that lands mid-walk wins: the walk stops at the next
 * connection boundary and returns the stored record.
 */
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    static final String GATE_OPERATION = "approval_gate";

    private final WorkflowExecutionRepository executionRepository;
    private final StepRecordRepository stepRecordRepository;
    private final ActionRepository actionRepository;
    private final StepHandlerRegistry handlers;
    private final ApprovalManager approvalManager;
    private final ConditionEvaluator conditionEvaluator;
    private final TemplateRenderer templateRenderer;
    private final WorkflowMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GraphExecutor(
            WorkflowExecutionRepository executionRepository,
            StepRecordRepository stepRecordRepository,
            ActionRepository actionRepository,
            StepHandlerRegistry handlers,
            ApprovalManager approvalManager,
            ConditionEvaluator conditionEvaluator,
            TemplateRenderer templateRenderer,
            WorkflowMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.executionRepository = executionRepository;
        this.stepRecordRepository = stepRecordRepository;
        this.actionRepository = actionRepository;
        this.handlers = handlers;
        this.approvalManager = approvalManager;
        this.conditionEvaluator = conditionEvaluator;
        this.templateRenderer = templateRenderer;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Create an execution for the payload and walk it to completion in the calling thread.
     */
    public WorkflowExecution run(WorkflowDefinition definition, JsonNode triggerPayload) {
        Instant now = clock.instant();
        WorkflowExecution created = WorkflowExecution.create(
            definition, triggerPayload, null, 0, ExecutionStatus.PENDING, now);
        executionRepository.save(created);
        WorkflowExecution claimed = created.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .startedAt(now)
            .updatedAt(now)
            .build();
        if (!executionRepository.compareAndSetStatus(created.executionId(), ExecutionStatus.PENDING, claimed)) {
            return reload(created);
        }
        return execute(definition, claimed);
    }

    /**
     * Walk an execution the caller has already moved to RUNNING, starting at the trigger.
     */
    public WorkflowExecution execute(WorkflowDefinition definition, WorkflowExecution claimed) {
        try (var ctx = LoggingContext.forExecution(claimed.executionId(), claimed.workflowId())) {
            try {
                metrics.executionStarted(claimed.workflowId());
                log.info("Walking {} (attempt {})", definition.versionKey(), claimed.retryCount());
                ExecutionContext context = ExecutionContext.initial(definition, claimed.triggerPayload());
                return walk(definition, claimed, context, definition.trigger().id(), new HashSet<>());
            } catch (RuntimeException e) {
                log.error("Walk of execution {} aborted by an internal error", claimed.executionId(), e);
                return finishFailed(claimed, null, ErrorCodes.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Continue an execution that was paused at an approval gate and has been approved.
     * The caller has moved it back to RUNNING; its result holds the checkpoint context.
     */
    public WorkflowExecution resume(
            WorkflowDefinition definition,
            WorkflowExecution claimed,
            String gateStepId,
            ApprovalRequest decision) {
        try (var ctx = LoggingContext.forExecution(claimed.executionId(), claimed.workflowId())) {
            try {
                ExecutionContext context = ExecutionContext.restore(claimed.result());
                List<StepRecord> records = stepRecordRepository.findByExecutionAndAttempt(
                    claimed.executionId(), claimed.retryCount());

                Set<String> visited = new HashSet<>();
                records.forEach(r -> visited.add(r.stepId()));

                ObjectNode output = gateOutput(decision);
                findGateRecord(records, gateStepId).ifPresent(record ->
                    stepRecordRepository.update(record.complete(output, clock.instant())));
                context.merge(gateStepId, output);

                log.info("Resuming after gate {} approved by {}", gateStepId, decision.approverId());
                return walk(definition, claimed, context, gateStepId, visited);
            } catch (RuntimeException e) {
                log.error("Resume of execution {} aborted by an internal error", claimed.executionId(), e);
                return finishFailed(claimed, null, ErrorCodes.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Close a gate whose approval was rejected: the gate step fails and the execution is cancelled.
     */
    public WorkflowExecution rejectAtGate(WorkflowExecution paused, ApprovalRequest decision) {
        try (var ctx = LoggingContext.forExecution(paused.executionId(), paused.workflowId())) {
            Instant now = clock.instant();
            String reason = "Approval rejected by " + decision.approverId() + ": " + decision.responseReason();
            if (paused.checkpointStepId() != null) {
                List<StepRecord> records = stepRecordRepository.findByExecutionAndAttempt(
                    paused.executionId(), paused.retryCount());
                findGateRecord(records, paused.checkpointStepId()).ifPresent(record ->
                    stepRecordRepository.update(record.fail(ErrorCodes.APPROVAL_REJECTED, reason, now)));
            }
            WorkflowExecution cancelled = paused.toBuilder()
                .status(ExecutionStatus.CANCELLED)
                .checkpointStepId(null)
                .error(ErrorCodes.APPROVAL_REJECTED, reason)
                .updatedAt(now)
                .completedAt(now)
                .build();
            if (!executionRepository.compareAndSetStatus(paused.executionId(), paused.status(), cancelled)) {
                return reload(paused);
            }
            metrics.executionCancelled(paused.workflowId());
            log.info("Execution {} cancelled: {}", paused.executionId(), reason);
            return cancelled;
        }
    }

    // ========== Walk ==========

    private WorkflowExecution walk(
            WorkflowDefinition definition,
            WorkflowExecution execution,
            ExecutionContext context,
            String startNodeId,
            Set<String> visited) {
        int attempt = execution.retryCount();
        String current = startNodeId;

        while (true) {
            Optional<Connection> next = firstPassing(definition.outgoing(current), context);
            if (next.isEmpty()) {
                return finishCompleted(execution, context);
            }
            Step step = definition.getStep(next.get().toId())
                .orElseThrow(() -> new IllegalStateException(
                    "Connection " + next.get().id() + " targets unknown step " + next.get().toId()));

            // Cancellation and timeout are honored only here, between steps
            WorkflowExecution stored = reload(execution);
            if (stored.status() != ExecutionStatus.RUNNING) {
                log.info("Execution {} is {}, stopping before step {}",
                    execution.executionId(), stored.status(), step.id());
                return stored;
            }

            if (!visited.add(step.id())) {
                return finishFailed(execution, context, ErrorCodes.CYCLE_DETECTED,
                    "Step " + step.id() + " was reached twice in one walk");
            }

            try (var stepCtx = LoggingContext.forStep(step.id(), attempt)) {
                if (!conditionEvaluator.allPass(step.conditions(), context.values())) {
                    stepRecordRepository.save(
                        StepRecord.skipped(execution.executionId(), step, attempt, clock.instant()));
                    log.debug("Step {} skipped, conditions not met", step.id());
                    current = step.id();
                    continue;
                }

                if (step.type() == StepType.APPROVAL_GATE) {
                    Optional<WorkflowExecution> paused = passGate(execution, step, attempt, context);
                    if (paused.isPresent()) {
                        return paused.get();
                    }
                } else {
                    StepRecord finished = dispatch(execution, step, attempt, context);
                    if (finished.status() == StepStatus.FAILED && !step.continueOnFailure()) {
                        return finishFailed(execution, context, finished.errorCode(), finished.error());
                    }
                }
            }

            Optional<WorkflowExecution> heartbeat = heartbeat(execution);
            if (heartbeat.isEmpty()) {
                return reload(execution);
            }
            execution = heartbeat.get();
            current = step.id();
        }
    }

    private Optional<Connection> firstPassing(List<Connection> connections, ExecutionContext context) {
        for (Connection connection : connections) {
            if (conditionEvaluator.evaluate(connection.guard(), context.values())) {
                return Optional.of(connection);
            }
        }
        return Optional.empty();
    }

    private StepRecord dispatch(WorkflowExecution execution, Step step, int attempt, ExecutionContext context) {
        Instant startedAt = clock.instant();
        StepRecord record = StepRecord.running(execution.executionId(), step, attempt, startedAt);
        stepRecordRepository.save(record);

        JsonNode config = templateRenderer.render(step.config(), context.values());
        StepContext stepContext = new StepContext(
            execution.executionId(), step, attempt, config, context.values(), objectMapper);
        StepResult result = handlers.dispatch(stepContext);

        Instant finishedAt = clock.instant();
        StepRecord finished;
        if (result.ok()) {
            finished = record.complete(result.output(), finishedAt);
            context.merge(step.id(), result.output());
            log.debug("Step {} completed", step.id());
        } else {
            finished = record.fail(result.errorCode(), result.error(), finishedAt);
            log.warn("Step {} failed [{}]: {}{}", step.id(), result.errorCode(), result.error(),
                step.continueOnFailure() ? " (continuing)" : "");
        }
        stepRecordRepository.update(finished);
        metrics.stepFinished(step.type(), finished.status().name(), Duration.between(startedAt, finishedAt));
        return finished;
    }

    // ========== Approval Gate ==========

    /**
     * Request approval for a gate step.
     *
     * @return the paused execution, or empty when the gate was auto-approved and the walk continues
     */
    private Optional<WorkflowExecution> passGate(
            WorkflowExecution execution, Step step, int attempt, ExecutionContext context) {
        Instant now = clock.instant();
        JsonNode config = templateRenderer.render(step.config(), context.values());

        ObjectNode payload = config.isObject() ? ((ObjectNode) config).deepCopy() : objectMapper.createObjectNode();
        payload.put("execution_id", execution.executionId().toString());
        payload.put("step_id", step.id());
        if (!payload.hasNonNull("title")) {
            payload.put("title", step.name() != null ? step.name() : "Approval gate " + step.id());
        }

        Action action = Action.builder(ActionKind.DECISION, GATE_OPERATION)
            .priority(parsePriority(config.path("priority").asText(null)))
            .payload(payload)
            .requiresApproval(config.path("requires_approval").asBoolean(true))
            .createdAt(now)
            .build();
        actionRepository.save(action);

        String requester = context.values().path("user_id").asText("system");
        ApprovalRequest request = approvalManager.requestApproval(action, requester);

        if (request.status() == ApprovalStatus.AUTO_APPROVED) {
            StepRecord record = StepRecord.running(execution.executionId(), step, attempt, now);
            stepRecordRepository.save(record);
            ObjectNode output = gateOutput(request);
            stepRecordRepository.update(record.complete(output, clock.instant()));
            context.merge(step.id(), output);
            log.info("Gate {} auto-approved", step.id());
            return Optional.empty();
        }

        stepRecordRepository.save(StepRecord.awaitingApproval(execution.executionId(), step, attempt, now));
        WorkflowExecution paused = execution.toBuilder()
            .status(ExecutionStatus.PENDING_APPROVAL)
            .checkpointStepId(step.id())
            .approvalId(request.id())
            .result(context.snapshot())
            .updatedAt(clock.instant())
            .build();
        if (!executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.RUNNING, paused)) {
            return Optional.of(reload(execution));
        }
        log.info("Execution {} paused at gate {} awaiting approval {}",
            execution.executionId(), step.id(), request.id());
        approvalManager.publish(request);
        return Optional.of(paused);
    }

    private ObjectNode gateOutput(ApprovalRequest decision) {
        ObjectNode output = objectMapper.createObjectNode();
        output.put("approved", decision.status().isApproved());
        output.put("approval_id", decision.id().toString());
        output.put("approver_id", decision.approverId());
        output.put("reason", decision.responseReason());
        return output;
    }

    private static Optional<StepRecord> findGateRecord(List<StepRecord> records, String gateStepId) {
        return records.stream()
            .filter(r -> r.stepId().equals(gateStepId) && r.status() == StepStatus.PENDING)
            .findFirst();
    }

    private static ActionPriority parsePriority(String raw) {
        if (raw == null || raw.isBlank()) {
            return ActionPriority.MEDIUM;
        }
        try {
            return ActionPriority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ActionPriority.MEDIUM;
        }
    }

    // ========== Status Transitions ==========

    private Optional<WorkflowExecution> heartbeat(WorkflowExecution execution) {
        WorkflowExecution beat = execution.toBuilder().updatedAt(clock.instant()).build();
        if (executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.RUNNING, beat)) {
            return Optional.of(beat);
        }
        return Optional.empty();
    }

    private WorkflowExecution finishCompleted(WorkflowExecution execution, ExecutionContext context) {
        Instant now = clock.instant();
        WorkflowExecution completed = execution.toBuilder()
            .status(ExecutionStatus.COMPLETED)
            .checkpointStepId(null)
            .result(context.snapshot())
            .clearError()
            .updatedAt(now)
            .completedAt(now)
            .build();
        if (!executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.RUNNING, completed)) {
            return reload(execution);
        }
        metrics.executionCompleted(execution.workflowId(), Duration.between(execution.createdAt(), now));
        log.info("Execution {} completed", execution.executionId());
        return completed;
    }

    private WorkflowExecution finishFailed(
            WorkflowExecution execution, ExecutionContext context, String errorCode, String error) {
        Instant now = clock.instant();
        WorkflowExecution.Builder builder = execution.toBuilder()
            .status(ExecutionStatus.FAILED)
            .checkpointStepId(null)
            .error(errorCode, error)
            .updatedAt(now)
            .completedAt(now);
        if (context != null) {
            builder.result(context.snapshot());
        }
        WorkflowExecution failed = builder.build();
        if (!executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.RUNNING, failed)) {
            return reload(execution);
        }
        metrics.executionFailed(execution.workflowId(), errorCode);
        log.warn("Execution {} failed [{}]: {}", execution.executionId(), errorCode, error);
        return failed;
    }

    private WorkflowExecution reload(WorkflowExecution execution) {
        UUID id = execution.executionId();
        return executionRepository.findById(id).orElse(execution);
    }
}
