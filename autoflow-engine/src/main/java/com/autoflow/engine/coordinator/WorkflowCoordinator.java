package com.autoflow.engine.coordinator;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.core.exception.NotFoundException;
import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.StepRecord;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.StepRecordRepository;
import com.autoflow.core.repository.WorkflowExecutionRepository;
import com.autoflow.engine.executor.GraphExecutor;
import com.autoflow.engine.lifecycle.GracefulShutdownHandler;
import com.autoflow.engine.logging.LoggingContext;
import com.autoflow.engine.metrics.WorkflowMetrics;
import com.autoflow.engine.service.ExecutionService;
import com.autoflow.engine.service.WorkflowDefinitionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Control plane for executions: creates them, claims them for a walk, and cancels them.
 *
 * Each walk runs as one task on the walk executor. A walk is claimed with a
 * compare-and-set from a dispatchable status to RUNNING, so two dispatches of the
 * same execution never walk it twice.
 */
public class WorkflowCoordinator implements ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private static final int CANCEL_ATTEMPTS = 3;

    private final WorkflowDefinitionService definitionService;
    private final WorkflowExecutionRepository executionRepository;
    private final StepRecordRepository stepRecordRepository;
    private final GraphExecutor graphExecutor;
    private final GracefulShutdownHandler shutdownHandler;
    private final WorkflowMetrics metrics;
    private final Executor walkExecutor;
    private final Clock clock;
    private final int defaultMaxRetries;

    public WorkflowCoordinator(
            WorkflowDefinitionService definitionService,
            WorkflowExecutionRepository executionRepository,
            StepRecordRepository stepRecordRepository,
            GraphExecutor graphExecutor,
            GracefulShutdownHandler shutdownHandler,
            WorkflowMetrics metrics,
            Executor walkExecutor,
            Clock clock,
            int defaultMaxRetries) {
        this.definitionService = definitionService;
        this.executionRepository = executionRepository;
        this.stepRecordRepository = stepRecordRepository;
        this.graphExecutor = graphExecutor;
        this.shutdownHandler = shutdownHandler;
        this.metrics = metrics;
        this.walkExecutor = walkExecutor;
        this.clock = clock;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    @Override
    public WorkflowExecution startExecution(StartExecutionRequest request) {
        WorkflowExecution execution = createExecution(request, ExecutionStatus.PENDING, null);
        dispatch(execution.executionId());
        return execution;
    }

    /**
     * Create an execution without dispatching it.
     * Used by the intake to park an execution in PENDING_APPROVAL until its action is approved.
     */
    public WorkflowExecution createExecution(StartExecutionRequest request, ExecutionStatus initialStatus,
                                             UUID approvalId) {
        WorkflowDefinition definition = request.version() != null
            ? definitionService.getVersion(request.workflowId(), request.version())
            : definitionService.getLatest(request.workflowId());
        if (!definition.enabled()) {
            throw new WorkflowValidationException("Workflow " + definition.versionKey() + " is disabled");
        }

        JsonNode payload = request.triggerPayload();
        if (payload == null || payload.isNull()) {
            payload = JsonNodeFactory.instance.objectNode();
        } else if (!payload.isObject()) {
            throw new WorkflowValidationException("trigger_payload must be a JSON object");
        }

        int maxRetries = request.maxRetries() != null ? request.maxRetries() : defaultMaxRetries;
        WorkflowExecution execution = WorkflowExecution.create(
            definition, payload, request.actionId(), maxRetries, initialStatus, clock.instant())
            .toBuilder()
            .approvalId(approvalId)
            .runningTimeout(request.runningTimeout())
            .build();
        executionRepository.save(execution);

        try (var ctx = LoggingContext.forExecution(execution.executionId(), definition.id())) {
            log.info("Created execution of {} in {}", definition.versionKey(), initialStatus);
        }
        return execution;
    }

    @Override
    public WorkflowExecution getExecution(UUID executionId) {
        return executionRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("WorkflowExecution", executionId.toString()));
    }

    @Override
    public List<StepRecord> getSteps(UUID executionId) {
        getExecution(executionId);
        return stepRecordRepository.findByExecution(executionId);
    }

    @Override
    public List<WorkflowExecution> queryExecutions(ExecutionQuery query) {
        if (query.workflowId() != null) {
            return executionRepository.findByWorkflowId(query.workflowId(), Integer.MAX_VALUE).stream()
                .filter(e -> query.status() == null || e.status() == query.status())
                .limit(query.limit())
                .toList();
        }
        if (query.status() != null) {
            return executionRepository.findByStatus(query.status(), query.limit());
        }
        List<WorkflowExecution> all = new ArrayList<>();
        for (ExecutionStatus status : ExecutionStatus.values()) {
            all.addAll(executionRepository.findByStatus(status, query.limit()));
        }
        return all.stream()
            .sorted(Comparator.comparing(WorkflowExecution::createdAt).reversed())
            .limit(query.limit())
            .toList();
    }

    @Override
    public boolean cancelExecution(UUID executionId) {
        for (int attempt = 0; attempt < CANCEL_ATTEMPTS; attempt++) {
            WorkflowExecution current = getExecution(executionId);
            if (current.isTerminal() || !current.status().canTransitionTo(ExecutionStatus.CANCELLED)) {
                log.debug("Execution {} is {}, not cancellable", executionId, current.status());
                return false;
            }
            Instant now = clock.instant();
            WorkflowExecution cancelled = current.toBuilder()
                .status(ExecutionStatus.CANCELLED)
                .checkpointStepId(null)
                .nextAttemptAt(null)
                .updatedAt(now)
                .completedAt(now)
                .build();
            if (executionRepository.compareAndSetStatus(executionId, current.status(), cancelled)) {
                metrics.executionCancelled(current.workflowId());
                try (var ctx = LoggingContext.forExecution(executionId, current.workflowId())) {
                    log.info("Execution cancelled from {}", current.status());
                }
                return true;
            }
            // Status moved underneath us; re-read and try again
        }
        return false;
    }

    @Override
    public boolean dispatch(UUID executionId) {
        return submit(executionId, () -> claimAndWalk(executionId));
    }

    /**
     * Continue an execution that was waiting on an approved request, in the background.
     * Executions paused at a gate resume after the gate; executions parked by the intake
     * start from the trigger.
     */
    public boolean resumeApproved(UUID executionId, ApprovalRequest decision) {
        return submit(executionId, () -> claimApproved(executionId, decision));
    }

    @Override
    public boolean resumeDecided(UUID executionId, ApprovalRequest decision) {
        if (decision.status().isApproved()) {
            return resumeApproved(executionId, decision);
        }
        if (decision.status() == ApprovalStatus.REJECTED) {
            return closeRejected(executionId, decision).isPresent();
        }
        return false;
    }

    /**
     * Cancel an execution whose approval was rejected.
     */
    public Optional<WorkflowExecution> closeRejected(UUID executionId, ApprovalRequest decision) {
        WorkflowExecution paused = getExecution(executionId);
        if (paused.status() != ExecutionStatus.PENDING_APPROVAL) {
            log.debug("Execution {} is {}, ignoring rejection", executionId, paused.status());
            return Optional.empty();
        }
        return Optional.of(graphExecutor.rejectAtGate(paused, decision));
    }

    // ========== Internal Methods ==========

    private boolean submit(UUID executionId, Runnable walk) {
        if (!shutdownHandler.tryRegister(executionId)) {
            log.debug("Execution {} not dispatched: shutting down or already in flight here", executionId);
            return false;
        }
        try {
            walkExecutor.execute(shutdownHandler.wrap(executionId, walk));
            return true;
        } catch (RejectedExecutionException e) {
            shutdownHandler.unregister(executionId);
            log.warn("Walk executor rejected execution {}: {}", executionId, e.getMessage());
            return false;
        }
    }

    private void claimAndWalk(UUID executionId) {
        Optional<WorkflowExecution> current = executionRepository.findById(executionId);
        if (current.isEmpty()) {
            log.warn("Dispatched execution {} does not exist", executionId);
            return;
        }
        ExecutionStatus status = current.get().status();
        if (status != ExecutionStatus.PENDING && status != ExecutionStatus.RETRYING) {
            log.debug("Execution {} is {}, nothing to dispatch", executionId, status);
            return;
        }
        claim(current.get(), false).ifPresent(claimed ->
            loadDefinition(claimed).ifPresent(definition -> graphExecutor.execute(definition, claimed)));
    }

    private void claimApproved(UUID executionId, ApprovalRequest decision) {
        Optional<WorkflowExecution> current = executionRepository.findById(executionId);
        if (current.isEmpty() || current.get().status() != ExecutionStatus.PENDING_APPROVAL) {
            log.debug("Execution {} is not waiting for approval", executionId);
            return;
        }
        String gateStepId = current.get().checkpointStepId();
        claim(current.get(), gateStepId != null).ifPresent(claimed ->
            loadDefinition(claimed).ifPresent(definition -> {
                if (gateStepId != null) {
                    graphExecutor.resume(definition, claimed, gateStepId, decision);
                } else {
                    graphExecutor.execute(definition, claimed);
                }
            }));
    }

    private Optional<WorkflowExecution> claim(WorkflowExecution current, boolean keepCheckpointResult) {
        if (!current.status().canTransitionTo(ExecutionStatus.RUNNING)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        WorkflowExecution.Builder builder = current.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .checkpointStepId(null)
            .clearError()
            .nextAttemptAt(null)
            .startedAt(current.startedAt() != null ? current.startedAt() : now)
            .updatedAt(now)
            .completedAt(null);
        if (!keepCheckpointResult) {
            builder.result(null);
        }
        WorkflowExecution claimed = builder.build();
        if (!executionRepository.compareAndSetStatus(current.executionId(), current.status(), claimed)) {
            log.debug("Execution {} was claimed elsewhere", current.executionId());
            return Optional.empty();
        }
        return Optional.of(claimed);
    }

    private Optional<WorkflowDefinition> loadDefinition(WorkflowExecution claimed) {
        try {
            return Optional.of(definitionService.getVersion(claimed.workflowId(), claimed.workflowVersion()));
        } catch (NotFoundException e) {
            Instant now = clock.instant();
            WorkflowExecution failed = claimed.toBuilder()
                .status(ExecutionStatus.FAILED)
                .error(ErrorCodes.INVALID_STEP_CONFIG, e.getMessage())
                .updatedAt(now)
                .completedAt(now)
                .build();
            executionRepository.compareAndSetStatus(claimed.executionId(), ExecutionStatus.RUNNING, failed);
            log.error("Execution {} references a missing definition: {}", claimed.executionId(), e.getMessage());
            return Optional.empty();
        }
    }
}
