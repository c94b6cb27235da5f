package com.autoflow.recovery;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.StepRecord;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.TriggerType;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.core.model.TriggerSource;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.engine.coordinator.ApprovalCoordinator.ApprovalCallback;
import com.autoflow.engine.coordinator.IntakeCoordinator.IntakeResult;
import com.autoflow.engine.metrics.WorkflowMetrics;
import com.autoflow.engine.service.ExecutionService.StartExecutionRequest;
import com.autoflow.engine.test.EngineFixture;
import com.autoflow.scheduler.DispatchScheduler;
import com.autoflow.scheduler.InMemoryDispatchTimerRepository;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionSupervisorTest {

    // When set, the approval channel answers every published request on the spot
    private final AtomicReference<String> instantDecision = new AtomicReference<>();
    private final EngineFixture fixture = new EngineFixture(f -> request -> {
        String decision = instantDecision.get();
        if (decision != null) {
            f.approvals.decide(new ApprovalCallback(request.id(), EngineFixture.APPROVER, decision, "on the spot"));
        }
    });
    private final SupervisorSettings settings = SupervisorSettings.defaults();

    private DispatchScheduler retryScheduler;
    private ExecutionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        retryScheduler = new DispatchScheduler(
            new InMemoryDispatchTimerRepository(),
            dispatch -> fixture.coordinator.dispatch(dispatch.executionId()),
            fixture.time,
            Duration.ofSeconds(1));
        supervisor = new ExecutionSupervisor(
            fixture.executionRepository, fixture.stepRecordRepository, fixture.approvalRepository,
            fixture.coordinator, retryScheduler, fixture.metrics, fixture.time, settings);
        fixture.register(taskWorkflow("tracker", "Ops"));
        fixture.register(taskWorkflow("broken", null));
    }

    @Test
    @DisplayName("An execution stuck RUNNING past the timeout is timed out and never retried")
    void stuckExecutionTimesOut() {
        WorkflowExecution stuck = running(fixture.time.now());
        fixture.time.advance(Duration.ofMinutes(31));

        SweepReport report = supervisor.sweep();

        assertThat(report.timedOut()).containsExactly(stuck.executionId());
        WorkflowExecution timedOut = fixture.coordinator.getExecution(stuck.executionId());
        assertThat(timedOut.status()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(timedOut.errorCode()).isEqualTo(ErrorCodes.TIMEOUT);
        assertThat(timedOut.error()).isEqualTo("Execution timed out after 30 minutes");
        assertThat(timedOut.completedAt()).isEqualTo(fixture.time.now());

        fixture.time.advance(Duration.ofHours(1));
        SweepReport next = supervisor.sweep();
        assertThat(next.isEmpty()).isTrue();
        assertThat(fixture.coordinator.getExecution(stuck.executionId()).status()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(fixture.meterRegistry.get(WorkflowMetrics.EXECUTION_TIMED_OUT).counter().count()).isEqualTo(1.0);
    }

    @Test
    void executionTimesOutOnItsOwnRunningTimeout() {
        WorkflowExecution quick = running(fixture.time.now(), Duration.ofMinutes(5));
        WorkflowExecution plain = running(fixture.time.now(), null);
        fixture.time.advance(Duration.ofMinutes(6));

        SweepReport report = supervisor.sweep();

        assertThat(report.timedOut()).containsExactly(quick.executionId());
        assertThat(fixture.coordinator.getExecution(quick.executionId()).error())
            .isEqualTo("Execution timed out after 5 minutes");
        assertThat(status(plain)).isEqualTo(ExecutionStatus.RUNNING);
    }

    @Test
    void recentlyActiveRunningExecutionIsLeftAlone() {
        WorkflowExecution active = running(fixture.time.now());
        fixture.time.advance(Duration.ofMinutes(29));

        assertThat(supervisor.sweep().timedOut()).isEmpty();
        assertThat(fixture.coordinator.getExecution(active.executionId()).status()).isEqualTo(ExecutionStatus.RUNNING);
    }

    @Test
    void failedExecutionRetriesAfterBackoffAndCompletes() {
        fixture.connectors.failTasks(1);
        WorkflowExecution execution = start("tracker");
        assertThat(status(execution)).isEqualTo(ExecutionStatus.FAILED);

        SweepReport report = supervisor.sweep();

        assertThat(report.retried()).containsExactly(execution.executionId());
        WorkflowExecution retrying = fixture.coordinator.getExecution(execution.executionId());
        assertThat(retrying.status()).isEqualTo(ExecutionStatus.RETRYING);
        assertThat(retrying.retryCount()).isEqualTo(1);
        assertThat(retrying.nextAttemptAt()).isEqualTo(fixture.time.now().plus(Duration.ofMinutes(1)));

        assertThat(retryScheduler.pollDue()).isZero();
        fixture.time.advance(Duration.ofMinutes(1));
        assertThat(retryScheduler.pollDue()).isEqualTo(1);

        assertThat(status(execution)).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.coordinator.getSteps(execution.executionId()))
            .extracting(StepRecord::attempt)
            .containsExactly(0, 1);
    }

    @Test
    void backoffDoublesUntilRetriesRunOut() {
        fixture.connectors.failTasks(100);
        WorkflowExecution execution = start("tracker");
        List<Duration> delays = new ArrayList<>();
        List<UUID> exhausted = new ArrayList<>();

        for (int round = 0; round < 5; round++) {
            SweepReport report = supervisor.sweep();
            exhausted.addAll(report.exhausted());
            WorkflowExecution current = fixture.coordinator.getExecution(execution.executionId());
            if (current.status() == ExecutionStatus.RETRYING) {
                Duration delay = Duration.between(fixture.time.now(), current.nextAttemptAt());
                delays.add(delay);
                fixture.time.advance(delay);
                retryScheduler.pollDue();
            } else {
                fixture.time.advance(Duration.ofMinutes(1));
            }
        }

        assertThat(delays).containsExactly(Duration.ofMinutes(1), Duration.ofMinutes(2), Duration.ofMinutes(4));
        WorkflowExecution failed = fixture.coordinator.getExecution(execution.executionId());
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.retryCount()).isEqualTo(3);
        assertThat(failed.isTerminal()).isTrue();
        // Surfaced in exactly one sweep
        assertThat(exhausted).containsExactly(execution.executionId());
        assertThat(fixture.meterRegistry.get(WorkflowMetrics.EXECUTION_EXHAUSTED).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A research action carries its retry budget of 2 into the execution")
    void researchExecutionExhaustsAfterTwoRetries() {
        fixture.definitions.registerTemplates();
        fixture.connectors.failTasks(100);
        IntakeResult intake = fixture.intake.submit(
            TriggerEvent.of("Need a detailed research analysis of churn", TriggerSource.EMAIL, "U42"));
        WorkflowExecution execution = intake.execution();
        assertThat(execution.maxRetries()).isEqualTo(2);
        assertThat(execution.runningTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(status(execution)).isEqualTo(ExecutionStatus.FAILED);

        List<UUID> retried = new ArrayList<>();
        List<UUID> exhausted = new ArrayList<>();
        for (int round = 0; round < 5; round++) {
            SweepReport report = supervisor.sweep();
            retried.addAll(report.retried());
            exhausted.addAll(report.exhausted());
            WorkflowExecution current = fixture.coordinator.getExecution(execution.executionId());
            if (current.status() == ExecutionStatus.RETRYING) {
                fixture.time.advance(Duration.between(fixture.time.now(), current.nextAttemptAt()));
                retryScheduler.pollDue();
            } else {
                fixture.time.advance(Duration.ofMinutes(1));
            }
        }

        assertThat(retried).hasSize(2);
        assertThat(exhausted).containsExactly(execution.executionId());
        WorkflowExecution failed = fixture.coordinator.getExecution(execution.executionId());
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.retryCount()).isEqualTo(2);
        assertThat(fixture.coordinator.getSteps(execution.executionId()))
            .extracting(StepRecord::attempt)
            .containsExactly(0, 1, 2);
    }

    @Test
    void nonRetryableFailureIsExhaustedImmediately() {
        WorkflowExecution execution = start("broken");
        assertThat(fixture.coordinator.getExecution(execution.executionId()).errorCode())
            .isEqualTo(ErrorCodes.INVALID_STEP_CONFIG);

        SweepReport report = supervisor.sweep();

        assertThat(report.retried()).isEmpty();
        assertThat(report.exhausted()).containsExactly(execution.executionId());
        WorkflowExecution failed = fixture.coordinator.getExecution(execution.executionId());
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.isTerminal()).isTrue();
    }

    @Test
    void stalePendingExecutionIsDispatchedAgain() {
        WorkflowExecution lost = fixture.coordinator.createExecution(
            StartExecutionRequest.of("tracker", payload()), ExecutionStatus.PENDING, null);

        assertThat(supervisor.sweep().redispatched()).isEmpty();

        fixture.time.advance(Duration.ofMinutes(6));
        SweepReport report = supervisor.sweep();

        assertThat(report.redispatched()).containsExactly(lost.executionId());
        assertThat(status(lost)).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.coordinator.getExecution(lost.executionId()).retryCount()).isZero();
    }

    @Test
    void retryWithLostTimerIsDispatchedAgain() {
        fixture.connectors.failTasks(1);
        WorkflowExecution execution = start("tracker");
        supervisor.sweep();
        retryScheduler.cancelFor(execution.executionId());

        fixture.time.advance(Duration.ofMinutes(7));
        SweepReport report = supervisor.sweep();

        assertThat(report.redispatched()).containsExactly(execution.executionId());
        assertThat(status(execution)).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    @DisplayName("A gate approved while its walk is still running is continued by the next sweep")
    void gateApprovedMidWalkIsResumedBySweep() {
        fixture.register(gatedWorkflow());
        instantDecision.set("approve");

        WorkflowExecution execution = start("gated");

        // The decision landed before the walk let go of the execution
        WorkflowExecution parked = fixture.coordinator.getExecution(execution.executionId());
        assertThat(parked.status()).isEqualTo(ExecutionStatus.PENDING_APPROVAL);
        assertThat(fixture.approvalRepository.findById(parked.approvalId()))
            .hasValueSatisfying(a -> assertThat(a.status()).isEqualTo(ApprovalStatus.APPROVED));

        SweepReport report = supervisor.sweep();

        assertThat(report.resumed()).containsExactly(execution.executionId());
        WorkflowExecution completed = fixture.coordinator.getExecution(execution.executionId());
        assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(completed.result().path("gate").path("reason").asText()).isEqualTo("on the spot");
        assertThat(fixture.connectors.tasks).hasSize(1);
        assertThat(supervisor.sweep().resumed()).isEmpty();
    }

    @Test
    void gateRejectedMidWalkIsCancelledWithoutTheSweep() {
        fixture.register(gatedWorkflow());
        instantDecision.set("reject");

        WorkflowExecution execution = start("gated");

        assertThat(status(execution)).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(supervisor.sweep().resumed()).isEmpty();
        assertThat(fixture.connectors.tasks).isEmpty();
    }

    @Test
    void decisionAlreadyHandedOverIsNotResumedAgain() {
        fixture.register(gatedWorkflow());
        WorkflowExecution execution = start("gated");
        UUID approvalId = fixture.coordinator.getExecution(execution.executionId()).approvalId();

        fixture.approvals.decide(new ApprovalCallback(approvalId, EngineFixture.APPROVER, "approve", null));
        assertThat(status(execution)).isEqualTo(ExecutionStatus.COMPLETED);

        assertThat(supervisor.sweep().resumed()).isEmpty();
        assertThat(fixture.connectors.tasks).hasSize(1);
    }

    @Test
    void parkedExecutionWaitsWhileApprovalUndecided() {
        WorkflowExecution parked = fixture.coordinator.createExecution(
            StartExecutionRequest.of("tracker", payload()), ExecutionStatus.PENDING_APPROVAL, UUID.randomUUID());
        fixture.time.advance(Duration.ofDays(2));

        assertThat(supervisor.sweep().isEmpty()).isTrue();
        assertThat(status(parked)).isEqualTo(ExecutionStatus.PENDING_APPROVAL);
    }

    @Test
    void purgeRemovesOldTerminalExecutionsAndTheirSteps() {
        WorkflowExecution old = start("tracker");
        fixture.time.advance(Duration.ofDays(91));
        WorkflowExecution recent = start("tracker");

        assertThat(supervisor.purge()).isEqualTo(1);

        assertThat(fixture.executionRepository.findById(old.executionId())).isEmpty();
        assertThat(fixture.stepRecordRepository.findByExecution(old.executionId())).isEmpty();
        assertThat(fixture.executionRepository.findById(recent.executionId())).isPresent();
        assertThat(supervisor.purge()).isZero();
    }

    @Test
    void startAndStop() {
        assertThat(supervisor.isRunning()).isFalse();
        supervisor.start();
        assertThat(supervisor.isRunning()).isTrue();
        supervisor.stop();
        assertThat(supervisor.isRunning()).isFalse();
    }

    // ========== Helpers ==========

    private WorkflowExecution start(String workflowId) {
        return fixture.coordinator.startExecution(StartExecutionRequest.of(workflowId, payload()));
    }

    private ExecutionStatus status(WorkflowExecution execution) {
        return fixture.coordinator.getExecution(execution.executionId()).status();
    }

    private WorkflowExecution running(Instant lastUpdate) {
        return running(lastUpdate, null);
    }

    private WorkflowExecution running(Instant lastUpdate, Duration runningTimeout) {
        WorkflowExecution created = fixture.coordinator.createExecution(
            new StartExecutionRequest("tracker", null, payload(), null, null, runningTimeout),
            ExecutionStatus.PENDING, null);
        WorkflowExecution running = created.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .startedAt(lastUpdate)
            .updatedAt(lastUpdate)
            .build();
        fixture.executionRepository.compareAndSetStatus(created.executionId(), ExecutionStatus.PENDING, running);
        return running;
    }

    private static WorkflowDefinition gatedWorkflow() {
        ObjectNode gate = JsonNodeFactory.instance.objectNode();
        gate.put("title", "Ship release?");
        ObjectNode task = JsonNodeFactory.instance.objectNode();
        task.put("name", "Release");
        task.put("project", "Ops");
        return WorkflowDefinition.builder()
            .id("gated")
            .name("gated")
            .trigger("start", TriggerType.MANUAL)
            .step(Step.builder("gate", StepType.APPROVAL_GATE).config(gate).build())
            .step(Step.builder("task", StepType.CREATE_TASK).config(task).build())
            .connect("start", "gate")
            .connect("gate", "task")
            .build();
    }

    private static WorkflowDefinition taskWorkflow(String id, String project) {
        ObjectNode config = JsonNodeFactory.instance.objectNode();
        config.put("name", "Follow up on {{subject}}");
        if (project != null) {
            config.put("project", project);
        }
        return WorkflowDefinition.builder()
            .id(id)
            .name(id)
            .trigger("start", TriggerType.MANUAL)
            .step(Step.builder("task", StepType.CREATE_TASK).config(config).build())
            .connect("start", "task")
            .build();
    }

    private static ObjectNode payload() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("subject", "the outage");
        return payload;
    }
}
