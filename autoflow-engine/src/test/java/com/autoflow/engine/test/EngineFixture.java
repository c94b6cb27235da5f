package com.autoflow.engine.test;

import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.test.TimeController;
import com.autoflow.engine.approval.ApprovalChannel;
import com.autoflow.engine.approval.ApprovalManager;
import com.autoflow.engine.approval.NotificationApprovalChannel;
import com.autoflow.engine.approval.StaticApproverPolicy;
import com.autoflow.engine.coordinator.ActionRoutingTable;
import com.autoflow.engine.coordinator.ApprovalCoordinator;
import com.autoflow.engine.coordinator.IntakeCoordinator;
import com.autoflow.engine.coordinator.WorkflowCoordinator;
import com.autoflow.engine.definition.DefinitionRegistry;
import com.autoflow.engine.definition.WorkflowDefinitionParser;
import com.autoflow.engine.definition.WorkflowDefinitionValidator;
import com.autoflow.engine.executor.ConditionEvaluator;
import com.autoflow.engine.executor.GraphExecutor;
import com.autoflow.engine.lifecycle.GracefulShutdownHandler;
import com.autoflow.engine.metrics.WorkflowMetrics;
import com.autoflow.engine.persistence.InMemoryActionRepository;
import com.autoflow.engine.persistence.InMemoryApprovalRequestRepository;
import com.autoflow.engine.persistence.InMemoryStepRecordRepository;
import com.autoflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.autoflow.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.autoflow.triage.EventClassifier;
import com.autoflow.triage.compiler.ActionCompilerRegistry;
import com.autoflow.worker.StepHandlerRegistry;
import com.autoflow.worker.TemplateRenderer;
import com.autoflow.worker.handler.DelayHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;

/**
 * The engine wired in memory, with walks run on the calling thread.
 */
public class EngineFixture {

    public static final String APPROVER = "U-LEAD";

    public final TimeController time = TimeController.frozenAt(Instant.parse("2024-03-04T09:00:00Z"));
    public final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final WorkflowMetrics metrics = new WorkflowMetrics(meterRegistry);
    public final CapturingConnectors connectors = new CapturingConnectors();

    public final InMemoryWorkflowDefinitionRepository definitionRepository = new InMemoryWorkflowDefinitionRepository();
    public final InMemoryWorkflowExecutionRepository executionRepository = new InMemoryWorkflowExecutionRepository();
    public final InMemoryStepRecordRepository stepRecordRepository = new InMemoryStepRecordRepository();
    public final InMemoryApprovalRequestRepository approvalRepository = new InMemoryApprovalRequestRepository();
    public final InMemoryActionRepository actionRepository = new InMemoryActionRepository();

    public final ApprovalManager approvalManager;
    public final GraphExecutor executor;
    public final DefinitionRegistry definitions;
    public final GracefulShutdownHandler shutdownHandler = new GracefulShutdownHandler(Duration.ofSeconds(1));
    public final WorkflowCoordinator coordinator;
    public final ApprovalCoordinator approvals;
    public final IntakeCoordinator intake;

    public EngineFixture() {
        this(fixture -> new NotificationApprovalChannel(fixture.connectors, fixture.mapper));
    }

    /**
     * @param channelFactory builds the approval channel; it may keep the fixture and
     *                       use its coordinators when a request is published
     */
    public EngineFixture(Function<EngineFixture, ApprovalChannel> channelFactory) {
        approvalManager = new ApprovalManager(
            approvalRepository, actionRepository,
            StaticApproverPolicy.withDefault(APPROVER),
            channelFactory.apply(this),
            metrics, time, ApprovalManager.DEFAULT_AUTO_APPROVAL_THRESHOLD);

        StepHandlerRegistry handlers = StepHandlerRegistry.create(
            connectors, connectors, connectors, connectors, connectors,
            new DelayHandler(duration -> time.advance(duration), Duration.ofMinutes(5)));

        executor = new GraphExecutor(
            executionRepository, stepRecordRepository, actionRepository, handlers, approvalManager,
            new ConditionEvaluator(), new TemplateRenderer(), metrics, mapper, time);

        definitions = new DefinitionRegistry(
            definitionRepository, new WorkflowDefinitionParser(time), new WorkflowDefinitionValidator(), time);

        coordinator = new WorkflowCoordinator(
            definitions, executionRepository, stepRecordRepository, executor, shutdownHandler,
            metrics, Runnable::run, time, 3);

        approvals = new ApprovalCoordinator(approvalManager, executionRepository, coordinator);

        intake = new IntakeCoordinator(
            new EventClassifier(), ActionCompilerRegistry.defaults("U-ONCALL", time),
            actionRepository, approvalManager, ActionRoutingTable.defaults(), coordinator);
    }

    public WorkflowDefinition register(WorkflowDefinition definition) {
        return definitions.register(definition);
    }
}
