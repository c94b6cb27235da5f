package com.autoflow.api.config;

import com.autoflow.core.model.RetryPolicy;
import com.autoflow.core.repository.ActionRepository;
import com.autoflow.core.repository.ApprovalRequestRepository;
import com.autoflow.core.repository.StepRecordRepository;
import com.autoflow.core.repository.WorkflowDefinitionRepository;
import com.autoflow.core.repository.WorkflowExecutionRepository;
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
import com.autoflow.engine.health.AutoflowHealthIndicator;
import com.autoflow.engine.lifecycle.GracefulShutdownHandler;
import com.autoflow.engine.metrics.MetricsSyncService;
import com.autoflow.engine.metrics.WorkflowMetrics;
import com.autoflow.engine.persistence.InMemoryActionRepository;
import com.autoflow.engine.persistence.InMemoryApprovalRequestRepository;
import com.autoflow.engine.persistence.InMemoryStepRecordRepository;
import com.autoflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.autoflow.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.autoflow.engine.persistence.jdbc.JdbcActionRepository;
import com.autoflow.engine.persistence.jdbc.JdbcApprovalRequestRepository;
import com.autoflow.engine.persistence.jdbc.JdbcStepRecordRepository;
import com.autoflow.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.autoflow.engine.persistence.jdbc.JdbcWorkflowExecutionRepository;
import com.autoflow.recovery.ExecutionSupervisor;
import com.autoflow.recovery.SupervisorSettings;
import com.autoflow.scheduler.DispatchScheduler;
import com.autoflow.scheduler.InMemoryDispatchTimerRepository;
import com.autoflow.triage.EventClassifier;
import com.autoflow.triage.compiler.ActionCompilerRegistry;
import com.autoflow.worker.StepHandlerRegistry;
import com.autoflow.worker.TemplateRenderer;
import com.autoflow.worker.connector.HttpWebhookConnector;
import com.autoflow.worker.connector.LoggingConnectors;
import com.autoflow.worker.handler.DelayHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine, the supervisor and the dispatch scheduler from {@link AutoflowProperties}.
 */
@Configuration
@EnableConfigurationProperties(AutoflowProperties.class)
public class AutoflowConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========== Repositories ==========

    @Configuration
    @ConditionalOnProperty(prefix = "autoflow", name = "store", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStore {

        @Bean
        public WorkflowDefinitionRepository workflowDefinitionRepository() {
            return new InMemoryWorkflowDefinitionRepository();
        }

        @Bean
        public WorkflowExecutionRepository workflowExecutionRepository() {
            return new InMemoryWorkflowExecutionRepository();
        }

        @Bean
        public StepRecordRepository stepRecordRepository() {
            return new InMemoryStepRecordRepository();
        }

        @Bean
        public ApprovalRequestRepository approvalRequestRepository() {
            return new InMemoryApprovalRequestRepository();
        }

        @Bean
        public ActionRepository actionRepository() {
            return new InMemoryActionRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "autoflow", name = "store", havingValue = "jdbc")
    static class JdbcStore {

        @Bean
        public WorkflowDefinitionRepository workflowDefinitionRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
            return new JdbcWorkflowDefinitionRepository(jdbc, mapper);
        }

        @Bean
        public WorkflowExecutionRepository workflowExecutionRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
            return new JdbcWorkflowExecutionRepository(jdbc, mapper);
        }

        @Bean
        public StepRecordRepository stepRecordRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
            return new JdbcStepRecordRepository(jdbc, mapper);
        }

        @Bean
        public ApprovalRequestRepository approvalRequestRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
            return new JdbcApprovalRequestRepository(jdbc, mapper);
        }

        @Bean
        public ActionRepository actionRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
            return new JdbcActionRepository(jdbc, mapper);
        }
    }

    // ========== Steps ==========

    @Bean
    public LoggingConnectors loggingConnectors() {
        return new LoggingConnectors();
    }

    @Bean
    public StepHandlerRegistry stepHandlerRegistry(LoggingConnectors connectors, AutoflowProperties properties) {
        AutoflowProperties.Executor executor = properties.getExecutor();
        return StepHandlerRegistry.create(
            connectors, connectors, connectors, connectors,
            new HttpWebhookConnector(executor.getWebhookTimeout()),
            new DelayHandler(executor.getMaxInlineDelay()));
    }

    // ========== Engine ==========

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        return new WorkflowMetrics(meterRegistry);
    }

    @Bean
    public MetricsSyncService metricsSyncService(WorkflowExecutionRepository executionRepository,
                                                 WorkflowMetrics metrics) {
        return new MetricsSyncService(executionRepository, metrics);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler() {
        return new GracefulShutdownHandler();
    }

    @Bean
    public ApprovalManager approvalManager(
            ApprovalRequestRepository approvalRepository,
            ActionRepository actionRepository,
            LoggingConnectors connectors,
            ObjectMapper objectMapper,
            WorkflowMetrics metrics,
            Clock clock,
            AutoflowProperties properties) {
        AutoflowProperties.Approval approval = properties.getApproval();
        return new ApprovalManager(
            approvalRepository, actionRepository,
            new StaticApproverPolicy(approval.getApprovers(), approval.getDefaultApprover()),
            new NotificationApprovalChannel(connectors, objectMapper),
            metrics, clock, approval.getAutoApprovalThreshold());
    }

    @Bean
    public GraphExecutor graphExecutor(
            WorkflowExecutionRepository executionRepository,
            StepRecordRepository stepRecordRepository,
            ActionRepository actionRepository,
            StepHandlerRegistry handlers,
            ApprovalManager approvalManager,
            WorkflowMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        return new GraphExecutor(
            executionRepository, stepRecordRepository, actionRepository, handlers, approvalManager,
            new ConditionEvaluator(), new TemplateRenderer(), metrics, objectMapper, clock);
    }

    @Bean
    public DefinitionRegistry definitionRegistry(WorkflowDefinitionRepository definitionRepository, Clock clock) {
        return new DefinitionRegistry(
            definitionRepository, new WorkflowDefinitionParser(clock), new WorkflowDefinitionValidator(), clock);
    }

    @Bean
    public ApplicationRunner templateRegistration(DefinitionRegistry definitions) {
        return args -> definitions.registerTemplates();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService walkExecutor(AutoflowProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getExecutor().getPoolSize(), r -> {
            Thread thread = new Thread(r, "autoflow-walk-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WorkflowCoordinator workflowCoordinator(
            DefinitionRegistry definitions,
            WorkflowExecutionRepository executionRepository,
            StepRecordRepository stepRecordRepository,
            GraphExecutor graphExecutor,
            GracefulShutdownHandler shutdownHandler,
            WorkflowMetrics metrics,
            ExecutorService walkExecutor,
            Clock clock,
            AutoflowProperties properties) {
        return new WorkflowCoordinator(
            definitions, executionRepository, stepRecordRepository, graphExecutor, shutdownHandler,
            metrics, walkExecutor, clock, properties.getSupervisor().getMaxRetries());
    }

    @Bean
    public ApprovalCoordinator approvalCoordinator(
            ApprovalManager approvalManager,
            WorkflowExecutionRepository executionRepository,
            WorkflowCoordinator workflowCoordinator) {
        return new ApprovalCoordinator(approvalManager, executionRepository, workflowCoordinator);
    }

    @Bean
    public IntakeCoordinator intakeCoordinator(
            ActionRepository actionRepository,
            ApprovalManager approvalManager,
            WorkflowCoordinator workflowCoordinator,
            Clock clock,
            AutoflowProperties properties) {
        return new IntakeCoordinator(
            new EventClassifier(),
            ActionCompilerRegistry.defaults(properties.getApproval().getEscalateTo(), clock),
            actionRepository,
            approvalManager,
            new ActionRoutingTable(properties.getRouting()),
            workflowCoordinator);
    }

    // ========== Recovery ==========

    @Bean(initMethod = "start", destroyMethod = "stop")
    public DispatchScheduler dispatchScheduler(WorkflowCoordinator coordinator, Clock clock,
                                               AutoflowProperties properties) {
        return new DispatchScheduler(
            new InMemoryDispatchTimerRepository(),
            dispatch -> coordinator.dispatch(dispatch.executionId()),
            clock,
            properties.getScheduler().getPollInterval());
    }

    @Bean
    public SupervisorSettings supervisorSettings(AutoflowProperties properties) {
        AutoflowProperties.Supervisor supervisor = properties.getSupervisor();
        RetryPolicy retryPolicy = RetryPolicy.builder()
            .maxRetries(supervisor.getMaxRetries())
            .baseBackoff(supervisor.getBaseBackoff())
            .build();
        return new SupervisorSettings(
            supervisor.getSweepInterval(),
            supervisor.getRunningTimeout(),
            supervisor.getStartupGrace(),
            retryPolicy,
            supervisor.getRetention(),
            supervisor.getPurgeInterval(),
            supervisor.getBatchSize());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ExecutionSupervisor executionSupervisor(
            WorkflowExecutionRepository executionRepository,
            StepRecordRepository stepRecordRepository,
            ApprovalRequestRepository approvalRepository,
            WorkflowCoordinator coordinator,
            DispatchScheduler dispatchScheduler,
            WorkflowMetrics metrics,
            Clock clock,
            SupervisorSettings settings) {
        return new ExecutionSupervisor(
            executionRepository, stepRecordRepository, approvalRepository, coordinator, dispatchScheduler,
            metrics, clock, settings);
    }

    @Bean
    public AutoflowHealthIndicator autoflowHealthIndicator(
            WorkflowExecutionRepository executionRepository,
            ApprovalRequestRepository approvalRepository,
            GracefulShutdownHandler shutdownHandler,
            ExecutionSupervisor supervisor) {
        return new AutoflowHealthIndicator(executionRepository, approvalRepository, shutdownHandler,
            supervisor::isRunning);
    }
}
