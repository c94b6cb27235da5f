package com.autoflow.engine.health;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.repository.ApprovalRequestRepository;
import com.autoflow.core.repository.WorkflowExecutionRepository;
import com.autoflow.engine.lifecycle.GracefulShutdownHandler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Reports engine health:
 * - DOWN while shutting down or when the store cannot be read
 * - OUT_OF_SERVICE when the supervisor is not sweeping
 * - UP otherwise, with execution counts per status and pending approvals
 */
public class AutoflowHealthIndicator implements HealthIndicator {

    private final WorkflowExecutionRepository executionRepository;
    private final ApprovalRequestRepository approvalRepository;
    private final GracefulShutdownHandler shutdownHandler;
    private final BooleanSupplier supervisorRunning;

    public AutoflowHealthIndicator(
            WorkflowExecutionRepository executionRepository,
            ApprovalRequestRepository approvalRepository,
            GracefulShutdownHandler shutdownHandler,
            BooleanSupplier supervisorRunning) {
        this.executionRepository = executionRepository;
        this.approvalRepository = approvalRepository;
        this.shutdownHandler = shutdownHandler;
        this.supervisorRunning = supervisorRunning;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inFlight", shutdownHandler.getActiveCount());

        if (shutdownHandler.isShuttingDown()) {
            return Health.down().withDetail("reason", "shutting down").withDetails(details).build();
        }

        try {
            Map<String, Long> executions = new LinkedHashMap<>();
            Map<ExecutionStatus, Long> counts = executionRepository.countByStatus();
            for (ExecutionStatus status : ExecutionStatus.values()) {
                executions.put(status.name(), counts.getOrDefault(status, 0L));
            }
            details.put("executions", executions);
            details.put("pendingApprovals", approvalRepository.countPending());
        } catch (RuntimeException e) {
            return Health.down().withException(e).withDetails(details).build();
        }

        if (!supervisorRunning.getAsBoolean()) {
            return Health.outOfService().withDetail("supervisor", "stopped").withDetails(details).build();
        }
        return Health.up().withDetail("supervisor", "running").withDetails(details).build();
    }
}
