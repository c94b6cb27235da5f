package com.autoflow.engine.metrics;

import com.autoflow.core.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically refreshes the per-status execution gauges from the store,
 * so they stay accurate after restarts.
 */
public class MetricsSyncService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSyncService.class);

    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowMetrics workflowMetrics;

    public MetricsSyncService(WorkflowExecutionRepository executionRepository, WorkflowMetrics workflowMetrics) {
        this.executionRepository = executionRepository;
        this.workflowMetrics = workflowMetrics;
    }

    @Scheduled(fixedRate = 30000, initialDelay = 5000)
    public void syncExecutionStatusGauges() {
        try {
            workflowMetrics.syncStatusCounts(executionRepository.countByStatus());
            log.debug("Synced execution status gauges");
        } catch (RuntimeException e) {
            log.warn("Failed to sync execution status gauges: {}", e.getMessage());
        }
    }
}
