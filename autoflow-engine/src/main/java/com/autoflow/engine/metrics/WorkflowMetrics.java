package com.autoflow.engine.metrics;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.StepType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for executions, steps and approvals.
 *
 * Metrics exposed:
 * - execution counts by status (gauge, refreshed from the store)
 * - execution lifecycle counters
 * - step and execution duration timers
 * - approval outcome counters
 */
public class WorkflowMetrics implements MeterBinder {

    public static final String EXECUTION_COUNT = "autoflow.executions";
    public static final String EXECUTION_STARTED = "autoflow.executions.started";
    public static final String EXECUTION_COMPLETED = "autoflow.executions.completed";
    public static final String EXECUTION_FAILED = "autoflow.executions.failed";
    public static final String EXECUTION_CANCELLED = "autoflow.executions.cancelled";
    public static final String EXECUTION_TIMED_OUT = "autoflow.executions.timed_out";
    public static final String EXECUTION_RETRIED = "autoflow.executions.retried";
    public static final String EXECUTION_REDISPATCHED = "autoflow.executions.redispatched";
    public static final String EXECUTION_EXHAUSTED = "autoflow.executions.exhausted";
    public static final String EXECUTION_DURATION = "autoflow.execution.duration";

    public static final String STEP_DURATION = "autoflow.step.duration";

    public static final String APPROVALS = "autoflow.approvals";

    private final Map<ExecutionStatus, AtomicLong> statusGauges = new EnumMap<>(ExecutionStatus.class);
    private MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        for (ExecutionStatus status : ExecutionStatus.values()) {
            statusGauges.put(status, new AtomicLong());
        }
        bindTo(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        statusGauges.forEach((status, value) ->
            Gauge.builder(EXECUTION_COUNT, value, AtomicLong::get)
                .tag("status", tagValue(status.name()))
                .description("Number of executions in " + status + " status")
                .register(registry));
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflowId) {
        counter(EXECUTION_STARTED, "Executions claimed for a walk", "workflow", workflowId).increment();
    }

    public void executionCompleted(String workflowId, Duration duration) {
        counter(EXECUTION_COMPLETED, "Executions completed", "workflow", workflowId).increment();
        Timer.builder(EXECUTION_DURATION)
            .tag("workflow", workflowId)
            .tag("outcome", "completed")
            .description("Time from creation to completion")
            .register(registry)
            .record(duration);
    }

    public void executionFailed(String workflowId, String errorCode) {
        Counter.builder(EXECUTION_FAILED)
            .tag("workflow", workflowId)
            .tag("error_code", tagValue(errorCode))
            .description("Executions that ended a walk as failed")
            .register(registry)
            .increment();
    }

    public void executionCancelled(String workflowId) {
        counter(EXECUTION_CANCELLED, "Executions cancelled", "workflow", workflowId).increment();
    }

    public void executionTimedOut(String workflowId) {
        counter(EXECUTION_TIMED_OUT, "Executions timed out by the supervisor", "workflow", workflowId).increment();
    }

    public void executionRetried(String workflowId, int retryCount) {
        Counter.builder(EXECUTION_RETRIED)
            .tag("workflow", workflowId)
            .tag("retry", String.valueOf(retryCount))
            .description("Retries scheduled by the supervisor")
            .register(registry)
            .increment();
    }

    public void executionRedispatched(String workflowId) {
        counter(EXECUTION_REDISPATCHED, "Stale executions dispatched again", "workflow", workflowId).increment();
    }

    public void executionExhausted(String workflowId) {
        counter(EXECUTION_EXHAUSTED, "Failed executions with no retries left", "workflow", workflowId).increment();
    }

    // ========== Step Metrics ==========

    public void stepFinished(StepType type, String outcome, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("type", type.value())
            .tag("outcome", tagValue(outcome))
            .description("Step handler duration")
            .register(registry)
            .record(duration);
    }

    // ========== Approval Metrics ==========

    public void approvalAutoApproved() {
        approval("auto_approved");
    }

    public void approvalPending() {
        approval("pending");
    }

    public void approvalApproved() {
        approval("approved");
    }

    public void approvalRejected() {
        approval("rejected");
    }

    public void approverMismatch() {
        approval("mismatched");
    }

    private void approval(String outcome) {
        Counter.builder(APPROVALS)
            .tag("outcome", outcome)
            .description("Approval requests by outcome")
            .register(registry)
            .increment();
    }

    // ========== Gauges ==========

    /**
     * Overwrite the per-status gauges with counts read from the store.
     * Statuses absent from the map are reset to zero.
     */
    public void syncStatusCounts(Map<ExecutionStatus, Long> counts) {
        statusGauges.forEach((status, value) -> value.set(counts.getOrDefault(status, 0L)));
    }

    public long statusCount(ExecutionStatus status) {
        return statusGauges.get(status).get();
    }

    // ========== Helper Methods ==========

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
            .tag(tagKey, tagValue(tagValue))
            .description(description)
            .register(registry);
    }

    private static String tagValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        return raw.toLowerCase(Locale.ROOT);
    }
}
