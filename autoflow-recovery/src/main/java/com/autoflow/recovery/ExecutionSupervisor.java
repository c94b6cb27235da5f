package com.autoflow.recovery;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.RetryPolicy;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.ApprovalRequestRepository;
import com.autoflow.core.repository.StepRecordRepository;
import com.autoflow.core.repository.WorkflowExecutionRepository;
import com.autoflow.engine.logging.LoggingContext;
import com.autoflow.engine.metrics.WorkflowMetrics;
import com.autoflow.engine.service.ExecutionService;
import com.autoflow.scheduler.DispatchScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep over execution records.
 *
 * Responsibilities:
 * - Time out executions stuck in RUNNING past their own or the default running timeout
 * - Dispatch again executions whose dispatch was lost (stale PENDING, overdue RETRYING)
 * - Continue parked executions whose approval was decided but never handed over
 * - Retry failed executions with exponential backoff, up to the retry budget
 * - Surface executions that ran out of retries
 * - Purge terminal executions past retention
 *
 * Every transition is a compare-and-set on status, so a walk finishing concurrently
 * always wins over the sweep or loses cleanly. Overlapping sweeps from several
 * replicas cannot double-retry an execution, but each replica surfaces exhausted
 * executions on its own.
 */
public class ExecutionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    private final WorkflowExecutionRepository executionRepository;
    private final StepRecordRepository stepRecordRepository;
    private final ApprovalRequestRepository approvalRepository;
    private final ExecutionService executionService;
    private final DispatchScheduler retryScheduler;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final SupervisorSettings settings;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private volatile Instant exhaustedWatermark = Instant.EPOCH;
    private volatile Instant decidedWatermark = Instant.EPOCH;

    public ExecutionSupervisor(
            WorkflowExecutionRepository executionRepository,
            StepRecordRepository stepRecordRepository,
            ApprovalRequestRepository approvalRepository,
            ExecutionService executionService,
            DispatchScheduler retryScheduler,
            WorkflowMetrics metrics,
            Clock clock,
            SupervisorSettings settings) {
        this.executionRepository = executionRepository;
        this.stepRecordRepository = stepRecordRepository;
        this.approvalRepository = approvalRepository;
        this.executionService = executionService;
        this.retryScheduler = retryScheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread thread = new Thread(r, "autoflow-supervisor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start sweeping and purging on their intervals.
     */
    public void start() {
        if (running) {
            log.warn("Execution supervisor already running");
            return;
        }

        running = true;
        log.info("Starting execution supervisor (sweep every {}s, running timeout {}m)",
            settings.sweepInterval().toSeconds(), settings.runningTimeout().toMinutes());

        scheduler.scheduleWithFixedDelay(
            this::scheduledSweep,
            settings.sweepInterval().toMillis(),
            settings.sweepInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );

        scheduler.scheduleWithFixedDelay(
            this::scheduledPurge,
            settings.purgeInterval().toMillis(),
            settings.purgeInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the supervisor.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Execution supervisor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one sweep now.
     */
    public SweepReport sweep() {
        Instant now = clock.instant();
        List<UUID> timedOut = timeOutStuck(now);
        List<UUID> redispatched = redispatchStale(now);
        List<UUID> resumed = resumeDecided(now);
        List<UUID> retried = retryFailed(now);
        List<UUID> exhausted = surfaceExhausted(now);

        SweepReport report = new SweepReport(now, timedOut, redispatched, resumed, retried, exhausted);
        if (!report.isEmpty()) {
            log.info("Sweep: {} timed out, {} re-dispatched, {} resumed, {} retried, {} exhausted",
                timedOut.size(), redispatched.size(), resumed.size(), retried.size(), exhausted.size());
        }
        return report;
    }

    /**
     * Delete terminal executions, and their step records, completed before the retention window.
     *
     * @return number of executions deleted
     */
    public int purge() {
        Instant cutoff = clock.instant().minus(settings.retention());
        List<UUID> purged = executionRepository.deleteTerminalBefore(cutoff);
        if (purged.isEmpty()) {
            return 0;
        }
        int records = stepRecordRepository.deleteByExecutions(purged);
        log.info("Purged {} executions and {} step records completed before {}", purged.size(), records, cutoff);
        return purged.size();
    }

    // ========== Scheduled Entry Points ==========

    private void scheduledSweep() {
        if (!running) return;

        try {
            sweep();
        } catch (Exception e) {
            log.error("Error in supervisor sweep", e);
        }
    }

    private void scheduledPurge() {
        if (!running) return;

        try {
            purge();
        } catch (Exception e) {
            log.error("Error in execution purge", e);
        }
    }

    // ========== Sweep Steps ==========

    private List<UUID> timeOutStuck(Instant now) {
        List<UUID> timedOut = new ArrayList<>();

        for (WorkflowExecution execution : executionRepository.findRunningTimedOut(
                now, settings.runningTimeout(), settings.batchSize())) {
            try (var ctx = LoggingContext.forExecution(execution.executionId(), execution.workflowId())) {
                Duration limit = execution.runningTimeout() != null
                    ? execution.runningTimeout()
                    : settings.runningTimeout();
                String message = "Execution timed out after " + limit.toMinutes() + " minutes";
                WorkflowExecution timeout = execution.toBuilder()
                    .status(ExecutionStatus.TIMEOUT)
                    .error(ErrorCodes.TIMEOUT, message)
                    .checkpointStepId(null)
                    .updatedAt(now)
                    .completedAt(now)
                    .build();
                if (executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.RUNNING, timeout)) {
                    metrics.executionTimedOut(execution.workflowId());
                    log.warn("Execution timed out, last update at {}", execution.updatedAt());
                    timedOut.add(execution.executionId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to time out execution {}", execution.executionId(), e);
            }
        }
        return timedOut;
    }

    private List<UUID> redispatchStale(Instant now) {
        List<UUID> redispatched = new ArrayList<>();
        Instant cutoff = now.minus(settings.startupGrace());

        List<WorkflowExecution> stale = new ArrayList<>(executionRepository.findByStatusCreatedBefore(
            ExecutionStatus.PENDING, cutoff, settings.batchSize()));
        stale.addAll(executionRepository.findRetryingDueBefore(cutoff, settings.batchSize()));

        for (WorkflowExecution execution : stale) {
            try (var ctx = LoggingContext.forExecution(execution.executionId(), execution.workflowId())) {
                if (executionService.dispatch(execution.executionId())) {
                    metrics.executionRedispatched(execution.workflowId());
                    log.warn("Re-dispatching stale {} execution created at {}", execution.status(), execution.createdAt());
                    redispatched.add(execution.executionId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to re-dispatch execution {}", execution.executionId(), e);
            }
        }
        return redispatched;
    }

    /**
     * Hand over approvals decided since the last sweep to executions still parked on them.
     * A decision that lands while its execution is mid-walk cannot be handed over at that
     * moment, so the watermark stops short of it and the next sweep tries again.
     */
    private List<UUID> resumeDecided(Instant now) {
        List<ApprovalRequest> decided = approvalRepository.findResolvedBetween(
            decidedWatermark, now, settings.batchSize());
        Instant watermark = decided.size() < settings.batchSize()
            ? now
            : decided.get(decided.size() - 1).respondedAt();

        List<UUID> resumed = new ArrayList<>();
        for (ApprovalRequest decision : decided) {
            Optional<WorkflowExecution> parked = executionRepository.findByApprovalId(decision.id())
                .filter(e -> e.status() == ExecutionStatus.PENDING_APPROVAL);
            if (parked.isEmpty()) {
                continue;
            }
            WorkflowExecution execution = parked.get();
            try (var ctx = LoggingContext.forExecution(execution.executionId(), execution.workflowId())) {
                if (executionService.resumeDecided(execution.executionId(), decision)) {
                    log.warn("Continuing parked execution after {} approval {}", decision.status(), decision.id());
                    resumed.add(execution.executionId());
                } else if (stillParked(execution.executionId())) {
                    watermark = decision.respondedAt().minusNanos(1);
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Failed to continue execution {} after approval {}",
                    execution.executionId(), decision.id(), e);
            }
        }
        decidedWatermark = watermark;
        return resumed;
    }

    private boolean stillParked(UUID executionId) {
        return executionRepository.findById(executionId)
            .map(e -> e.status() == ExecutionStatus.PENDING_APPROVAL)
            .orElse(false);
    }

    private List<UUID> retryFailed(Instant now) {
        List<UUID> retried = new ArrayList<>();
        RetryPolicy policy = settings.retryPolicy();

        for (WorkflowExecution execution : executionRepository.findRetryableFailed(settings.batchSize())) {
            try (var ctx = LoggingContext.forExecution(execution.executionId(), execution.workflowId())) {
                if (!policy.shouldRetry(execution.errorCode())
                        || !policy.hasMoreRetries(execution.retryCount(), execution.maxRetries())) {
                    markExhausted(execution, now);
                    continue;
                }

                Duration delay = policy.computeBackoff(execution.retryCount());
                int retryCount = execution.retryCount() + 1;
                WorkflowExecution retrying = execution.toBuilder()
                    .status(ExecutionStatus.RETRYING)
                    .retryCount(retryCount)
                    .nextAttemptAt(now.plus(delay))
                    .updatedAt(now)
                    .completedAt(null)
                    .build();
                if (!executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.FAILED, retrying)) {
                    continue;
                }
                retryScheduler.scheduleDelay(execution.executionId(), "retry " + retryCount, delay);
                metrics.executionRetried(execution.workflowId(), retryCount);
                log.info("Retry {}/{} scheduled in {}s after {}",
                    retryCount, execution.maxRetries(), delay.toSeconds(), execution.errorCode());
                retried.add(execution.executionId());
            } catch (RuntimeException e) {
                log.error("Failed to schedule retry for execution {}", execution.executionId(), e);
            }
        }
        return retried;
    }

    /**
     * Spend the remaining retry budget of a failure that must not be retried,
     * so it becomes terminal and is surfaced like any exhausted execution.
     */
    private void markExhausted(WorkflowExecution execution, Instant now) {
        WorkflowExecution exhausted = execution.toBuilder()
            .retryCount(execution.maxRetries())
            .updatedAt(now)
            .build();
        if (executionRepository.compareAndSetStatus(execution.executionId(), ExecutionStatus.FAILED, exhausted)) {
            log.debug("Error {} is not retryable", execution.errorCode());
        }
    }

    private List<UUID> surfaceExhausted(Instant now) {
        List<WorkflowExecution> exhausted = executionRepository.findExhaustedUpdatedBetween(
            exhaustedWatermark, now, settings.batchSize());
        exhaustedWatermark = exhausted.size() < settings.batchSize()
            ? now
            : exhausted.get(exhausted.size() - 1).updatedAt();

        List<UUID> surfaced = new ArrayList<>();
        for (WorkflowExecution execution : exhausted) {
            try (var ctx = LoggingContext.forExecution(execution.executionId(), execution.workflowId())) {
                metrics.executionExhausted(execution.workflowId());
                log.warn("{}: execution failed after {} retries with {}: {}",
                    ErrorCodes.RETRY_EXHAUSTED, execution.retryCount(), execution.errorCode(), execution.error());
            }
            surfaced.add(execution.executionId());
        }
        return surfaced;
    }
}
