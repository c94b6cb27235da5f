package com.autoflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

/**
 * Delayed re-dispatch queue for executions.
 *
 * Responsibilities:
 * - Hold a dispatch until its fire time (retry backoff)
 * - Fire due dispatches to the callback, at most once each
 * - Drop pending dispatches of cancelled executions
 */
public class DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private static final int BATCH_SIZE = 100;

    private final DispatchTimerRepository timerRepository;
    private final DispatchCallback callback;
    private final Clock clock;
    private final Duration pollInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public DispatchScheduler(
            DispatchTimerRepository timerRepository,
            DispatchCallback callback,
            Clock clock,
            Duration pollInterval) {
        this.timerRepository = timerRepository;
        this.callback = callback;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "autoflow-dispatch-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start polling for due dispatches.
     */
    public void start() {
        if (running) {
            log.warn("Dispatch scheduler already running");
            return;
        }

        running = true;
        log.info("Starting dispatch scheduler (poll every {})", pollInterval);

        scheduler.scheduleWithFixedDelay(
            this::pollSafely,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler. Pending dispatches stay in the repository.
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
        log.info("Dispatch scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedule an execution to be dispatched at a specific time.
     *
     * @param executionId the execution to dispatch
     * @param reason      why the dispatch was scheduled, for logs
     * @param fireAt      when to dispatch
     * @return the timer ID
     */
    public UUID scheduleDispatch(UUID executionId, String reason, Instant fireAt) {
        ScheduledDispatch timer = new ScheduledDispatch(
            UUID.randomUUID(),
            executionId,
            reason,
            fireAt,
            false,
            null,
            clock.instant()
        );

        timerRepository.save(timer);

        log.info("Scheduled dispatch {} of execution {} at {} ({})",
            timer.timerId(), executionId, fireAt, reason);
        return timer.timerId();
    }

    /**
     * Schedule an execution to be dispatched after a delay.
     */
    public UUID scheduleDelay(UUID executionId, String reason, Duration delay) {
        return scheduleDispatch(executionId, reason, clock.instant().plus(delay));
    }

    /**
     * Cancel every pending dispatch of an execution.
     *
     * @return number of cancelled timers
     */
    public int cancelFor(UUID executionId) {
        return timerRepository.cancelForExecution(executionId);
    }

    /**
     * Fire all due dispatches once.
     *
     * @return number of dispatches fired
     */
    public int pollDue() {
        Instant now = clock.instant();
        List<ScheduledDispatch> due = timerRepository.findDue(now, BATCH_SIZE);

        int fired = 0;
        for (ScheduledDispatch timer : due) {
            try {
                if (fire(timer, now)) {
                    fired++;
                }
            } catch (Exception e) {
                log.error("Failed to fire dispatch {} for execution {}", timer.timerId(), timer.executionId(), e);
            }
        }
        return fired;
    }

    private void pollSafely() {
        if (!running) return;

        try {
            pollDue();
        } catch (Exception e) {
            log.error("Error polling dispatch timers", e);
        }
    }

    private boolean fire(ScheduledDispatch timer, Instant now) {
        // Claim first so two pollers never fire the same timer
        if (!timerRepository.markFired(timer.timerId(), now)) {
            return false;
        }
        log.info("Firing dispatch {} for execution {} ({})", timer.timerId(), timer.executionId(), timer.reason());
        callback.onDispatchDue(timer);
        return true;
    }

    /**
     * Receives due dispatches.
     */
    @FunctionalInterface
    public interface DispatchCallback {
        void onDispatchDue(ScheduledDispatch dispatch);
    }

    /**
     * Repository for scheduled dispatches.
     */
    public interface DispatchTimerRepository {
        void save(ScheduledDispatch timer);
        List<ScheduledDispatch> findDue(Instant now, int limit);
        int cancelForExecution(UUID executionId);

        /**
         * Mark a timer fired.
         *
         * @return false if it was already fired or cancelled
         */
        boolean markFired(UUID timerId, Instant firedAt);

        List<ScheduledDispatch> findPendingForExecution(UUID executionId);
    }

    /**
     * Scheduled dispatch record.
     */
    public record ScheduledDispatch(
        UUID timerId,
        UUID executionId,
        String reason,
        Instant fireAt,
        boolean fired,
        Instant firedAt,
        Instant createdAt
    ) {
        ScheduledDispatch markFired(Instant at) {
            return new ScheduledDispatch(timerId, executionId, reason, fireAt, true, at, createdAt);
        }
    }
}
