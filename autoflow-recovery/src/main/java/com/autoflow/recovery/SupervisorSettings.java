package com.autoflow.recovery;

import com.autoflow.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tuning for the execution supervisor.
 *
 * @param sweepInterval  time between sweeps
 * @param runningTimeout RUNNING executions idle longer than this are timed out
 * @param startupGrace   PENDING executions older than this, and RETRYING executions overdue by
 *                       more than this, are dispatched again
 * @param retryPolicy    backoff and retry budget for failed executions
 * @param retention      terminal executions completed longer ago than this are purged
 * @param purgeInterval  time between purges
 * @param batchSize      maximum executions handled per category per sweep
 */
public record SupervisorSettings(
    Duration sweepInterval,
    Duration runningTimeout,
    Duration startupGrace,
    RetryPolicy retryPolicy,
    Duration retention,
    Duration purgeInterval,
    int batchSize
) {
    public SupervisorSettings {
        requirePositive(sweepInterval, "sweepInterval");
        requirePositive(runningTimeout, "runningTimeout");
        requirePositive(startupGrace, "startupGrace");
        requirePositive(retention, "retention");
        requirePositive(purgeInterval, "purgeInterval");
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(
            Duration.ofSeconds(30),
            Duration.ofMinutes(30),
            Duration.ofMinutes(5),
            RetryPolicy.defaultPolicy(),
            Duration.ofDays(90),
            Duration.ofDays(1),
            100);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
