package com.autoflow.core.model;

import com.autoflow.core.exception.ErrorCodes;
import java.time.Duration;
import java.util.Set;

/**
 * Retry behavior for failed executions.
 * Immutable and shared by the supervisor.
 *
 * Invariants:
 * - maxRetries >= 0
 * - baseBackoff > 0
 * - backoff(n) = baseBackoff * 2^n, strictly increasing in n
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseBackoff,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseBackoff == null || baseBackoff.isZero() || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff must be positive");
        }
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default retry policy: 3 retries, backoff of 1, 2 and 4 minutes.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofMinutes(1), ErrorCodes.NON_RETRYABLE);
    }

    /**
     * No retry policy: failures are terminal immediately.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ofSeconds(1), Set.of());
    }

    /**
     * Compute the delay before the next attempt.
     *
     * @param retryCount retries already performed (0 for the first retry)
     * @return baseBackoff * 2^retryCount
     */
    public Duration computeBackoff(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must be >= 0");
        }
        if (retryCount > 30) {
            throw new IllegalArgumentException("Retry count too large: " + retryCount);
        }
        return baseBackoff.multipliedBy(1L << retryCount);
    }

    /**
     * Check if the given error code should trigger a retry.
     */
    public boolean shouldRetry(String errorCode) {
        return errorCode == null || !nonRetryableErrors.contains(errorCode);
    }

    /**
     * Check if more retries are available.
     *
     * @param retryCount retries already performed
     * @param limit      per-execution retry limit
     */
    public boolean hasMoreRetries(int retryCount, int limit) {
        return retryCount < Math.min(limit, maxRetries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private Duration baseBackoff = Duration.ofMinutes(1);
        private Set<String> nonRetryableErrors = ErrorCodes.NON_RETRYABLE;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseBackoff(Duration baseBackoff) {
            this.baseBackoff = baseBackoff;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, baseBackoff, nonRetryableErrors);
        }
    }
}
