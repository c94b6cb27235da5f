package com.autoflow.core.model;

import com.autoflow.core.exception.ErrorCodes;
import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.util.Set;
import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldUseMinuteBaseAndThreeRetries() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxRetries());
        assertEquals(Duration.ofMinutes(1), policy.baseBackoff());
        assertTrue(policy.nonRetryableErrors().contains(ErrorCodes.INVALID_STEP_CONFIG));
    }

    @Test
    void computeBackoff_shouldDoubleEachRetry() {
        RetryPolicy policy = RetryPolicy.builder()
            .baseBackoff(Duration.ofSeconds(10))
            .build();

        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(0));
        assertEquals(Duration.ofSeconds(20), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(40), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(80), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldBeStrictlyIncreasing() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        Duration previous = Duration.ZERO;
        for (int n = 0; n < 10; n++) {
            Duration current = policy.computeBackoff(n);
            assertTrue(current.compareTo(previous) > 0, "backoff must grow at retry " + n);
            previous = current;
        }
    }

    @Test
    void computeBackoff_withNegativeCount_shouldThrow() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.computeBackoff(-1));
    }

    @Test
    void shouldRetry_withNonRetryableError_shouldReturnFalse() {
        RetryPolicy policy = RetryPolicy.builder()
            .nonRetryableErrors(Set.of("INVALID_STEP_CONFIG"))
            .build();

        assertFalse(policy.shouldRetry("INVALID_STEP_CONFIG"));
        assertTrue(policy.shouldRetry("CONNECTOR_ERROR"));
        assertTrue(policy.shouldRetry(null));
    }

    @Test
    void hasMoreRetries_shouldRespectSmallerLimit() {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(3).build();

        assertTrue(policy.hasMoreRetries(0, 3));
        assertTrue(policy.hasMoreRetries(1, 2));
        assertFalse(policy.hasMoreRetries(2, 2));
        assertFalse(policy.hasMoreRetries(3, 5));
    }

    @Test
    void constructor_withZeroBackoff_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Set.of()));
    }
}
