package com.autoflow.recovery;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * What one supervisor sweep did.
 *
 * @param sweptAt       clock time of the sweep
 * @param timedOut      RUNNING executions moved to TIMEOUT
 * @param redispatched  stale PENDING or overdue RETRYING executions dispatched again
 * @param resumed       parked executions continued after their approval was decided
 * @param retried       FAILED executions moved to RETRYING
 * @param exhausted     FAILED executions with no retries left, each listed in exactly one sweep
 */
public record SweepReport(
    Instant sweptAt,
    List<UUID> timedOut,
    List<UUID> redispatched,
    List<UUID> resumed,
    List<UUID> retried,
    List<UUID> exhausted
) {
    public SweepReport {
        timedOut = List.copyOf(timedOut);
        redispatched = List.copyOf(redispatched);
        resumed = List.copyOf(resumed);
        retried = List.copyOf(retried);
        exhausted = List.copyOf(exhausted);
    }

    public boolean isEmpty() {
        return timedOut.isEmpty() && redispatched.isEmpty() && resumed.isEmpty()
            && retried.isEmpty() && exhausted.isEmpty();
    }
}
