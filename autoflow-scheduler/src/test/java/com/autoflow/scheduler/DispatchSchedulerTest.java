package com.autoflow.scheduler;

import com.autoflow.core.test.TimeController;
import com.autoflow.scheduler.DispatchScheduler.ScheduledDispatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchSchedulerTest {

    private TimeController time;
    private InMemoryDispatchTimerRepository repository;
    private List<ScheduledDispatch> fired;
    private DispatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-03-04T10:00:00Z"));
        repository = new InMemoryDispatchTimerRepository();
        fired = new ArrayList<>();
        scheduler = new DispatchScheduler(repository, fired::add, time, Duration.ofSeconds(1));
    }

    @Test
    void dispatch_firesOnlyOnceDue() {
        UUID executionId = UUID.randomUUID();
        scheduler.scheduleDelay(executionId, "retry 1", Duration.ofMinutes(2));

        assertThat(scheduler.pollDue()).isZero();

        time.advanceMinutes(2);
        assertThat(scheduler.pollDue()).isEqualTo(1);
        assertThat(fired).extracting(ScheduledDispatch::executionId).containsExactly(executionId);

        time.advanceMinutes(5);
        assertThat(scheduler.pollDue()).isZero();
        assertThat(fired).hasSize(1);
    }

    @Test
    void dueDispatches_fireInFireTimeOrder() {
        UUID late = UUID.randomUUID();
        UUID early = UUID.randomUUID();
        scheduler.scheduleDelay(late, "retry 2", Duration.ofMinutes(4));
        scheduler.scheduleDelay(early, "retry 1", Duration.ofMinutes(1));

        time.advanceMinutes(10);
        scheduler.pollDue();

        assertThat(fired).extracting(ScheduledDispatch::executionId).containsExactly(early, late);
    }

    @Test
    void cancelFor_dropsPendingDispatches() {
        UUID executionId = UUID.randomUUID();
        scheduler.scheduleDelay(executionId, "retry 1", Duration.ofMinutes(1));

        assertThat(scheduler.cancelFor(executionId)).isEqualTo(1);
        time.advanceMinutes(5);

        assertThat(scheduler.pollDue()).isZero();
        assertThat(repository.findPendingForExecution(executionId)).isEmpty();
    }

    @Test
    void markFired_secondClaimFails() {
        UUID timerId = scheduler.scheduleDelay(UUID.randomUUID(), "retry 1", Duration.ZERO);

        assertThat(repository.markFired(timerId, time.now())).isTrue();
        assertThat(repository.markFired(timerId, time.now())).isFalse();
    }

    @Test
    void callbackFailure_doesNotStopOtherDispatches() {
        List<UUID> seen = new ArrayList<>();
        UUID bad = UUID.randomUUID();
        DispatchScheduler failing = new DispatchScheduler(repository, d -> {
            seen.add(d.executionId());
            if (d.executionId().equals(bad)) {
                throw new IllegalStateException("store unavailable");
            }
        }, time, Duration.ofSeconds(1));
        failing.scheduleDelay(bad, "retry", Duration.ofSeconds(1));
        failing.scheduleDelay(UUID.randomUUID(), "retry", Duration.ofSeconds(2));

        time.advanceSeconds(5);

        assertThat(failing.pollDue()).isEqualTo(1);
        assertThat(seen).hasSize(2);
    }

    @Test
    void purgeFiredBefore_removesOnlyOldFiredTimers() {
        scheduler.scheduleDelay(UUID.randomUUID(), "retry", Duration.ZERO);
        scheduler.pollDue();
        scheduler.scheduleDelay(UUID.randomUUID(), "retry", Duration.ofHours(1));

        time.advanceMinutes(10);

        assertThat(repository.purgeFiredBefore(time.now())).isEqualTo(1);
    }
}
