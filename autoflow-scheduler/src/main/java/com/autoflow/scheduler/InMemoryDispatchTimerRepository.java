package com.autoflow.scheduler;

import com.autoflow.scheduler.DispatchScheduler.DispatchTimerRepository;
import com.autoflow.scheduler.DispatchScheduler.ScheduledDispatch;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory timer store. Timers do not survive a restart; the supervisor's
 * lost-retry sweep re-dispatches RETRYING executions whose timer vanished.
 */
public class InMemoryDispatchTimerRepository implements DispatchTimerRepository {

    private final Map<UUID, ScheduledDispatch> timers = new ConcurrentHashMap<>();

    @Override
    public void save(ScheduledDispatch timer) {
        timers.put(timer.timerId(), timer);
    }

    @Override
    public List<ScheduledDispatch> findDue(Instant now, int limit) {
        return timers.values().stream()
            .filter(t -> !t.fired() && !t.fireAt().isAfter(now))
            .sorted(Comparator.comparing(ScheduledDispatch::fireAt))
            .limit(limit)
            .toList();
    }

    @Override
    public int cancelForExecution(UUID executionId) {
        AtomicInteger cancelled = new AtomicInteger();
        timers.values().removeIf(t -> {
            boolean match = !t.fired() && t.executionId().equals(executionId);
            if (match) {
                cancelled.incrementAndGet();
            }
            return match;
        });
        return cancelled.get();
    }

    @Override
    public boolean markFired(UUID timerId, Instant firedAt) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        timers.computeIfPresent(timerId, (id, timer) -> {
            if (timer.fired()) {
                return timer;
            }
            claimed.set(true);
            return timer.markFired(firedAt);
        });
        return claimed.get();
    }

    @Override
    public List<ScheduledDispatch> findPendingForExecution(UUID executionId) {
        return timers.values().stream()
            .filter(t -> !t.fired() && t.executionId().equals(executionId))
            .sorted(Comparator.comparing(ScheduledDispatch::fireAt))
            .toList();
    }

    /**
     * Remove fired timers older than the cutoff.
     */
    public int purgeFiredBefore(Instant cutoff) {
        int before = timers.size();
        timers.values().removeIf(t -> t.fired() && t.firedAt().isBefore(cutoff));
        return before - timers.size();
    }
}
