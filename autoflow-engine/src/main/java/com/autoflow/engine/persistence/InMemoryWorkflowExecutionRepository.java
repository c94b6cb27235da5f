package com.autoflow.engine.persistence;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.WorkflowExecutionRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory execution store. Compare-and-set runs inside {@link ConcurrentHashMap#computeIfPresent},
 * which is atomic per key.
 */
public class InMemoryWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private final Map<UUID, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowExecution execution) {
        if (executions.putIfAbsent(execution.executionId(), execution) != null) {
            throw new IllegalStateException("Execution already exists: " + execution.executionId());
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public boolean compareAndSetStatus(UUID executionId, ExecutionStatus expected, WorkflowExecution updated) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        executions.computeIfPresent(executionId, (id, current) -> {
            if (current.status() != expected) {
                return current;
            }
            swapped.set(true);
            return updated;
        });
        return swapped.get();
    }

    @Override
    public List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == status)
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findRunningTimedOut(Instant now, Duration defaultTimeout, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == ExecutionStatus.RUNNING && e.updatedAt() != null)
            .filter(e -> e.updatedAt()
                .plus(e.runningTimeout() != null ? e.runningTimeout() : defaultTimeout)
                .isBefore(now))
            .sorted(Comparator.comparing(WorkflowExecution::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findByStatusCreatedBefore(ExecutionStatus status, Instant cutoff, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == status)
            .filter(e -> e.createdAt().isBefore(cutoff))
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findRetryingDueBefore(Instant cutoff, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == ExecutionStatus.RETRYING)
            .filter(e -> e.nextAttemptAt() != null && e.nextAttemptAt().isBefore(cutoff))
            .sorted(Comparator.comparing(WorkflowExecution::nextAttemptAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findRetryableFailed(int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == ExecutionStatus.FAILED && e.hasRetriesLeft())
            .sorted(Comparator.comparing(WorkflowExecution::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findExhaustedUpdatedBetween(Instant after, Instant until, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == ExecutionStatus.FAILED && !e.hasRetriesLeft())
            .filter(e -> e.updatedAt().isAfter(after) && !e.updatedAt().isAfter(until))
            .sorted(Comparator.comparing(WorkflowExecution::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<WorkflowExecution> findByApprovalId(UUID approvalId) {
        return executions.values().stream()
            .filter(e -> Objects.equals(e.approvalId(), approvalId))
            .findFirst();
    }

    @Override
    public List<WorkflowExecution> findByWorkflowId(String workflowId, int limit) {
        return executions.values().stream()
            .filter(e -> e.workflowId().equals(workflowId))
            .sorted(Comparator.comparing(WorkflowExecution::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        executions.values().forEach(e -> counts.merge(e.status(), 1L, Long::sum));
        return counts;
    }

    @Override
    public List<UUID> deleteTerminalBefore(Instant completedBefore) {
        List<UUID> toDelete = executions.values().stream()
            .filter(WorkflowExecution::isTerminal)
            .filter(e -> e.completedAt() != null && e.completedAt().isBefore(completedBefore))
            .map(WorkflowExecution::executionId)
            .collect(Collectors.toList());

        toDelete.forEach(executions::remove);
        return toDelete;
    }
}
