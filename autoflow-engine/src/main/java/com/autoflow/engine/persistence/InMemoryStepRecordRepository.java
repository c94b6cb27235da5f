package com.autoflow.engine.persistence;

import com.autoflow.core.model.StepRecord;
import com.autoflow.core.repository.StepRecordRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory step record store, kept per execution in start order.
 */
public class InMemoryStepRecordRepository implements StepRecordRepository {

    private final Map<UUID, List<StepRecord>> recordsByExecution = new ConcurrentHashMap<>();

    @Override
    public void save(StepRecord record) {
        recordsByExecution.computeIfAbsent(record.executionId(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public void update(StepRecord record) {
        List<StepRecord> records = recordsByExecution.get(record.executionId());
        if (records == null) {
            throw new IllegalStateException("No records for execution " + record.executionId());
        }
        synchronized (records) {
            for (int i = 0; i < records.size(); i++) {
                if (records.get(i).recordId().equals(record.recordId())) {
                    records.set(i, record);
                    return;
                }
            }
        }
        throw new IllegalStateException("Unknown step record " + record.recordId());
    }

    @Override
    public List<StepRecord> findByExecution(UUID executionId) {
        return new ArrayList<>(recordsByExecution.getOrDefault(executionId, List.of()));
    }

    @Override
    public List<StepRecord> findByExecutionAndAttempt(UUID executionId, int attempt) {
        return recordsByExecution.getOrDefault(executionId, List.of()).stream()
            .filter(r -> r.attempt() == attempt)
            .collect(Collectors.toList());
    }

    @Override
    public int deleteByExecutions(Collection<UUID> executionIds) {
        int deleted = 0;
        for (UUID executionId : executionIds) {
            List<StepRecord> removed = recordsByExecution.remove(executionId);
            if (removed != null) {
                deleted += removed.size();
            }
        }
        return deleted;
    }
}
