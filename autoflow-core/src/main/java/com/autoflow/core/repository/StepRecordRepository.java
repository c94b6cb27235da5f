package com.autoflow.core.repository;

import com.autoflow.core.model.StepRecord;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Append-mostly store of step records.
 */
public interface StepRecordRepository {

    void save(StepRecord record);

    /**
     * Replace a record by its record id. Used to finish RUNNING and PENDING records.
     */
    void update(StepRecord record);

    /**
     * All records of an execution across attempts, in the order they were started.
     */
    List<StepRecord> findByExecution(UUID executionId);

    /**
     * Records of a single walk attempt, in the order they were started.
     */
    List<StepRecord> findByExecutionAndAttempt(UUID executionId, int attempt);

    int deleteByExecutions(Collection<UUID> executionIds);
}
