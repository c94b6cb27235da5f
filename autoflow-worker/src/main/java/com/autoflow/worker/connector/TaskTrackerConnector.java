package com.autoflow.worker.connector;

import com.autoflow.worker.ConnectorException;

/**
 * Task creation in an external tracker.
 */
public interface TaskTrackerConnector {

    /**
     * Create a task and return its id in the tracker.
     */
    String createTask(TaskRequest request) throws ConnectorException;

    /**
     * Fields of a new task. Optional fields may be null.
     */
    record TaskRequest(
        String name,
        String project,
        String description,
        String assignee,
        String dueDate
    ) {
    }
}
