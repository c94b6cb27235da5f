package com.autoflow.worker.handler;

import com.autoflow.worker.ConnectorException;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.autoflow.worker.connector.TaskTrackerConnector;
import com.autoflow.worker.connector.TaskTrackerConnector.TaskRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Creates a task in the tracker. Requires {@code name} and {@code project}.
 */
public class CreateTaskHandler implements StepHandler {

    private final TaskTrackerConnector connector;

    public CreateTaskHandler(TaskTrackerConnector connector) {
        this.connector = connector;
    }

    @Override
    public StepResult handle(StepContext context) {
        String name = context.text("name").orElse(null);
        String project = context.text("project").orElse(null);
        if (name == null || project == null) {
            return StepResult.invalidConfig("create_task requires 'name' and 'project'");
        }
        TaskRequest request = new TaskRequest(
            name,
            project,
            context.text("description").orElse(null),
            context.text("assignee").orElse(null),
            context.text("due_date").orElse(null)
        );

        try {
            String taskId = connector.createTask(request);
            ObjectNode output = context.newOutput();
            output.put("task_created", true);
            output.put("task_id", taskId);
            output.put("name", name);
            output.put("project", project);
            return StepResult.ok(output);
        } catch (ConnectorException e) {
            return StepResult.from(e);
        }
    }
}
