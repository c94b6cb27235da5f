package com.autoflow.engine.executor;

import com.autoflow.core.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Variable bag of one walk: definition variables, overlaid by the trigger payload,
 * then each step's output under its step id.
 * Owned by a single walk and never shared.
 */
public final class ExecutionContext {

    private final ObjectNode values;

    private ExecutionContext(ObjectNode values) {
        this.values = values;
    }

    public static ExecutionContext initial(WorkflowDefinition definition, JsonNode triggerPayload) {
        ObjectNode values = JsonNodeFactory.instance.objectNode();
        overlay(values, definition.variables());
        overlay(values, triggerPayload);
        return new ExecutionContext(values);
    }

    /**
     * Rebuild a context from a checkpoint snapshot.
     */
    public static ExecutionContext restore(JsonNode snapshot) {
        ObjectNode values = JsonNodeFactory.instance.objectNode();
        overlay(values, snapshot);
        return new ExecutionContext(values);
    }

    /**
     * Store a step output under the step id. Null or missing outputs are ignored.
     */
    public void merge(String stepId, JsonNode output) {
        if (output == null || output.isMissingNode() || output.isNull()) {
            return;
        }
        values.set(stepId, output.deepCopy());
    }

    public JsonNode values() {
        return values;
    }

    /**
     * Detached copy, safe to persist while the walk continues.
     */
    public ObjectNode snapshot() {
        return values.deepCopy();
    }

    private static void overlay(ObjectNode target, JsonNode source) {
        if (source != null && source.isObject()) {
            source.fields().forEachRemaining(e -> target.set(e.getKey(), e.getValue().deepCopy()));
        }
    }
}
