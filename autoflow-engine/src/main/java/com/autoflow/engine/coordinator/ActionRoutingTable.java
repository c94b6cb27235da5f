package com.autoflow.engine.coordinator;

import com.autoflow.core.model.ActionKind;
import com.autoflow.engine.definition.WorkflowTemplates;

import java.util.EnumMap;
import java.util.Map;

/**
 * Which workflow runs a compiled action, by action kind.
 * Starts from the built-in kind workflows; overrides replace individual entries.
 */
public class ActionRoutingTable {

    private final Map<ActionKind, String> routes = new EnumMap<>(ActionKind.class);

    public ActionRoutingTable(Map<ActionKind, String> overrides) {
        routes.putAll(WorkflowTemplates.kindWorkflows());
        overrides.forEach((kind, workflowId) -> {
            if (workflowId != null && !workflowId.isBlank()) {
                routes.put(kind, workflowId);
            }
        });
    }

    public static ActionRoutingTable defaults() {
        return new ActionRoutingTable(Map.of());
    }

    public String workflowFor(ActionKind kind) {
        return routes.get(kind);
    }

    public Map<ActionKind, String> routes() {
        return Map.copyOf(routes);
    }
}
