package com.autoflow.engine.definition;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.Connection;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the graph rules of a definition before it is stored.
 * All violations are collected and reported in one exception.
 */
public class WorkflowDefinitionValidator {

    public void validate(WorkflowDefinition definition) {
        List<String> violations = violations(definition);
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException("Workflow definition " + definition.id(), violations);
        }
    }

    public List<String> violations(WorkflowDefinition definition) {
        List<String> violations = new ArrayList<>();

        if (isBlank(definition.id())) {
            violations.add("id cannot be empty");
        }
        if (isBlank(definition.name())) {
            violations.add("name cannot be empty");
        }
        if (definition.trigger() == null || isBlank(definition.trigger().id())) {
            violations.add("trigger is required");
            return violations;
        }
        String triggerId = definition.trigger().id();

        Set<String> stepIds = new HashSet<>();
        for (Step step : definition.steps()) {
            if (isBlank(step.id())) {
                violations.add("step id cannot be empty");
            } else if (step.id().equals(triggerId)) {
                violations.add("step id " + step.id() + " collides with the trigger id");
            } else if (!stepIds.add(step.id())) {
                violations.add("duplicate step id " + step.id());
            }
        }

        Set<String> connectionIds = new HashSet<>();
        for (Connection connection : definition.connections()) {
            if (!connectionIds.add(connection.id())) {
                violations.add("duplicate connection id " + connection.id());
            }
            if (!connection.fromId().equals(triggerId) && !stepIds.contains(connection.fromId())) {
                violations.add("connection " + connection.id() + " starts at unknown node " + connection.fromId());
            }
            if (connection.toId().equals(triggerId)) {
                violations.add("connection " + connection.id() + " targets the trigger");
            } else if (!stepIds.contains(connection.toId())) {
                violations.add("connection " + connection.id() + " targets unknown node " + connection.toId());
            }
        }

        findUnguardedCycle(definition.connections())
            .ifPresent(cycle -> violations.add("unguarded cycle through " + String.join(" -> ", cycle)));

        return violations;
    }

    /**
     * Depth-first search over unguarded connections only. A guarded connection can break
     * a loop at run time, so cycles that contain one are allowed.
     */
    Optional<List<String>> findUnguardedCycle(List<Connection> connections) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (Connection connection : connections) {
            if (!connection.isGuarded()) {
                edges.computeIfAbsent(connection.fromId(), k -> new ArrayList<>()).add(connection.toId());
            }
        }

        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        for (String start : edges.keySet()) {
            if (!state.containsKey(start)) {
                List<String> path = new ArrayList<>();
                List<String> cycle = visit(start, edges, state, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String node, Map<String, List<String>> edges,
                               Map<String, Integer> state, List<String> path) {
        state.put(node, 1);
        path.add(node);
        for (String next : edges.getOrDefault(node, List.of())) {
            Integer nextState = state.get(next);
            if (nextState == null) {
                List<String> cycle = visit(next, edges, state, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (nextState == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        state.put(node, 2);
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
