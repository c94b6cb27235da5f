package com.autoflow.engine.definition;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.Condition;
import com.autoflow.core.model.ConditionOperator;
import com.autoflow.core.model.Connection;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.Trigger;
import com.autoflow.core.model.TriggerType;
import com.autoflow.core.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds definitions from the workflow editor's JSON shape:
 * <pre>
 * {
 *   "id": "...", "name": "...", "description": "...", "enabled": true,
 *   "trigger": {"id": "...", "type": "email_received", "name": "...", "config": {}},
 *   "steps": [{"id": "...", "type": "create_task", "name": "...", "config": {},
 *              "conditions": [{"field": "...", "operator": "equals", "value": ...}],
 *              "continue_on_failure": false}],
 *   "connections": [{"id": "...", "from_id": "...", "to_id": "...", "condition": {...}}],
 *   "variables": {}
 * }
 * </pre>
 * {@code actions} is accepted in place of {@code steps}. Missing step and connection ids
 * become {@code step-<n>} and {@code conn-<n>}, counted from 1.
 * Shape errors are collected and reported together; graph rules are checked later by
 * {@link WorkflowDefinitionValidator}.
 */
public class WorkflowDefinitionParser {

    static final String DEFAULT_TRIGGER_ID = "trigger";

    private final Clock clock;

    public WorkflowDefinitionParser(Clock clock) {
        this.clock = clock;
    }

    public WorkflowDefinition parse(JsonNode json, String createdBy) {
        if (json == null || !json.isObject()) {
            throw new WorkflowValidationException("Workflow definition must be a JSON object");
        }
        List<String> violations = new ArrayList<>();

        String id = text(json, "id").orElseGet(() -> UUID.randomUUID().toString());
        Trigger trigger = parseTrigger(json.path("trigger"), violations);

        JsonNode stepsNode = json.has("steps") ? json.path("steps") : json.path("actions");
        List<Step> steps = new ArrayList<>();
        if (stepsNode.isArray()) {
            int index = 0;
            for (JsonNode stepNode : stepsNode) {
                index++;
                parseStep(stepNode, index, violations).ifPresent(steps::add);
            }
        } else if (!stepsNode.isMissingNode()) {
            violations.add("steps must be an array");
        }

        List<Connection> connections = new ArrayList<>();
        JsonNode connectionsNode = json.path("connections");
        if (connectionsNode.isArray()) {
            int index = 0;
            for (JsonNode connectionNode : connectionsNode) {
                index++;
                parseConnection(connectionNode, index, violations).ifPresent(connections::add);
            }
        } else if (!connectionsNode.isMissingNode()) {
            violations.add("connections must be an array");
        }

        JsonNode variables = json.path("variables");
        if (!variables.isMissingNode() && !variables.isNull() && !variables.isObject()) {
            violations.add("variables must be an object");
        }

        if (!violations.isEmpty()) {
            throw new WorkflowValidationException("Workflow definition " + id, violations);
        }

        return WorkflowDefinition.builder()
            .id(id)
            .name(text(json, "name").orElse(null))
            .description(text(json, "description").orElse(""))
            .trigger(trigger)
            .steps(steps)
            .connections(connections)
            .variables(variables.isObject() ? variables.deepCopy() : null)
            .enabled(json.path("enabled").asBoolean(true))
            .createdAt(clock.instant())
            .createdBy(createdBy)
            .build();
    }

    // ========== Nodes ==========

    private Trigger parseTrigger(JsonNode node, List<String> violations) {
        if (!node.isObject()) {
            violations.add("trigger is required");
            return null;
        }
        String rawType = text(node, "type").orElse(null);
        Optional<TriggerType> type = TriggerType.find(rawType);
        if (type.isEmpty()) {
            violations.add("trigger has unknown type '" + rawType + "'");
            return null;
        }
        return new Trigger(
            text(node, "id").orElse(DEFAULT_TRIGGER_ID),
            type.get(),
            text(node, "name").orElse(type.get().value()),
            node.path("config").isObject() ? node.path("config").deepCopy() : null
        );
    }

    private Optional<Step> parseStep(JsonNode node, int index, List<String> violations) {
        String id = text(node, "id").orElse("step-" + index);
        String rawType = text(node, "type").orElse(null);
        Optional<StepType> type = StepType.find(rawType);
        if (type.isEmpty()) {
            violations.add("step " + id + " has unknown type '" + rawType + "'");
            return Optional.empty();
        }

        Step.Builder builder = Step.builder(id, type.get())
            .name(text(node, "name").orElse(id))
            .continueOnFailure(node.path("continue_on_failure").asBoolean(false));
        if (node.path("config").isObject()) {
            builder.config(node.path("config").deepCopy());
        }
        JsonNode conditions = node.path("conditions");
        if (conditions.isArray()) {
            for (JsonNode condition : conditions) {
                parseCondition(condition, "step " + id, violations).ifPresent(builder::condition);
            }
        }
        return Optional.of(builder.build());
    }

    private Optional<Connection> parseConnection(JsonNode node, int index, List<String> violations) {
        String id = text(node, "id").orElse("conn-" + index);
        Optional<String> from = text(node, "from_id");
        Optional<String> to = text(node, "to_id");
        if (from.isEmpty() || to.isEmpty()) {
            violations.add("connection " + id + " needs from_id and to_id");
            return Optional.empty();
        }
        JsonNode guardNode = node.has("condition") ? node.path("condition") : node.path("guard");
        if (guardNode.isObject()) {
            Optional<Condition> guard = parseCondition(guardNode, "connection " + id, violations);
            return guard.map(g -> Connection.guarded(id, from.get(), to.get(), g));
        }
        return Optional.of(Connection.of(id, from.get(), to.get()));
    }

    private Optional<Condition> parseCondition(JsonNode node, String owner, List<String> violations) {
        Optional<String> field = text(node, "field");
        if (field.isEmpty()) {
            violations.add(owner + " has a condition without a field");
            return Optional.empty();
        }
        // Unknown operators are kept and evaluate to false at run time
        ConditionOperator operator = ConditionOperator.fromValue(text(node, "operator").orElse("equals"));
        return Optional.of(Condition.of(field.get(), operator, node.path("value").isMissingNode()
            ? null : node.path("value").deepCopy()));
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
