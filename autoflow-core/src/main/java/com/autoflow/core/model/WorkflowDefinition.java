package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable definition of a workflow graph.
 * Versioned by re-creation: registering an existing id stores the next version.
 *
 * Primary Key: {id}:{version}
 *
 * Invariants (checked at creation):
 * - step ids are unique and distinct from the trigger id
 * - every connection endpoint resolves to the trigger or a step
 * - no connection targets the trigger
 * - no cycle consists only of unguarded connections
 */
public record WorkflowDefinition(
    // Identity
    String id,
    int version,
    String name,
    String description,

    // Graph structure
    Trigger trigger,
    List<Step> steps,
    List<Connection> connections,

    // Defaults merged into every execution context
    JsonNode variables,
    boolean enabled,

    // Metadata
    Instant createdAt,
    String createdBy
) {
    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
        connections = connections == null ? List.of() : List.copyOf(connections);
        if (variables == null) {
            variables = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Construct the versioned key of this definition.
     */
    public String versionKey() {
        return id + ":" + version;
    }

    /**
     * Get a step by ID.
     */
    public Optional<Step> getStep(String stepId) {
        return steps.stream()
            .filter(s -> s.id().equals(stepId))
            .findFirst();
    }

    /**
     * Outgoing connections of a node, in declaration order.
     */
    public List<Connection> outgoing(String nodeId) {
        return connections.stream()
            .filter(c -> c.fromId().equals(nodeId))
            .toList();
    }

    /**
     * Check if a node id names the trigger or a step.
     */
    public boolean hasNode(String nodeId) {
        return (trigger != null && trigger.id().equals(nodeId)) || getStep(nodeId).isPresent();
    }

    /**
     * Copy as the given version, used when re-creating an existing definition.
     */
    public WorkflowDefinition withVersion(int newVersion) {
        return new WorkflowDefinition(
            id, newVersion, name, description, trigger, steps, connections,
            variables, enabled, createdAt, createdBy
        );
    }

    public WorkflowDefinition withEnabled(boolean newEnabled) {
        return new WorkflowDefinition(
            id, version, name, description, trigger, steps, connections,
            variables, newEnabled, createdAt, createdBy
        );
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private int version = 1;
        private String name;
        private String description;
        private Trigger trigger;
        private final List<Step> steps = new ArrayList<>();
        private final List<Connection> connections = new ArrayList<>();
        private JsonNode variables;
        private boolean enabled = true;
        private Instant createdAt = Instant.now();
        private String createdBy;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder trigger(String triggerId, TriggerType type) {
            this.trigger = new Trigger(triggerId, type, triggerId, null);
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<Step> steps) {
            this.steps.addAll(steps);
            return this;
        }

        public Builder connect(String fromId, String toId) {
            this.connections.add(Connection.of("conn-" + connections.size(), fromId, toId));
            return this;
        }

        public Builder connect(String fromId, String toId, Condition guard) {
            this.connections.add(Connection.guarded("conn-" + connections.size(), fromId, toId, guard));
            return this;
        }

        public Builder connection(Connection connection) {
            this.connections.add(connection);
            return this;
        }

        public Builder connections(List<Connection> connections) {
            this.connections.addAll(connections);
            return this;
        }

        public Builder variables(JsonNode variables) {
            this.variables = variables;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                id, version, name, description, trigger, steps, connections,
                variables, enabled, createdAt, createdBy
            );
        }
    }
}
