package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.List;

/**
 * One dispatchable unit of work inside a workflow definition.
 *
 * Invariants:
 * - id is unique within its definition
 * - conditions are evaluated before dispatch; any failure skips the step
 */
public record Step(
    String id,
    StepType type,
    String name,
    JsonNode config,
    List<Condition> conditions,
    boolean continueOnFailure
) {
    public Step {
        if (config == null) {
            config = JsonNodeFactory.instance.objectNode();
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Builder builder(String id, StepType type) {
        return new Builder(id, type);
    }

    public static class Builder {
        private final String id;
        private final StepType type;
        private String name;
        private JsonNode config;
        private List<Condition> conditions = List.of();
        private boolean continueOnFailure;

        private Builder(String id, StepType type) {
            this.id = id;
            this.type = type;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(JsonNode config) {
            this.config = config;
            return this;
        }

        public Builder conditions(List<Condition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder condition(Condition condition) {
            this.conditions = new ArrayList<>(this.conditions);
            this.conditions.add(condition);
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        public Step build() {
            return new Step(id, type, name, config, conditions, continueOnFailure);
        }
    }
}
