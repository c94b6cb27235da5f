package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * A predicate over the execution context.
 *
 * @param field    dot-path into the context, e.g. {@code "create-task.task_id"}
 * @param operator comparison operator
 * @param value    right-hand operand, ignored by the emptiness operators
 */
public record Condition(
    String field,
    ConditionOperator operator,
    JsonNode value
) {
    public Condition {
        if (value == null) {
            value = NullNode.getInstance();
        }
        if (operator == null) {
            operator = ConditionOperator.UNSUPPORTED;
        }
    }

    public static Condition of(String field, ConditionOperator operator, JsonNode value) {
        return new Condition(field, operator, value);
    }

    public static Condition of(String field, ConditionOperator operator, String value) {
        return new Condition(field, operator, TextNode.valueOf(value));
    }
}
