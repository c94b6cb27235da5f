package com.autoflow.engine.executor;

import com.autoflow.core.model.Condition;
import com.autoflow.worker.JsonPaths;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates step conditions and connection guards against an execution context.
 * Never throws: an operator it cannot apply evaluates to false.
 *
 * Comparison rules:
 * - two numeric operands (numbers or numeric strings) compare as decimals
 * - otherwise operands compare by their text form
 * - ordering operators are false unless both operands are numeric
 * - a missing field behaves like null
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    /**
     * Check that every condition passes. An empty list passes.
     */
    public boolean allPass(List<Condition> conditions, JsonNode context) {
        for (Condition condition : conditions) {
            if (!evaluate(condition, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluate one condition. A null condition (an unguarded edge) passes.
     */
    public boolean evaluate(Condition condition, JsonNode context) {
        if (condition == null) {
            return true;
        }
        JsonNode actual = JsonPaths.resolve(context, condition.field());
        JsonNode expected = condition.value();

        return switch (condition.operator()) {
            case EQUALS -> isEqual(actual, expected);
            case NOT_EQUALS -> !isEqual(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case GT -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LT -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case GTE -> compare(actual, expected).map(c -> c >= 0).orElse(false);
            case LTE -> compare(actual, expected).map(c -> c <= 0).orElse(false);
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
            case UNSUPPORTED -> {
                log.warn("Unsupported operator on field '{}', condition evaluates to false",
                    condition.field());
                yield false;
            }
        };
    }

    // ========== Operators ==========

    private boolean isEqual(JsonNode actual, JsonNode expected) {
        boolean actualAbsent = isNull(actual);
        boolean expectedAbsent = isNull(expected);
        if (actualAbsent || expectedAbsent) {
            return actualAbsent && expectedAbsent;
        }
        Optional<BigDecimal> left = asNumber(actual);
        Optional<BigDecimal> right = asNumber(expected);
        if (left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get()) == 0;
        }
        return text(actual).equals(text(expected));
    }

    private boolean contains(JsonNode actual, JsonNode expected) {
        if (isNull(actual) || isNull(expected)) {
            return false;
        }
        if (actual.isArray()) {
            for (JsonNode element : actual) {
                if (isEqual(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (actual.isValueNode()) {
            return actual.asText().contains(text(expected));
        }
        return false;
    }

    private Optional<Integer> compare(JsonNode actual, JsonNode expected) {
        Optional<BigDecimal> left = asNumber(actual);
        Optional<BigDecimal> right = asNumber(expected);
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(left.get().compareTo(right.get()));
    }

    private boolean isEmpty(JsonNode node) {
        if (isNull(node)) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.isEmpty();
        }
        return false;
    }

    // ========== Helpers ==========

    private static boolean isNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    private static Optional<BigDecimal> asNumber(JsonNode node) {
        if (isNull(node)) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(raw));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String text(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
