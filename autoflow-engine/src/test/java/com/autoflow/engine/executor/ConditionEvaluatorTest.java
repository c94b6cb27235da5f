package com.autoflow.engine.executor;

import com.autoflow.core.model.Condition;
import com.autoflow.core.model.ConditionOperator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final JsonNode context = read("""
        {
          "status": "open",
          "count": 5,
          "amount": "12.50",
          "tags": ["vip", "beta"],
          "subject": "Action required: renew",
          "empty": "",
          "lead": {"tier": "enterprise"}
        }
        """);

    @Test
    void nullCondition_passes() {
        assertThat(evaluator.evaluate(null, context)).isTrue();
        assertThat(evaluator.allPass(List.of(), context)).isTrue();
    }

    @Test
    void equals_comparesTextAndNumbersNumerically() {
        assertThat(check("status", ConditionOperator.EQUALS, "open")).isTrue();
        assertThat(check("status", ConditionOperator.EQUALS, "closed")).isFalse();
        assertThat(evaluator.evaluate(Condition.of("count", ConditionOperator.EQUALS, "5.0"), context)).isTrue();
        assertThat(evaluator.evaluate(Condition.of("amount", ConditionOperator.EQUALS, "12.5"), context)).isTrue();
        assertThat(check("status", ConditionOperator.NOT_EQUALS, "closed")).isTrue();
    }

    @Test
    void equals_missingFieldOnlyMatchesNull() {
        assertThat(evaluator.evaluate(Condition.of("nope", ConditionOperator.EQUALS, (String) null), context)).isTrue();
        assertThat(check("nope", ConditionOperator.EQUALS, "x")).isFalse();
    }

    @Test
    void contains_worksOnStringsAndArrays() {
        assertThat(check("subject", ConditionOperator.CONTAINS, "Action")).isTrue();
        assertThat(check("tags", ConditionOperator.CONTAINS, "vip")).isTrue();
        assertThat(check("tags", ConditionOperator.CONTAINS, "gold")).isFalse();
        assertThat(check("tags", ConditionOperator.NOT_CONTAINS, "gold")).isTrue();
        assertThat(check("nope", ConditionOperator.CONTAINS, "x")).isFalse();
    }

    @Test
    void ordering_requiresBothSidesNumeric() {
        assertThat(evaluator.evaluate(Condition.of("count", ConditionOperator.GT, IntNode.valueOf(3)), context)).isTrue();
        assertThat(evaluator.evaluate(Condition.of("count", ConditionOperator.LTE, IntNode.valueOf(5)), context)).isTrue();
        assertThat(evaluator.evaluate(Condition.of("count", ConditionOperator.LT, IntNode.valueOf(5)), context)).isFalse();
        assertThat(check("amount", ConditionOperator.GTE, "12")).isTrue();
        assertThat(check("status", ConditionOperator.GT, "a")).isFalse();
    }

    @Test
    void emptiness_coversMissingBlankAndEmptyContainers() {
        assertThat(check("empty", ConditionOperator.IS_EMPTY, null)).isTrue();
        assertThat(check("nope", ConditionOperator.IS_EMPTY, null)).isTrue();
        assertThat(check("tags", ConditionOperator.IS_EMPTY, null)).isFalse();
        assertThat(check("lead", ConditionOperator.IS_NOT_EMPTY, null)).isTrue();
    }

    @Test
    void nestedPathsResolve() {
        assertThat(check("lead.tier", ConditionOperator.EQUALS, "enterprise")).isTrue();
    }

    @Test
    void unsupportedOperator_isFalse() {
        assertThat(check("status", ConditionOperator.UNSUPPORTED, "open")).isFalse();
        assertThat(evaluator.allPass(List.of(
            Condition.of("status", ConditionOperator.EQUALS, "open"),
            Condition.of("status", ConditionOperator.UNSUPPORTED, "open")), context)).isFalse();
    }

    private boolean check(String field, ConditionOperator operator, String value) {
        return evaluator.evaluate(Condition.of(field, operator, value), context);
    }

    private JsonNode read(String json) {
        try {
            return mapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
