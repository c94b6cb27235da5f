package com.autoflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Comparison operators for step conditions and connection guards.
 * Unrecognized operator names parse to {@link #UNSUPPORTED}, which never matches.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty"),
    UNSUPPORTED("unsupported");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConditionOperator fromValue(String value) {
        if (value == null) {
            return UNSUPPORTED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "equals", "eq", "==" -> EQUALS;
            case "not_equals", "ne", "!=" -> NOT_EQUALS;
            case "contains" -> CONTAINS;
            case "not_contains" -> NOT_CONTAINS;
            case "gt", "greater_than", ">" -> GT;
            case "lt", "less_than", "<" -> LT;
            case "gte", "greater_than_or_equal", ">=" -> GTE;
            case "lte", "less_than_or_equal", "<=" -> LTE;
            case "is_empty" -> IS_EMPTY;
            case "is_not_empty" -> IS_NOT_EMPTY;
            default -> UNSUPPORTED;
        };
    }
}
