package com.autoflow.triage;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classifier categories, highest tier first.
 */
public enum TriageCategory {
    URGENT("urgent", 4),
    HIGH_PRIORITY("high_priority", 3),
    ROUTINE("routine", 2),
    LOW_PRIORITY("low_priority", 1);

    private final String value;
    private final int tier;

    TriageCategory(String value, int tier) {
        this.value = value;
        this.tier = tier;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int tier() {
        return tier;
    }

    public boolean outranks(TriageCategory other) {
        return other == null || tier > other.tier;
    }
}
