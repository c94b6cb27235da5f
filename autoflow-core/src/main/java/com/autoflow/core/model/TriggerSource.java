package com.autoflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Where an inbound trigger event came from.
 */
public enum TriggerSource {
    CHAT("chat"),
    EMAIL("email"),
    TASK_TRACKER("task_tracker"),
    SCHEDULED("scheduled"),
    MANUAL("manual"),
    WEBHOOK("webhook");

    private final String value;

    TriggerSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<TriggerSource> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.value.equals(normalized))
            .findFirst();
    }

    @JsonCreator
    public static TriggerSource fromValue(String value) {
        return find(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown trigger source: " + value));
    }
}
