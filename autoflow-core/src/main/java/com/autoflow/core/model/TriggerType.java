package com.autoflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * External event type that starts a walk.
 */
public enum TriggerType {
    EMAIL_RECEIVED("email_received"),
    CHAT_MESSAGE("chat_message"),
    TASK_CREATED("task_created"),
    TASK_COMPLETED("task_completed"),
    SCHEDULED("scheduled"),
    MANUAL("manual"),
    WEBHOOK("webhook"),
    ACTION_COMPILED("action_compiled");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<TriggerType> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(t -> t.value.equals(normalized))
            .findFirst();
    }

    @JsonCreator
    public static TriggerType fromValue(String value) {
        return find(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown trigger type: " + value));
    }
}
