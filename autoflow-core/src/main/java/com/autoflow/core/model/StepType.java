package com.autoflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of step types. Each maps to exactly one handler.
 */
public enum StepType {
    SEND_NOTIFICATION("send_notification"),
    CREATE_TASK("create_task"),
    SEND_MESSAGE("send_message"),
    SCHEDULE_EVENT("schedule_event"),
    WEBHOOK_CALL("webhook_call"),
    DELAY("delay"),
    SET_VARIABLE("set_variable"),
    /** Pauses the walk until an approver decides. Handled by the executor itself. */
    APPROVAL_GATE("approval_gate");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolve a wire name, accepting the enum constant name too.
     */
    public static Optional<StepType> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("update_status".equals(normalized)) {
            return Optional.of(SET_VARIABLE);
        }
        return Arrays.stream(values())
            .filter(t -> t.value.equals(normalized))
            .findFirst();
    }

    @JsonCreator
    public static StepType fromValue(String value) {
        return find(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown step type: " + value));
    }
}
