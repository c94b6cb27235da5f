package com.autoflow.worker.handler;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;

/**
 * Waits for {@code seconds + minutes*60 + hours*3600}. No external call.
 * Delays longer than the inline limit are rejected; longer waits belong in separate workflows.
 */
public class DelayHandler implements StepHandler {

    /**
     * Blocking wait, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;
    private final Duration maxInlineDelay;

    public DelayHandler(Duration maxInlineDelay) {
        this(duration -> Thread.sleep(duration.toMillis()), maxInlineDelay);
    }

    public DelayHandler(Sleeper sleeper, Duration maxInlineDelay) {
        this.sleeper = sleeper;
        this.maxInlineDelay = maxInlineDelay;
    }

    @Override
    public StepResult handle(StepContext context) {
        JsonNode config = context.getConfig();
        long seconds = config.path("seconds").asLong(0)
            + config.path("minutes").asLong(0) * 60
            + config.path("hours").asLong(0) * 3600;
        if (seconds < 0) {
            return StepResult.invalidConfig("delay must not be negative");
        }
        Duration delay = Duration.ofSeconds(seconds);
        if (delay.compareTo(maxInlineDelay) > 0) {
            return StepResult.invalidConfig(String.format(
                "delay of %ds exceeds the inline limit of %ds", seconds, maxInlineDelay.toSeconds()));
        }

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failure(ErrorCodes.STEP_EXECUTION_ERROR,
                "Delay interrupted", true);
        }

        ObjectNode output = context.newOutput();
        output.put("delay_completed", true);
        output.put("delay_seconds", seconds);
        return StepResult.ok(output);
    }
}
