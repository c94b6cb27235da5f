package com.autoflow.worker;

/**
 * Handler for one step type.
 * Handlers may block on connector I/O but must not throw; failures are results.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * Execute the step.
     *
     * @param context step, rendered config and read-only view of the execution context
     * @return output to merge into the context, or a failure
     */
    StepResult handle(StepContext context);
}
