package com.autoflow.worker.handler;

import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Records a named value. Later steps read it as {@code <stepId>.<variable>}.
 */
public class SetVariableHandler implements StepHandler {

    @Override
    public StepResult handle(StepContext context) {
        Optional<String> variable = context.text("variable");
        if (variable.isEmpty()) {
            return StepResult.invalidConfig("set_variable requires 'variable'");
        }
        JsonNode value = context.getConfig().path("value");
        if (value.isMissingNode()) {
            value = context.getObjectMapper().nullNode();
        }

        ObjectNode output = context.newOutput();
        output.put("variable", variable.get());
        output.set("value", value.deepCopy());
        output.set(variable.get(), value.deepCopy());
        return StepResult.ok(output);
    }
}
