package com.autoflow.engine.definition;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.Condition;
import com.autoflow.core.model.ConditionOperator;
import com.autoflow.core.model.Connection;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.TriggerType;
import com.autoflow.core.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowDefinitionValidatorTest {

    private final WorkflowDefinitionValidator validator = new WorkflowDefinitionValidator();

    @Test
    void validDefinition_hasNoViolations() {
        WorkflowDefinition definition = base()
            .step(step("a"))
            .step(step("b"))
            .connect("start", "a")
            .connect("a", "b")
            .build();

        assertThat(validator.violations(definition)).isEmpty();
    }

    @Test
    void allViolationsAreReportedTogether() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .id("wf")
            .name(" ")
            .trigger("start", TriggerType.MANUAL)
            .step(step("a"))
            .step(step("a"))
            .step(step("start"))
            .connect("start", "a")
            .connect("a", "missing")
            .connect("a", "start")
            .build();

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(WorkflowValidationException.class)
            .satisfies(e -> assertThat(((WorkflowValidationException) e).getViolations()).containsExactlyInAnyOrder(
                "name cannot be empty",
                "duplicate step id a",
                "step id start collides with the trigger id",
                "connection conn-1 targets unknown node missing",
                "connection conn-2 targets the trigger",
                "unguarded cycle through start -> a -> start"));
    }

    @Test
    void unguardedCycle_isRejected() {
        WorkflowDefinition definition = base()
            .step(step("a"))
            .step(step("b"))
            .connect("start", "a")
            .connect("a", "b")
            .connect("b", "a")
            .build();

        assertThat(validator.violations(definition)).containsExactly("unguarded cycle through a -> b -> a");
    }

    @Test
    void cycleWithAGuard_isAllowed() {
        WorkflowDefinition definition = base()
            .step(step("a"))
            .step(step("b"))
            .connect("start", "a")
            .connect("a", "b")
            .connect("b", "a", Condition.of("retry", ConditionOperator.EQUALS, "yes"))
            .build();

        assertThat(validator.violations(definition)).isEmpty();
    }

    @Test
    void duplicateConnectionIdsAndUnknownSources_areReported() {
        WorkflowDefinition definition = base()
            .step(step("a"))
            .connection(Connection.of("c1", "start", "a"))
            .connection(Connection.of("c1", "ghost", "a"))
            .build();

        assertThat(validator.violations(definition)).containsExactlyInAnyOrder(
            "duplicate connection id c1",
            "connection c1 starts at unknown node ghost");
    }

    @Test
    void selfLoop_isAnUnguardedCycle() {
        assertThat(validator.findUnguardedCycle(List.of(Connection.of("c", "x", "x"))))
            .contains(List.of("x", "x"));
    }

    private static WorkflowDefinition.Builder base() {
        return WorkflowDefinition.builder().id("wf").name("wf").trigger("start", TriggerType.MANUAL);
    }

    private static Step step(String id) {
        return Step.builder(id, StepType.SET_VARIABLE).build();
    }
}
