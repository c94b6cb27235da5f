package com.autoflow.engine.definition;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.ConditionOperator;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.TriggerType;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.test.TimeController;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowDefinitionParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TimeController time = TimeController.frozenAt(Instant.parse("2024-03-04T09:00:00Z"));
    private final WorkflowDefinitionParser parser = new WorkflowDefinitionParser(time);

    @Test
    void parsesEditorJson() throws Exception {
        JsonNode json = mapper.readTree("""
            {
              "id": "lead-intake",
              "name": "Lead intake",
              "trigger": {"type": "webhook"},
              "steps": [
                {"id": "task", "type": "create_task",
                 "config": {"name": "Call {{lead.name}}", "project": "sales"}},
                {"type": "send_notification", "continue_on_failure": true,
                 "conditions": [{"field": "lead.tier", "operator": "==", "value": "enterprise"}]}
              ],
              "connections": [
                {"from_id": "trigger", "to_id": "task"},
                {"id": "to-notify", "from_id": "task", "to_id": "step-2",
                 "condition": {"field": "task.task_id", "operator": "is_not_empty"}}
              ],
              "variables": {"region": "emea"}
            }
            """);

        WorkflowDefinition definition = parser.parse(json, "U1");

        assertThat(definition.id()).isEqualTo("lead-intake");
        assertThat(definition.trigger().id()).isEqualTo("trigger");
        assertThat(definition.trigger().type()).isEqualTo(TriggerType.WEBHOOK);
        assertThat(definition.steps()).extracting(s -> s.id()).containsExactly("task", "step-2");
        assertThat(definition.steps().get(1).type()).isEqualTo(StepType.SEND_NOTIFICATION);
        assertThat(definition.steps().get(1).continueOnFailure()).isTrue();
        assertThat(definition.steps().get(1).conditions().get(0).operator()).isEqualTo(ConditionOperator.EQUALS);
        assertThat(definition.connections()).extracting(c -> c.id()).containsExactly("conn-1", "to-notify");
        assertThat(definition.connections().get(1).isGuarded()).isTrue();
        assertThat(definition.variables().path("region").asText()).isEqualTo("emea");
        assertThat(definition.enabled()).isTrue();
        assertThat(definition.createdAt()).isEqualTo(time.now());
        assertThat(definition.createdBy()).isEqualTo("U1");
    }

    @Test
    void acceptsActionsAsStepAlias_andGeneratesId() throws Exception {
        JsonNode json = mapper.readTree("""
            {"name": "n", "trigger": {"type": "manual"},
             "actions": [{"type": "delay", "config": {"seconds": 1}}]}
            """);

        WorkflowDefinition definition = parser.parse(json, "U1");

        assertThat(definition.id()).isNotBlank();
        assertThat(definition.steps()).singleElement().satisfies(s -> assertThat(s.type()).isEqualTo(StepType.DELAY));
    }

    @Test
    void unknownOperatorIsKeptAsUnsupported() throws Exception {
        JsonNode json = mapper.readTree("""
            {"name": "n", "trigger": {"type": "manual"},
             "steps": [{"id": "a", "type": "delay"}],
             "connections": [{"from_id": "trigger", "to_id": "a",
                              "guard": {"field": "x", "operator": "matches", "value": "y"}}]}
            """);

        WorkflowDefinition definition = parser.parse(json, "U1");

        assertThat(definition.connections().get(0).guard().operator()).isEqualTo(ConditionOperator.UNSUPPORTED);
    }

    @Test
    void unknownTypesAndBrokenConnections_areCollected() throws Exception {
        JsonNode json = mapper.readTree("""
            {"name": "n", "trigger": {"type": "telepathy"},
             "steps": [{"id": "a", "type": "teleport"}],
             "connections": [{"from_id": "a"}]}
            """);

        assertThatThrownBy(() -> parser.parse(json, "U1"))
            .isInstanceOf(WorkflowValidationException.class)
            .satisfies(e -> assertThat(((WorkflowValidationException) e).getViolations()).containsExactly(
                "trigger has unknown type 'telepathy'",
                "step a has unknown type 'teleport'",
                "connection conn-1 needs from_id and to_id"));
    }

    @Test
    void nonObjectInput_isRejected() {
        assertThatThrownBy(() -> parser.parse(mapper.createArrayNode(), "U1"))
            .isInstanceOf(WorkflowValidationException.class);
    }
}
