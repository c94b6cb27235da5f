package com.autoflow.api.rest;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.engine.service.ExecutionService.StartExecutionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ExecutionControllerTest {

    private ApiFixture api;

    @BeforeEach
    void setUp() {
        api = new ApiFixture();
        api.registerGreeting("greeting");
    }

    @Test
    void startExecution_returnsCreatedExecution() throws Exception {
        MvcResult result = api.mockMvc.perform(post("/api/v1/executions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow_id\":\"greeting\",\"trigger_payload\":{\"name\":\"Ada\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.workflow_id").value("greeting"))
            .andExpect(jsonPath("$.workflow_version").value(1))
            .andExpect(jsonPath("$.trigger_payload.name").value("Ada"))
            .andReturn();

        UUID executionId = UUID.fromString(
            api.mapper.readTree(result.getResponse().getContentAsString()).path("execution_id").asText());
        assertThat(api.engine.coordinator.getExecution(executionId).status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(api.engine.connectors.notifications).extracting(n -> n.message()).containsExactly("Hello Ada");
    }

    @Test
    void startExecution_unknownWorkflowIsNotFound() throws Exception {
        api.mockMvc.perform(post("/api/v1/executions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow_id\":\"missing\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    void startExecution_nonObjectPayloadIsRejected() throws Exception {
        api.mockMvc.perform(post("/api/v1/executions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow_id\":\"greeting\",\"trigger_payload\":[1,2]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void getExecution_andSteps() throws Exception {
        WorkflowExecution execution = start("Grace");

        api.mockMvc.perform(get("/api/v1/executions/{id}", execution.executionId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.retry_count").value(0));

        api.mockMvc.perform(get("/api/v1/executions/{id}/steps", execution.executionId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].step_id").value("greet"))
            .andExpect(jsonPath("$[0].step_type").value("send_notification"))
            .andExpect(jsonPath("$[0].attempt").value(0));
    }

    @Test
    void getExecution_unknownIdIsNotFound() throws Exception {
        api.mockMvc.perform(get("/api/v1/executions/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
        api.mockMvc.perform(get("/api/v1/executions/{id}/steps", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    void getExecution_malformedIdIsBadRequest() throws Exception {
        api.mockMvc.perform(get("/api/v1/executions/not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value(ApiExceptionHandler.BAD_REQUEST));
    }

    @Test
    void queryExecutions_filtersByWorkflowAndStatus() throws Exception {
        api.registerGreeting("farewell");
        start("Ada");
        api.engine.coordinator.createExecution(
            StartExecutionRequest.of("greeting", payload("Bob")), ExecutionStatus.PENDING_APPROVAL, UUID.randomUUID());
        api.engine.coordinator.startExecution(StartExecutionRequest.of("farewell", payload("Cy")));

        api.mockMvc.perform(get("/api/v1/executions").param("workflow_id", "greeting"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)));

        api.mockMvc.perform(get("/api/v1/executions")
                .param("workflow_id", "greeting")
                .param("status", "PENDING_APPROVAL"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].trigger_payload.name").value("Bob"));

        api.mockMvc.perform(get("/api/v1/executions").param("status", "COMPLETED"))
            .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void cancel_parkedExecutionOnlyOnce() throws Exception {
        WorkflowExecution parked = api.engine.coordinator.createExecution(
            StartExecutionRequest.of("greeting", payload("Ada")), ExecutionStatus.PENDING_APPROVAL, UUID.randomUUID());

        api.mockMvc.perform(post("/api/v1/executions/{id}/cancel", parked.executionId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(true))
            .andExpect(jsonPath("$.execution.status").value("CANCELLED"));

        api.mockMvc.perform(post("/api/v1/executions/{id}/cancel", parked.executionId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void cancel_completedExecutionIsRefused() throws Exception {
        WorkflowExecution execution = start("Ada");

        api.mockMvc.perform(post("/api/v1/executions/{id}/cancel", execution.executionId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(false))
            .andExpect(jsonPath("$.execution.status").value("COMPLETED"));
    }

    private WorkflowExecution start(String name) {
        return api.engine.coordinator.startExecution(StartExecutionRequest.of("greeting", payload(name)));
    }

    private static JsonNode payload(String name) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("name", name);
        return payload;
    }
}
