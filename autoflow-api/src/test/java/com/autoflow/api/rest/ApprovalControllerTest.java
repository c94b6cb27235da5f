package com.autoflow.api.rest;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.core.model.TriggerSource;
import com.autoflow.engine.coordinator.ApprovalCoordinator.ApprovalCallback;
import com.autoflow.engine.coordinator.IntakeCoordinator.IntakeResult;
import com.autoflow.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApprovalControllerTest {

    private ApiFixture api;
    private IntakeResult escalation;

    @BeforeEach
    void setUp() {
        api = new ApiFixture();
        api.engine.definitions.registerTemplates();
        escalation = api.engine.intake.submit(
            TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));
    }

    @Test
    void pendingListsRequestsAssignedToTheApprover() throws Exception {
        api.mockMvc.perform(get("/api/v1/approvals/pending").param("approver_id", EngineFixture.APPROVER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].id").value(escalation.approval().id().toString()))
            .andExpect(jsonPath("$[0].action_kind").value("ESCALATION"))
            .andExpect(jsonPath("$[0].requester_id").value("U42"))
            .andExpect(jsonPath("$[0].status").value("PENDING"));

        api.mockMvc.perform(get("/api/v1/approvals/pending").param("approver_id", "someone-else"))
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void pendingRequiresApproverId() throws Exception {
        api.mockMvc.perform(get("/api/v1/approvals/pending"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Approving through the callback runs the parked escalation workflow once")
    void approveCallbackResumesExecution() throws Exception {
        api.mockMvc.perform(post("/api/v1/approvals/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content(callback(escalation.approval().id(), EngineFixture.APPROVER, "Approved")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.applied").value(true))
            .andExpect(jsonPath("$.status").value("APPROVED"))
            .andExpect(jsonPath("$.execution_id").value(escalation.execution().executionId().toString()));

        assertThat(api.engine.coordinator.getExecution(escalation.execution().executionId()).status())
            .isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(api.engine.connectors.tasks).hasSize(1);

        api.mockMvc.perform(post("/api/v1/approvals/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content(callback(escalation.approval().id(), EngineFixture.APPROVER, "reject")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.applied").value(false))
            .andExpect(jsonPath("$.status").value("APPROVED"));
        assertThat(api.engine.connectors.tasks).hasSize(1);
    }

    @Test
    void rejectCallbackCancelsExecution() throws Exception {
        api.mockMvc.perform(post("/api/v1/approvals/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content(callback(escalation.approval().id(), EngineFixture.APPROVER, "reject")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.applied").value(true))
            .andExpect(jsonPath("$.status").value("REJECTED"));

        assertThat(api.engine.coordinator.getExecution(escalation.execution().executionId()).status())
            .isEqualTo(ExecutionStatus.CANCELLED);
    }

    @Test
    void callbackFromWrongApproverIsNotApplied() throws Exception {
        api.mockMvc.perform(post("/api/v1/approvals/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content(callback(escalation.approval().id(), "U-INTRUDER", "approve")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.applied").value(false))
            .andExpect(jsonPath("$.status").value("PENDING"));

        assertThat(api.engine.coordinator.getExecution(escalation.execution().executionId()).status())
            .isEqualTo(ExecutionStatus.PENDING_APPROVAL);
    }

    @Test
    void callbackWithUnknownDecisionIsBadRequest() throws Exception {
        api.mockMvc.perform(post("/api/v1/approvals/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content(callback(escalation.approval().id(), EngineFixture.APPROVER, "maybe")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void callbackWithoutApprovalIdIsBadRequest() throws Exception {
        api.mockMvc.perform(post("/api/v1/approvals/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"approver_id\":\"U-LEAD\",\"decision\":\"approve\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void historyShowsRequestsOfTheRequester() throws Exception {
        api.engine.approvals.decide(new ApprovalCallback(
            escalation.approval().id(), EngineFixture.APPROVER, "approve", "ok"));

        api.mockMvc.perform(get("/api/v1/approvals/history").param("user_id", "U42"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].status").value("APPROVED"))
            .andExpect(jsonPath("$[0].response_reason").value("ok"));
    }

    private String callback(UUID approvalId, String approverId, String decision) throws Exception {
        return api.json(new ApprovalController.CallbackRequest(approvalId, approverId, decision, null));
    }
}
