package com.autoflow.engine.coordinator;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ActionStatus;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.core.model.TriggerSource;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.engine.coordinator.ApprovalCoordinator.ApprovalCallback;
import com.autoflow.engine.coordinator.IntakeCoordinator.IntakeResult;
import com.autoflow.engine.definition.WorkflowTemplates;
import com.autoflow.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntakeCoordinatorTest {

    private final EngineFixture fixture = new EngineFixture();

    @BeforeEach
    void registerTemplates() {
        fixture.definitions.registerTemplates();
    }

    @Test
    @DisplayName("An urgent message compiles to a critical escalation that skips the compiler's approval rule")
    void urgentMessageEscalates() {
        IntakeResult result = fixture.intake.submit(TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));

        assertThat(result.category()).isEqualTo("urgent");
        assertThat(result.action().kind()).isEqualTo(ActionKind.ESCALATION);
        assertThat(result.action().priority()).isEqualTo(ActionPriority.CRITICAL);
        assertThat(result.action().requiresApproval()).isFalse();
        assertThat(result.action().payload().path("escalate_to").asText()).isEqualTo("U-ONCALL");
        assertThat(result.execution().workflowId()).isEqualTo(WorkflowTemplates.ESCALATION_RESPONSE);

        // Critical priority drags confidence to 0.6, below the threshold
        assertThat(result.approval().confidenceScore()).isEqualTo(0.6);
        assertThat(result.approval().status()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(result.execution().status()).isEqualTo(ExecutionStatus.PENDING_APPROVAL);
        assertThat(result.execution().approvalId()).isEqualTo(result.approval().id());
    }

    @Test
    void approvedEscalation_runsItsWorkflowFromTheTrigger() {
        IntakeResult result = fixture.intake.submit(TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));

        fixture.approvals.decide(new ApprovalCallback(result.approval().id(), EngineFixture.APPROVER, "approve", null));

        WorkflowExecution execution = fixture.coordinator.getExecution(result.execution().executionId());
        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.connectors.notifications)
            .filteredOn(n -> n.target().equals("U-ONCALL"))
            .singleElement()
            .satisfies(n -> assertThat(n.message())
                .isEqualTo("Escalation: URGENT: server down (priority CRITICAL): URGENT: server down"));
        assertThat(fixture.connectors.tasks).singleElement()
            .satisfies(task -> {
                assertThat(task.project()).isEqualTo("Escalations");
                assertThat(task.assignee()).isEqualTo("U-ONCALL");
            });
    }

    @Test
    void autoApprovedAction_startsExecutionImmediately() {
        IntakeResult result = fixture.intake.submit(
            TriggerEvent.of("Need a detailed research analysis of churn", TriggerSource.EMAIL, "U42"));

        assertThat(result.action().kind()).isEqualTo(ActionKind.RESEARCH);
        assertThat(result.approval().status()).isEqualTo(ApprovalStatus.AUTO_APPROVED);
        assertThat(fixture.actionRepository.findById(result.action().id()))
            .hasValueSatisfying(action -> assertThat(action.status()).isEqualTo(ActionStatus.APPROVED));

        WorkflowExecution execution = fixture.coordinator.getExecution(result.execution().executionId());
        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.actionId()).isEqualTo(result.action().id());
        assertThat(fixture.connectors.tasks).singleElement()
            .satisfies(task -> assertThat(task.name())
                .isEqualTo("Research: Need a detailed research analysis of churn"));
        assertThat(fixture.connectors.notifications).singleElement()
            .satisfies(n -> assertThat(n.message())
                .isEqualTo("Research task task-1 opened for Need a detailed research analysis of churn"));
    }

    @Test
    @DisplayName("A medium-priority scheduling request is auto-approved and books the meeting")
    void schedulingRequest_isAutoApprovedAndStarted() {
        IntakeResult result = fixture.intake.submit(
            TriggerEvent.of("Can we schedule a meeting next week", TriggerSource.CHAT, "U42"));

        assertThat(result.action().kind()).isEqualTo(ActionKind.SCHEDULING);
        assertThat(result.action().priority()).isEqualTo(ActionPriority.MEDIUM);
        assertThat(result.approval().confidenceScore()).isEqualTo(0.85);
        assertThat(result.approval().status()).isEqualTo(ApprovalStatus.AUTO_APPROVED);
        assertThat(result.execution().workflowId()).isEqualTo(WorkflowTemplates.MEETING_SCHEDULING);
        assertThat(fixture.coordinator.getExecution(result.execution().executionId()).status())
            .isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.connectors.events).hasSize(1);
        assertThat(fixture.approvalManager.pendingFor(EngineFixture.APPROVER)).isEmpty();
    }

    @Test
    void executionCarriesActionRetryBudgetAndTimeout() {
        IntakeResult research = fixture.intake.submit(
            TriggerEvent.of("Need a detailed research analysis of churn", TriggerSource.EMAIL, "U42"));
        IntakeResult escalation = fixture.intake.submit(
            TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));

        assertThat(research.execution().maxRetries()).isEqualTo(2);
        assertThat(research.execution().runningTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(escalation.execution().maxRetries()).isEqualTo(escalation.action().maxRetries());
        assertThat(escalation.execution().runningTimeout()).isEqualTo(escalation.action().timeout());
    }

    @Test
    @DisplayName("An approver answering the moment the request is published still releases the execution")
    void instantApproval_runsParkedExecution() {
        EngineFixture instant = new EngineFixture(f -> request ->
            f.approvals.decide(new ApprovalCallback(request.id(), EngineFixture.APPROVER, "approve", null)));
        instant.definitions.registerTemplates();

        IntakeResult result = instant.intake.submit(TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));

        assertThat(result.approval().status()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(instant.approvalManager.find(result.approval().id()))
            .hasValueSatisfying(a -> assertThat(a.status()).isEqualTo(ApprovalStatus.APPROVED));
        WorkflowExecution execution = instant.coordinator.getExecution(result.execution().executionId());
        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(instant.connectors.tasks).hasSize(1);
    }

    @Test
    void pendingApproval_isPublishedOnceExecutionIsParked() {
        IntakeResult result = fixture.intake.submit(TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));

        assertThat(fixture.connectors.notifications)
            .filteredOn(n -> n.target().equals(EngineFixture.APPROVER))
            .singleElement()
            .satisfies(n -> assertThat(n.message()).contains(result.approval().id().toString()));
        assertThat(fixture.executionRepository.findByApprovalId(result.approval().id())).isPresent();
    }

    @Test
    void routedPayload_carriesActionAndOrigin() {
        IntakeResult result = fixture.intake.submit(
            TriggerEvent.of("Can we schedule a meeting next week", TriggerSource.CHAT, "U42"));

        var payload = result.execution().triggerPayload();
        assertThat(payload.path("action_id").asText()).isEqualTo(result.action().id().toString());
        assertThat(payload.path("action_kind").asText()).isEqualTo("SCHEDULING");
        assertThat(payload.path("operation").asText()).isEqualTo("schedule_meeting");
        assertThat(payload.path("source").asText()).isEqualTo("chat");
        assertThat(payload.path("user_id").asText()).isEqualTo("U42");
        assertThat(payload.path("start").isTextual()).isTrue();
    }

    @Test
    void rejectedAction_cancelsParkedExecution() {
        IntakeResult result = fixture.intake.submit(TriggerEvent.of("URGENT: server down", TriggerSource.CHAT, "U42"));

        fixture.approvals.decide(new ApprovalCallback(result.approval().id(), EngineFixture.APPROVER, "reject", "busy"));

        WorkflowExecution execution = fixture.coordinator.getExecution(result.execution().executionId());
        assertThat(execution.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(fixture.connectors.tasks).isEmpty();
    }

    @Test
    void invalidEvent_reportsEveryProblem() {
        assertThatThrownBy(() -> fixture.intake.submit(new TriggerEvent(null, null, " ", null)))
            .isInstanceOf(WorkflowValidationException.class)
            .satisfies(e -> assertThat(((WorkflowValidationException) e).getViolations())
                .containsExactly("content is required", "source is required", "user_id cannot be blank"));
    }
}
