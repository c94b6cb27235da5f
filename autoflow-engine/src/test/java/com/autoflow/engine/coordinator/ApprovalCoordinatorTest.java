package com.autoflow.engine.coordinator;

import com.autoflow.core.exception.WorkflowValidationException;
import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.engine.coordinator.ApprovalCoordinator.ApprovalCallback;
import com.autoflow.engine.coordinator.ApprovalCoordinator.DecisionOutcome;
import com.autoflow.engine.test.EngineFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalCoordinatorTest {

    private final EngineFixture fixture = new EngineFixture();

    @ParameterizedTest
    @ValueSource(strings = {"approve", "APPROVED", " Approve "})
    void decide_acceptsApproveSpellings(String decision) {
        ApprovalRequest pending = pendingRequest();

        DecisionOutcome outcome = fixture.approvals.decide(
            new ApprovalCallback(pending.id(), EngineFixture.APPROVER, decision, null));

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.executionId()).isNull();
        assertThat(fixture.approvalManager.find(pending.id()))
            .hasValueSatisfying(r -> assertThat(r.status()).isEqualTo(ApprovalStatus.APPROVED));
    }

    @Test
    void decide_reject() {
        ApprovalRequest pending = pendingRequest();

        DecisionOutcome outcome = fixture.approvals.decide(
            new ApprovalCallback(pending.id(), EngineFixture.APPROVER, "rejected", "not now"));

        assertThat(outcome.applied()).isTrue();
        assertThat(fixture.approvalManager.find(pending.id()))
            .hasValueSatisfying(r -> {
                assertThat(r.status()).isEqualTo(ApprovalStatus.REJECTED);
                assertThat(r.responseReason()).isEqualTo("not now");
            });
    }

    @Test
    void decide_unknownDecisionWord() {
        ApprovalRequest pending = pendingRequest();

        assertThatThrownBy(() -> fixture.approvals.decide(
            new ApprovalCallback(pending.id(), EngineFixture.APPROVER, "maybe", null)))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("maybe");
        assertThatThrownBy(() -> fixture.approvals.decide(
            new ApprovalCallback(pending.id(), EngineFixture.APPROVER, null, null)))
            .isInstanceOf(WorkflowValidationException.class);
        assertThat(fixture.approvalManager.find(pending.id()))
            .hasValueSatisfying(r -> assertThat(r.isPending()).isTrue());
    }

    @Test
    void decide_notAppliedForWrongApproverOrSecondDecision() {
        ApprovalRequest pending = pendingRequest();

        assertThat(fixture.approvals.decide(new ApprovalCallback(pending.id(), "U-STRANGER", "approve", null)).applied())
            .isFalse();
        assertThat(fixture.approvals.decide(new ApprovalCallback(pending.id(), EngineFixture.APPROVER, "approve", null)).applied())
            .isTrue();
        assertThat(fixture.approvals.decide(new ApprovalCallback(pending.id(), EngineFixture.APPROVER, "reject", null)).applied())
            .isFalse();
    }

    @Test
    void decide_unknownApprovalIsNotApplied() {
        DecisionOutcome outcome = fixture.approvals.decide(
            new ApprovalCallback(UUID.randomUUID(), EngineFixture.APPROVER, "approve", null));

        assertThat(outcome.applied()).isFalse();
    }

    private ApprovalRequest pendingRequest() {
        Action action = Action.builder(ActionKind.DECISION, "review_decision")
            .priority(ActionPriority.MEDIUM)
            .requiresApproval(true)
            .build();
        fixture.actionRepository.save(action);
        return fixture.approvalManager.requestApproval(action, "U42");
    }
}
