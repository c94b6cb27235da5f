package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageCategory;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;

/**
 * Escalates urgent events to a responsible person.
 * Escalations run without approval: waiting on a human defeats their purpose.
 */
public class EscalationCompiler implements ActionCompiler {

    public static final String OPERATION = "escalate";

    private final String escalateTo;
    private final Clock clock;

    public EscalationCompiler(String escalateTo, Clock clock) {
        this.escalateTo = escalateTo;
        this.clock = clock;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.ESCALATION;
    }

    @Override
    public Action compile(TriageResult triage, TriggerEvent event) {
        ActionPriority priority = triage.category() == TriageCategory.URGENT
            ? ActionPriority.CRITICAL
            : ActionPriority.HIGH;

        ObjectNode payload = Payloads.base(triage, event);
        payload.put("title", "Escalation: " + Payloads.summary(event.content(), 80));
        payload.put("escalate_to", escalateTo);
        payload.put("escalation_window_minutes", triage.escalationWindow().toMinutes());
        payload.set("next_steps", Payloads.array(triage.nextSteps()));

        return Action.builder(ActionKind.ESCALATION, OPERATION)
            .priority(priority)
            .payload(payload)
            .requiresApproval(false)
            .timeout(Duration.ofMinutes(5))
            .createdAt(clock.instant())
            .build();
    }
}
