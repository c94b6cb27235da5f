package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;

/**
 * Acknowledges and routes low-priority events to a queue.
 */
public class TriageCompiler implements ActionCompiler {

    public static final String OPERATION = "triage_and_route";

    private final Clock clock;

    public TriageCompiler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.TRIAGE;
    }

    @Override
    public Action compile(TriageResult triage, TriggerEvent event) {
        ObjectNode payload = Payloads.base(triage, event);
        payload.put("title", Payloads.summary(event.content(), 80));
        payload.put("escalation_window_minutes", triage.escalationWindow().toMinutes());
        payload.set("next_steps", Payloads.array(triage.nextSteps()));

        return Action.builder(ActionKind.TRIAGE, OPERATION)
            .priority(triage.candidatePriority())
            .payload(payload)
            .requiresApproval(triage.requiresApproval())
            .createdAt(clock.instant())
            .build();
    }
}
