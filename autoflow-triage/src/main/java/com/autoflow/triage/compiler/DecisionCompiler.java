package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.Locale;

/**
 * Fallback compiler. Produces a low-confidence action that always needs a human.
 */
public class DecisionCompiler implements ActionCompiler {

    public static final String OPERATION = "review_decision";
    public static final double CONFIDENCE_THRESHOLD = 0.9;

    private final Clock clock;

    public DecisionCompiler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.DECISION;
    }

    @Override
    public Action compile(TriageResult triage, TriggerEvent event) {
        ObjectNode payload = Payloads.base(triage, event);
        payload.put("title", "Decision needed: " + Payloads.summary(event.content(), 80));
        payload.put("sentiment", triage.classification().sentiment().name().toLowerCase(Locale.ROOT));
        payload.set("next_steps", Payloads.array(triage.nextSteps()));

        return Action.builder(ActionKind.DECISION, OPERATION)
            .priority(triage.candidatePriority())
            .payload(payload)
            .requiresApproval(true)
            .approvalConfidenceThreshold(CONFIDENCE_THRESHOLD)
            .createdAt(clock.instant())
            .build();
    }
}
