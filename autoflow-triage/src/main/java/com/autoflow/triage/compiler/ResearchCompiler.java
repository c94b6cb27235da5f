package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;

/**
 * Opens a research request for complex events.
 */
public class ResearchCompiler implements ActionCompiler {

    public static final String OPERATION = "research";

    private final Clock clock;

    public ResearchCompiler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.RESEARCH;
    }

    @Override
    public Action compile(TriageResult triage, TriggerEvent event) {
        ObjectNode payload = Payloads.base(triage, event);
        payload.put("topic", Payloads.summary(event.content(), 120));
        payload.put("complexity_score", triage.classification().complexityScore());

        return Action.builder(ActionKind.RESEARCH, OPERATION)
            .priority(triage.candidatePriority())
            .payload(payload)
            .requiresApproval(false)
            .maxRetries(2)
            .timeout(Duration.ofMinutes(30))
            .createdAt(clock.instant())
            .build();
    }
}
