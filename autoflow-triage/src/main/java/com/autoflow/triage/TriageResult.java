package com.autoflow.triage;

import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import java.time.Duration;
import java.util.List;

/**
 * Classification plus the routing decision derived from it.
 *
 * @param classification    raw classifier output
 * @param candidatePriority priority implied by the urgency score
 * @param assignedHandler   compiler that should turn this into an action
 * @param rule              rule of the winning category
 */
public record TriageResult(
    Classification classification,
    ActionPriority candidatePriority,
    ActionKind assignedHandler,
    TriageRule rule
) {
    public TriageCategory category() {
        return classification.category();
    }

    public boolean requiresApproval() {
        return !rule.autoApproval();
    }

    public Duration escalationWindow() {
        return rule.escalationWindow();
    }

    public List<String> nextSteps() {
        return rule.nextSteps();
    }
}
