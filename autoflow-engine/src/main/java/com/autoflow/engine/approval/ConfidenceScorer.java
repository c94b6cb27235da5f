package com.autoflow.engine.approval;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;

/**
 * Deterministic estimate of how safe an action is to auto-approve.
 * Base 0.7, adjusted by kind and priority, clamped to [0, 1].
 */
public final class ConfidenceScorer {

    static final double BASE_SCORE = 0.7;

    private ConfidenceScorer() {
    }

    public static double score(Action action) {
        return score(action.kind(), action.priority());
    }

    public static double score(ActionKind kind, ActionPriority priority) {
        double score = BASE_SCORE + kindAdjustment(kind) + priorityAdjustment(priority);
        // Two decimals, so 0.7 + 0.1 meets a 0.8 threshold
        double rounded = Math.round(score * 100.0) / 100.0;
        return Math.min(Math.max(rounded, 0.0), 1.0);
    }

    /**
     * Human-readable reason attached to every approval request.
     */
    public static String reasoning(ActionKind kind) {
        return switch (kind) {
            case SCHEDULING -> "Scheduling actions are generally safe to auto-approve.";
            case FOLLOW_UP -> "Follow-up actions help maintain communication.";
            case ESCALATION -> "Escalation requires immediate attention.";
            case DECISION -> "Decision-making actions require careful consideration.";
            case TRIAGE, RESEARCH -> "Autonomous action requires approval.";
        };
    }

    private static double kindAdjustment(ActionKind kind) {
        return switch (kind) {
            case SCHEDULING -> 0.15;
            case TRIAGE -> 0.10;
            case FOLLOW_UP -> 0.05;
            case ESCALATION, DECISION, RESEARCH -> 0.0;
        };
    }

    private static double priorityAdjustment(ActionPriority priority) {
        return switch (priority) {
            case CRITICAL -> -0.10;
            case LOW -> 0.10;
            case MEDIUM, HIGH -> 0.0;
        };
    }
}
