package com.autoflow.engine.approval;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Approver lookup from a fixed kind-to-approver table with a default.
 */
public class StaticApproverPolicy implements ApproverPolicy {

    private final Map<ActionKind, String> approvers;
    private final String defaultApprover;

    public StaticApproverPolicy(Map<ActionKind, String> approvers, String defaultApprover) {
        if (defaultApprover == null || defaultApprover.isBlank()) {
            throw new IllegalArgumentException("defaultApprover cannot be blank");
        }
        this.approvers = approvers.isEmpty() ? new EnumMap<>(ActionKind.class) : new EnumMap<>(approvers);
        this.defaultApprover = defaultApprover;
    }

    public static StaticApproverPolicy withDefault(String defaultApprover) {
        return new StaticApproverPolicy(Map.of(), defaultApprover);
    }

    @Override
    public String approverFor(Action action, String requesterId) {
        return approvers.getOrDefault(action.kind(), defaultApprover);
    }
}
