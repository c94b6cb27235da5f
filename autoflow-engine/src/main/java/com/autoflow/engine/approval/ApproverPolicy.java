package com.autoflow.engine.approval;

import com.autoflow.core.model.Action;

/**
 * Decides who must approve an action.
 */
@FunctionalInterface
public interface ApproverPolicy {

    String approverFor(Action action, String requesterId);
}
