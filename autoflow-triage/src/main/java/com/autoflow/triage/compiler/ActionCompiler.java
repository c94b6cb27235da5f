package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;

/**
 * Turns a triage result into one concrete action.
 * Implementations are pure: they name an operation and attach a payload,
 * and never call external systems.
 */
public interface ActionCompiler {

    /**
     * The kind of action this compiler produces.
     */
    ActionKind kind();

    /**
     * Compile an action.
     *
     * @param triage classification and routing for the event
     * @param event  the original event (content, source, user, metadata)
     * @return a new action in PENDING status
     */
    Action compile(TriageResult triage, TriggerEvent event);
}
