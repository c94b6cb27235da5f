package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a triage result to the compiler for its assigned handler.
 * Kinds without a compiler fall back to the decision compiler.
 */
public class ActionCompilerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionCompilerRegistry.class);

    private final Map<ActionKind, ActionCompiler> compilers = new EnumMap<>(ActionKind.class);
    private final ActionCompiler fallback;

    public ActionCompilerRegistry(List<ActionCompiler> compilers) {
        for (ActionCompiler compiler : compilers) {
            ActionCompiler previous = this.compilers.put(compiler.kind(), compiler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate compiler for kind " + compiler.kind());
            }
        }
        this.fallback = this.compilers.get(ActionKind.DECISION);
        if (fallback == null) {
            throw new IllegalArgumentException("A DECISION compiler is required as fallback");
        }
    }

    /**
     * Registry with every built-in compiler.
     */
    public static ActionCompilerRegistry defaults(String escalateTo, Clock clock) {
        return new ActionCompilerRegistry(List.of(
            new TriageCompiler(clock),
            new SchedulingCompiler(clock),
            new FollowUpCompiler(clock),
            new EscalationCompiler(escalateTo, clock),
            new ResearchCompiler(clock),
            new DecisionCompiler(clock)
        ));
    }

    public Action compile(TriageResult triage, TriggerEvent event) {
        ActionCompiler compiler = compilers.get(triage.assignedHandler());
        if (compiler == null) {
            log.debug("No compiler for {}, falling back to decision", triage.assignedHandler());
            compiler = fallback;
        }
        return compiler.compile(triage, event);
    }

    public boolean supports(ActionKind kind) {
        return compilers.containsKey(kind);
    }
}
