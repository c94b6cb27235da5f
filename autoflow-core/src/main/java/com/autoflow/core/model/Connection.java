package com.autoflow.core.model;

/**
 * Directed edge between two nodes of a workflow graph.
 * An absent guard always passes.
 */
public record Connection(
    String id,
    String fromId,
    String toId,
    Condition guard
) {
    public boolean isGuarded() {
        return guard != null;
    }

    public static Connection of(String id, String fromId, String toId) {
        return new Connection(id, fromId, toId, null);
    }

    public static Connection guarded(String id, String fromId, String toId, Condition guard) {
        return new Connection(id, fromId, toId, guard);
    }
}
