package com.autoflow.core.model;

/**
 * The domain an action belongs to. Each kind has one compiler and one routed workflow.
 */
public enum ActionKind {
    TRIAGE,
    SCHEDULING,
    FOLLOW_UP,
    ESCALATION,
    DECISION,
    RESEARCH
}
