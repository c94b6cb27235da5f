package com.autoflow.core.model;

/**
 * Priority of a compiled action, lowest first.
 */
public enum ActionPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Map a classifier urgency score onto a priority.
     */
    public static ActionPriority fromUrgencyScore(int urgencyScore) {
        if (urgencyScore >= 5) {
            return CRITICAL;
        }
        if (urgencyScore >= 3) {
            return HIGH;
        }
        if (urgencyScore >= 1) {
            return MEDIUM;
        }
        return LOW;
    }
}
