package com.autoflow.triage;

import com.autoflow.core.model.ActionPriority;
import java.time.Duration;
import java.util.List;

/**
 * Keyword rule for one category.
 *
 * @param category          category assigned when a keyword matches
 * @param keywords          lower-case substrings searched in the content
 * @param priority          priority the rule stands for
 * @param autoApproval      whether actions from this rule may run without a human
 * @param bonusPerHit       score added per hit on top of the base +1
 * @param escalationWindow  how long before an unhandled event should escalate
 * @param nextSteps         suggested follow-on handling
 */
public record TriageRule(
    TriageCategory category,
    List<String> keywords,
    ActionPriority priority,
    boolean autoApproval,
    int bonusPerHit,
    Duration escalationWindow,
    List<String> nextSteps
) {
    public TriageRule {
        keywords = List.copyOf(keywords);
        nextSteps = List.copyOf(nextSteps);
    }

    /**
     * Built-in rule table, highest tier first.
     */
    public static List<TriageRule> defaults() {
        return List.of(
            new TriageRule(TriageCategory.URGENT,
                List.of("urgent", "asap", "emergency", "critical"),
                ActionPriority.CRITICAL, false, 3, Duration.ofMinutes(5),
                List.of("immediate_notification", "escalation_to_manager", "priority_handling")),
            new TriageRule(TriageCategory.HIGH_PRIORITY,
                List.of("important", "priority", "deadline"),
                ActionPriority.HIGH, false, 2, Duration.ofMinutes(30),
                List.of("quick_response", "dedicated_handling")),
            new TriageRule(TriageCategory.ROUTINE,
                List.of("follow up", "update", "check"),
                ActionPriority.MEDIUM, true, 0, Duration.ofMinutes(120),
                List.of("standard_processing", "queue_for_handling")),
            new TriageRule(TriageCategory.LOW_PRIORITY,
                List.of("general", "info", "question"),
                ActionPriority.LOW, true, 0, Duration.ofMinutes(480),
                List.of("general_processing"))
        );
    }
}
