package com.autoflow.triage;

import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.TriggerEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword classifier for inbound events.
 * Pure and deterministic: no I/O, safe to re-run on the same event.
 *
 * Scoring: every keyword hit adds 1, plus the rule's per-hit bonus
 * (3 for urgent, 2 for high priority). The category is the highest tier
 * with at least one hit, or routine when nothing matches.
 */
public class EventClassifier {

    static final List<String> COMPLEXITY_INDICATORS =
        List.of("complex", "detailed", "analysis", "research", "investigation");
    static final List<String> POSITIVE_WORDS =
        List.of("good", "great", "excellent", "positive", "success");
    static final List<String> NEGATIVE_WORDS =
        List.of("bad", "terrible", "problem", "issue", "failure");
    static final List<String> SCHEDULING_HINTS =
        List.of("schedule", "meeting", "calendar");
    static final List<String> FOLLOW_UP_HINTS =
        List.of("follow up", "follow-up", "check");

    private static final int RESEARCH_COMPLEXITY_THRESHOLD = 2;

    private final List<TriageRule> rules;

    public EventClassifier() {
        this(TriageRule.defaults());
    }

    public EventClassifier(List<TriageRule> rules) {
        this.rules = List.copyOf(rules);
        if (this.rules.stream().noneMatch(r -> r.category() == TriageCategory.ROUTINE)) {
            throw new IllegalArgumentException("Rule table must contain a routine rule");
        }
    }

    /**
     * Classify an event and decide which compiler should handle it.
     */
    public TriageResult triage(TriggerEvent event) {
        Objects.requireNonNull(event, "event");
        Classification classification = classify(event.content());
        String text = normalize(event.content());
        return new TriageResult(
            classification,
            ActionPriority.fromUrgencyScore(classification.urgencyScore()),
            assignHandler(classification, text),
            ruleFor(classification.category())
        );
    }

    /**
     * Classify raw content.
     */
    public Classification classify(String content) {
        String text = normalize(content);

        int urgencyScore = 0;
        TriageCategory category = null;
        List<String> matched = new ArrayList<>();

        for (TriageRule rule : rules) {
            for (String keyword : rule.keywords()) {
                if (text.contains(keyword)) {
                    matched.add(keyword);
                    urgencyScore += 1 + rule.bonusPerHit();
                    if (rule.category().outranks(category)) {
                        category = rule.category();
                    }
                }
            }
        }

        return new Classification(
            category == null ? TriageCategory.ROUTINE : category,
            urgencyScore,
            countHits(text, COMPLEXITY_INDICATORS),
            sentimentOf(text),
            matched
        );
    }

    private ActionKind assignHandler(Classification classification, String text) {
        if (classification.category() == TriageCategory.URGENT) {
            return ActionKind.ESCALATION;
        }
        if (countHits(text, SCHEDULING_HINTS) > 0) {
            return ActionKind.SCHEDULING;
        }
        if (countHits(text, FOLLOW_UP_HINTS) > 0) {
            return ActionKind.FOLLOW_UP;
        }
        if (classification.complexityScore() > RESEARCH_COMPLEXITY_THRESHOLD) {
            return ActionKind.RESEARCH;
        }
        if (classification.category() == TriageCategory.LOW_PRIORITY) {
            return ActionKind.TRIAGE;
        }
        return ActionKind.DECISION;
    }

    private TriageRule ruleFor(TriageCategory category) {
        return rules.stream()
            .filter(r -> r.category() == category)
            .findFirst()
            .orElseThrow();
    }

    private static Sentiment sentimentOf(String text) {
        int positive = countHits(text, POSITIVE_WORDS);
        int negative = countHits(text, NEGATIVE_WORDS);
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    private static int countHits(String text, List<String> words) {
        int hits = 0;
        for (String word : words) {
            if (text.contains(word)) {
                hits++;
            }
        }
        return hits;
    }

    private static String normalize(String content) {
        return content == null ? "" : content.toLowerCase(Locale.ROOT);
    }
}
