package com.autoflow.triage;

import java.util.List;

/**
 * Output of the classifier for one event.
 */
public record Classification(
    TriageCategory category,
    int urgencyScore,
    int complexityScore,
    Sentiment sentiment,
    List<String> matchedKeywords
) {
    public Classification {
        matchedKeywords = List.copyOf(matchedKeywords);
    }
}
