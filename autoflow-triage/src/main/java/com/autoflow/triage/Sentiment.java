package com.autoflow.triage;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
