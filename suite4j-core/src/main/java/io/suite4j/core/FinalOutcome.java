package io.suite4j.core;

public enum FinalOutcome {
    COMPLETED,
    RETIRED
}
