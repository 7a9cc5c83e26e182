package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The relevance dimensions combined by the context scorer.
 */
public enum DimensionType {
    USER_ROLE("userRole"),
    WORKFLOW_PHASE("workflowPhase"),
    SYSTEM_STATUS("systemStatus"),
    TIME_CONTEXT("timeContext"),
    HISTORICAL_PATTERNS("historicalPatterns");

    private final String code;

    DimensionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
