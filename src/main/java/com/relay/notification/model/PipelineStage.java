package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineStage {
    RULE("rule"),
    CONTEXT("context"),
    PREDICTION("prediction"),
    BEHAVIOR("behavior"),
    RATE_LIMIT("rate-limit"),
    EXPLAIN("explain");

    private final String code;

    PipelineStage(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
