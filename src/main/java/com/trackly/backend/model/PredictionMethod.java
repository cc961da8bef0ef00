package com.trackly.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PredictionMethod {
    INBOUND_MATCH("inbound_match"),
    HISTORICAL_PATTERN("historical_pattern"),
    BRANCH_PATTERN("branch_pattern"),
    REALTIME("realtime");

    private final String wireName;

    PredictionMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
