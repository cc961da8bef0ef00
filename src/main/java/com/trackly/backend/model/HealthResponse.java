package com.trackly.backend.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private String status; // "healthy" or "stale"

    @JsonUnwrapped
    private HealthStats stats;

    private long uptime; // seconds
    private LearningState learningState;
}
