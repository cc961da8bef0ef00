package com.trackly.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStats {
    private long totalPatterns;
    private Instant lastUpdateAt;
    private long successfulFetches;
    private long failedFetches;

    @JsonProperty("isHealthy")
    private boolean healthy;

    public static HealthStats empty() {
        return HealthStats.builder().build();
    }
}
