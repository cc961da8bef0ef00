package com.trackly.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningCycleSummary {
    private Instant timestamp;
    private String status;
    private Integer fetchAttempts;
    private Integer observationsReceived;
    private Integer observationsDiscarded;
    private Integer patternsUpdated;
    private Integer arrivalsRecorded;
    private Long processingTimeMs;
    private String message;
}
