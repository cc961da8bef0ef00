package com.trackly.backend.service;

import com.trackly.backend.model.HealthResponse;
import com.trackly.backend.model.HealthStats;
import com.trackly.backend.repository.LearnedDataReader;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Serves the stats the learning loop last persisted. Staleness is taken as
 * recorded, never recomputed here.
 */
@Service
public class HealthStatsService {

    private final LearnedDataReader learnedData;
    private final TrackLearningService learningService;
    private final Clock clock;
    private final Instant startedAt;

    public HealthStatsService(LearnedDataReader learnedData, TrackLearningService learningService, Clock clock) {
        this.learnedData = learnedData;
        this.learningService = learningService;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public HealthStats report() {
        return learnedData.findStats().orElseGet(HealthStats::empty);
    }

    public HealthResponse health() {
        HealthStats stats = report();
        return HealthResponse.builder()
                .status(stats.isHealthy() ? "healthy" : "stale")
                .stats(stats)
                .uptime(Duration.between(startedAt, clock.instant()).getSeconds())
                .learningState(learningService.getState())
                .build();
    }
}
