package com.trackly.backend.controller;

import com.trackly.backend.model.HealthResponse;
import com.trackly.backend.model.HealthStats;
import com.trackly.backend.service.HealthStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Learning statistics and freshness")
public class StatsController {

    private final HealthStatsService healthStatsService;

    @Operation(summary = "Learning Stats", description = "Pattern count, fetch counters and freshness as recorded by the last learning cycle.")
    @GetMapping("/api/stats")
    public HealthStats stats() {
        return healthStatsService.report();
    }

    @Operation(summary = "Health Check", description = "Reports 'healthy' when a learning cycle succeeded within the staleness window, otherwise 'stale'.")
    @GetMapping("/health")
    public HealthResponse health() {
        return healthStatsService.health();
    }
}
