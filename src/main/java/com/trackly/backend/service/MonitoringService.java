package com.trackly.backend.service;

import com.trackly.backend.model.LearningCycleSummary;

/**
 * Sink for learning-loop metrics. Implementations must not throw; a metric
 * that cannot be published is dropped.
 */
public interface MonitoringService {

    void recordCycle(LearningCycleSummary summary);
}
