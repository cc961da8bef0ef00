package com.trackly.backend.repository;

import com.trackly.backend.model.HealthStats;
import com.trackly.backend.model.RecentArrival;
import com.trackly.backend.model.TrainPattern;
import com.trackly.backend.util.TimeBucket;

/**
 * Write side of the learned-data store. Only the learning loop holds one.
 */
public interface LearnedDataWriter extends LearnedDataReader {

    boolean savePattern(String destination, TimeBucket bucket, String trainNum, TrainPattern pattern);

    /**
     * Replaces the arrival held for the destination.
     */
    boolean saveRecentArrival(String destination, RecentArrival arrival);

    boolean saveStats(HealthStats stats);

    long countPatterns();
}
