package com.trackly.backend.repository;

import com.trackly.backend.model.HealthStats;
import com.trackly.backend.model.RecentArrival;
import com.trackly.backend.model.TrainPattern;
import com.trackly.backend.util.TimeBucket;

import java.util.Optional;

/**
 * Read side of the learned-data store, handed to the query components.
 */
public interface LearnedDataReader {

    Optional<TrainPattern> findPattern(String destination, TimeBucket bucket, String trainNum);

    Optional<RecentArrival> findRecentArrival(String destination);

    Optional<HealthStats> findStats();
}
