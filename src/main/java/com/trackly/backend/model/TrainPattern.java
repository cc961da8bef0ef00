package com.trackly.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learned track frequencies for one destination, time bucket and train.
 * Counts only ever grow; the derived fields are recomputed after every
 * observation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainPattern {

    /** Confidence never reaches 100: a train can always be moved. */
    public static final int MAX_CONFIDENCE = 95;

    @Builder.Default
    private Map<String, Integer> trackCounts = new LinkedHashMap<>(); // insertion order breaks ties
    private String mostCommonTrack;
    private int confidence;
    private int totalObservations;
    @Builder.Default
    private List<String> alternativeTracks = new ArrayList<>();
    private Instant lastSeenAt;

    public void recordObservation(String track, Instant seenAt) {
        if (trackCounts == null) {
            trackCounts = new LinkedHashMap<>();
        }
        trackCounts.merge(track, 1, Integer::sum);
        totalObservations++;
        if (lastSeenAt == null || (seenAt != null && seenAt.isAfter(lastSeenAt))) {
            lastSeenAt = seenAt;
        }
        recompute();
    }

    private void recompute() {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : trackCounts.entrySet()) {
            // strictly greater, so the first-seen track wins a tie
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        mostCommonTrack = best;
        confidence = totalObservations == 0 ? 0
                : (int) Math.min(MAX_CONFIDENCE, Math.round(bestCount * 100.0 / totalObservations));

        String top = best;
        List<String> alternatives = new ArrayList<>();
        trackCounts.entrySet().stream()
                .filter(e -> !e.getKey().equals(top) && e.getValue() > 1)
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> alternatives.add(e.getKey()));
        alternativeTracks = alternatives;
    }
}
