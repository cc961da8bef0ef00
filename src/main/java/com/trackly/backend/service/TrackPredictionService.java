package com.trackly.backend.service;

import com.trackly.backend.exception.BadRequestException;
import com.trackly.backend.model.Prediction;
import com.trackly.backend.model.PredictionMethod;
import com.trackly.backend.model.PredictionResponse;
import com.trackly.backend.model.RecentArrival;
import com.trackly.backend.model.SeedPattern;
import com.trackly.backend.model.TerminalCatalog;
import com.trackly.backend.model.TrainPattern;
import com.trackly.backend.repository.LearnedDataReader;
import com.trackly.backend.util.TimeBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks track predictions for an outbound train from three independent
 * sources: a recent inbound arrival, the learned pattern for the train in the
 * current time slot, and the branch seed table. Read-only over learned data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackPredictionService {

    static final int INBOUND_CONFIDENCE = 85;

    private final LearnedDataReader learnedData;
    private final TerminalCatalog catalog;
    private final Clock clock;

    @Value("${learning.time-zone:America/New_York}")
    private String timeZone;

    @Value("${prediction.inbound-window-minutes:15}")
    private long inboundWindowMinutes;

    @Value("${prediction.min-observations:2}")
    private int minObservations;

    public PredictionResponse predict(String destination, String trainNum) {
        if (destination == null || destination.isBlank()) {
            throw new BadRequestException("Missing destination parameter");
        }
        String canonical = catalog.canonicalDestination(destination);
        String train = trainNum == null || trainNum.isBlank() ? null : trainNum.trim();
        Instant now = clock.instant();

        // insertion order breaks confidence ties (sort is stable)
        List<Prediction> predictions = new ArrayList<>();
        inboundMatch(canonical, now).ifPresent(predictions::add);
        historicalPattern(canonical, train, now).ifPresent(predictions::add);
        branchPattern(canonical).ifPresent(predictions::add);
        predictions.sort(Comparator.comparingInt(Prediction::getConfidence).reversed());

        log.debug("PREDICT: {} train {} → {} prediction(s)", canonical, train, predictions.size());
        return PredictionResponse.builder()
                .destination(canonical)
                .trainNum(train)
                .predictions(predictions)
                .timestamp(now)
                .build();
    }

    private Optional<Prediction> inboundMatch(String destination, Instant now) {
        Optional<RecentArrival> arrival = learnedData.findRecentArrival(destination);
        if (arrival.isEmpty() || arrival.get().getObservedAt() == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(arrival.get().getObservedAt(), now);
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        if (age.compareTo(Duration.ofMinutes(inboundWindowMinutes)) > 0) {
            return Optional.empty();
        }
        long minutes = age.toMinutes();
        return Optional.of(Prediction.builder()
                .method(PredictionMethod.INBOUND_MATCH)
                .track(arrival.get().getTrack())
                .confidence(INBOUND_CONFIDENCE)
                .reason(String.format("Inbound %s train arrived on track %s %d minute%s ago",
                        destination, arrival.get().getTrack(), minutes, minutes == 1 ? "" : "s"))
                .build());
    }

    private Optional<Prediction> historicalPattern(String destination, String trainNum, Instant now) {
        if (trainNum == null) {
            return Optional.empty();
        }
        TimeBucket bucket = TimeBucket.of(now, ZoneId.of(timeZone));
        return learnedData.findPattern(destination, bucket, trainNum)
                .filter(pattern -> pattern.getTotalObservations() >= minObservations)
                .filter(pattern -> pattern.getMostCommonTrack() != null)
                .map(pattern -> toHistoricalPrediction(pattern, trainNum));
    }

    private Prediction toHistoricalPrediction(TrainPattern pattern, String trainNum) {
        int topCount = pattern.getTrackCounts().getOrDefault(pattern.getMostCommonTrack(), 0);
        return Prediction.builder()
                .method(PredictionMethod.HISTORICAL_PATTERN)
                .track(pattern.getMostCommonTrack())
                .confidence(pattern.getConfidence())
                .reason(String.format("Train %s used track %s in %d of %d observations at this time",
                        trainNum, pattern.getMostCommonTrack(), topCount, pattern.getTotalObservations()))
                .alternatives(pattern.getAlternativeTracks() == null
                        ? List.of()
                        : List.copyOf(pattern.getAlternativeTracks()))
                .build();
    }

    private Optional<Prediction> branchPattern(String destination) {
        return catalog.findSeed(destination).map(seed -> toBranchPrediction(destination, seed));
    }

    private Prediction toBranchPrediction(String destination, SeedPattern seed) {
        return Prediction.builder()
                .method(PredictionMethod.BRANCH_PATTERN)
                .tracks(seed.getTracks())
                .confidence(seed.getConfidence())
                .reason(String.format("%s branch trains usually depart from tracks %s",
                        destination, String.join(", ", seed.getTracks())))
                .build();
    }
}
