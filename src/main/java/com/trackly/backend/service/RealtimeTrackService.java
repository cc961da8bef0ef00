package com.trackly.backend.service;

import com.trackly.backend.client.FeedFetcher;
import com.trackly.backend.exception.BadRequestException;
import com.trackly.backend.exception.FeedUnavailableException;
import com.trackly.backend.model.FetchResult;
import com.trackly.backend.model.Prediction;
import com.trackly.backend.model.PredictionMethod;
import com.trackly.backend.model.PredictionResponse;
import com.trackly.backend.model.TerminalCatalog;
import com.trackly.backend.model.TrainTimeDeparture;
import com.trackly.backend.parser.TrainTimeFeedParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Degraded fallback mode: reads the live TrainTime board on every request and
 * passes posted tracks straight through, without any learning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RealtimeTrackService {

    static final int POSTED_CONFIDENCE = 95;
    static final int NOT_POSTED_CONFIDENCE = 50;

    private final FeedFetcher feedFetcher;
    private final TrainTimeFeedParser trainTimeFeedParser;
    private final TerminalCatalog catalog;
    private final Clock clock;

    @Value("${realtime.url}")
    private String realtimeUrl;

    public PredictionResponse predict(String destination, String trainNum) {
        if (destination == null || destination.isBlank()) {
            throw new BadRequestException("Missing destination parameter");
        }
        String train = trainNum == null || trainNum.isBlank() ? null : trainNum.trim();

        FetchResult fetch = feedFetcher.fetch(realtimeUrl);
        if (!fetch.isSuccess()) {
            throw new FeedUnavailableException("Failed to fetch track data: " + fetch.getError());
        }
        List<TrainTimeDeparture> board;
        try {
            board = trainTimeFeedParser.decode(fetch.getPayload());
        } catch (IOException e) {
            throw new FeedUnavailableException("Failed to decode track data", e);
        }

        String query = destination.trim().toLowerCase(Locale.ROOT);
        List<Prediction> predictions = board.stream()
                .filter(row -> matches(row, query, train))
                .map(this::toPrediction)
                .collect(Collectors.toList());

        log.info("REALTIME: {} train {} → {} live row(s) out of {}", destination, train, predictions.size(),
                board.size());
        return PredictionResponse.builder()
                .destination(destination.trim())
                .trainNum(train)
                .predictions(predictions)
                .timestamp(clock.instant())
                .build();
    }

    private boolean matches(TrainTimeDeparture row, String query, String trainNum) {
        if (row.getDestination() != null && row.getDestination().trim().toLowerCase(Locale.ROOT).contains(query)) {
            return true;
        }
        return trainNum != null && row.getTrainNumber() != null && trainNum.equals(row.getTrainNumber().trim());
    }

    private Prediction toPrediction(TrainTimeDeparture row) {
        Optional<String> track = catalog.normalizeTrack(row.getTrack());
        String train = row.getTrainNumber() == null ? "?" : row.getTrainNumber().trim();
        return Prediction.builder()
                .method(PredictionMethod.REALTIME)
                .track(track.orElse(null))
                .confidence(track.isPresent() ? POSTED_CONFIDENCE : NOT_POSTED_CONFIDENCE)
                .reason(track.isPresent()
                        ? String.format("Live track assignment for train %s from the TrainTime board", train)
                        : String.format("Track not yet posted for train %s (TBD)", train))
                .build();
    }
}
