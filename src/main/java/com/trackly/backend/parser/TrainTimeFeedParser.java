package com.trackly.backend.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackly.backend.model.ParseResult;
import com.trackly.backend.model.TerminalCatalog;
import com.trackly.backend.model.TrackAssignment;
import com.trackly.backend.model.TrainTimeDeparture;
import com.trackly.backend.model.TrainTimeResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reads the TrainTime JSON departure board. Every row is a departure from the
 * terminal and carries its track explicitly once posted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainTimeFeedParser implements FeedParser {

    public static final String FORMAT = "traintime";
    private static final String TRACK_NOT_POSTED = "TBD";

    private final TerminalCatalog catalog;
    private final ObjectMapper objectMapper;

    @Value("${learning.time-zone:America/New_York}")
    private String timeZone;

    @Override
    public String format() {
        return FORMAT;
    }

    /**
     * Decodes the board without validating tracks. Rows are returned as posted,
     * including {@code TBD} tracks.
     */
    public List<TrainTimeDeparture> decode(byte[] payload) throws IOException {
        TrainTimeResponse response = objectMapper.readValue(payload, TrainTimeResponse.class);
        if (response == null || response.getTrains() == null) {
            return Collections.emptyList();
        }
        return response.getTrains();
    }

    @Override
    public ParseResult parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return ParseResult.failed("empty payload");
        }
        List<TrainTimeDeparture> departures;
        try {
            departures = decode(payload);
        } catch (IOException e) {
            log.warn("⚠️ Malformed TrainTime payload: {}", e.getMessage());
            return ParseResult.failed("malformed TrainTime payload: " + e.getMessage());
        }

        List<TrackAssignment> assignments = new ArrayList<>();
        int discarded = 0;
        for (TrainTimeDeparture departure : departures) {
            TrackAssignment assignment = toAssignment(departure);
            if (assignment == null) {
                discarded++;
            } else {
                assignments.add(assignment);
            }
        }
        log.debug("TrainTime board: {} rows → {} assignments ({} discarded)",
                departures.size(), assignments.size(), discarded);
        return ParseResult.of(assignments, discarded);
    }

    private TrackAssignment toAssignment(TrainTimeDeparture departure) {
        if (departure == null || !catalog.isKnownDestination(departure.getDestination())) {
            return null;
        }
        String rawTrack = departure.getTrack();
        if (rawTrack == null || rawTrack.isBlank() || TRACK_NOT_POSTED.equalsIgnoreCase(rawTrack.trim())) {
            return null;
        }
        Optional<String> track = catalog.normalizeTrack(rawTrack);
        Optional<Instant> scheduled = parseTime(departure.getScheduledTime());
        if (track.isEmpty() || scheduled.isEmpty()) {
            return null;
        }
        String trainNum = departure.getTrainNumber() == null || departure.getTrainNumber().isBlank()
                ? null
                : departure.getTrainNumber().trim();
        return TrackAssignment.builder()
                .destination(catalog.canonicalDestination(departure.getDestination()))
                .track(track.get())
                .trainNum(trainNum)
                .departure(true)
                .timestamp(scheduled.get())
                .build();
    }

    private Optional<Instant> parseTime(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text.trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            // board times without an offset are terminal-local
            return Optional.of(((LocalDateTime) parsed).atZone(ZoneId.of(timeZone)).toInstant());
        } catch (DateTimeException e) {
            log.trace("Unparseable scheduled time: {}", text);
            return Optional.empty();
        }
    }
}
