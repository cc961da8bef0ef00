package com.trackly.backend.parser;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime;
import com.trackly.backend.model.ParseResult;
import com.trackly.backend.model.TerminalCatalog;
import com.trackly.backend.model.TrackAssignment;
import com.trackly.backend.util.TrackCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads track assignments from a GTFS-realtime trip updates feed. The track
 * is carried in the stop id of each stop time update (e.g. {@code NYK_13}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GtfsRealtimeFeedParser implements FeedParser {

    public static final String FORMAT = "gtfs-rt";

    private final TerminalCatalog catalog;

    @Override
    public String format() {
        return FORMAT;
    }

    @Override
    public ParseResult parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return ParseResult.failed("empty payload");
        }

        GtfsRealtime.FeedMessage feed;
        try {
            feed = GtfsRealtime.FeedMessage.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            log.warn("⚠️ Malformed GTFS-realtime payload ({} bytes): {}", payload.length, e.getMessage());
            return ParseResult.failed("malformed GTFS-realtime payload: " + e.getMessage());
        }

        List<TrackAssignment> assignments = new ArrayList<>();
        int discarded = 0;
        try {
            for (GtfsRealtime.FeedEntity entity : feed.getEntityList()) {
                if (!entity.hasTripUpdate()) {
                    continue;
                }
                GtfsRealtime.TripUpdate tripUpdate = entity.getTripUpdate();
                Optional<String> destination = catalog.resolveRoute(tripUpdate.getTrip().getRouteId());
                if (destination.isEmpty()) {
                    log.trace("Skipping trip {} with unknown route {}", tripUpdate.getTrip().getTripId(),
                            tripUpdate.getTrip().getRouteId());
                    discarded += tripUpdate.getStopTimeUpdateCount();
                    continue;
                }
                String trainNum = trainNumber(tripUpdate);

                for (GtfsRealtime.TripUpdate.StopTimeUpdate update : tripUpdate.getStopTimeUpdateList()) {
                    TrackAssignment assignment = toAssignment(destination.get(), trainNum, update);
                    if (assignment == null) {
                        discarded++;
                    } else {
                        assignments.add(assignment);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to read GTFS-realtime entities", e);
            return ParseResult.failed("unreadable GTFS-realtime entities: " + e.getMessage());
        }

        log.debug("GTFS-realtime feed: {} entities → {} assignments ({} discarded)",
                feed.getEntityCount(), assignments.size(), discarded);
        return ParseResult.of(assignments, discarded);
    }

    private TrackAssignment toAssignment(String destination, String trainNum,
            GtfsRealtime.TripUpdate.StopTimeUpdate update) {
        // a trip also reports its stops along the branch; those stop ids are
        // station codes, not terminal tracks
        if (!update.hasStopId() || !catalog.isTerminalStop(update.getStopId())) {
            return null;
        }
        Optional<String> track = TrackCodes.extract(update.getStopId()).flatMap(catalog::normalizeTrack);
        if (track.isEmpty()) {
            return null;
        }

        boolean hasArrival = update.hasArrival() && update.getArrival().hasTime();
        boolean hasDeparture = update.hasDeparture() && update.getDeparture().hasTime();
        if (hasArrival && !hasDeparture) {
            return TrackAssignment.builder()
                    .destination(destination)
                    .track(track.get())
                    .trainNum(trainNum)
                    .arrival(true)
                    .timestamp(Instant.ofEpochSecond(update.getArrival().getTime()))
                    .build();
        }
        if (hasDeparture) {
            return TrackAssignment.builder()
                    .destination(destination)
                    .track(track.get())
                    .trainNum(trainNum)
                    .departure(true)
                    .timestamp(Instant.ofEpochSecond(update.getDeparture().getTime()))
                    .build();
        }
        return null;
    }

    private String trainNumber(GtfsRealtime.TripUpdate tripUpdate) {
        if (tripUpdate.hasVehicle() && tripUpdate.getVehicle().hasLabel()
                && !tripUpdate.getVehicle().getLabel().isBlank()) {
            return tripUpdate.getVehicle().getLabel().trim();
        }
        String tripId = tripUpdate.getTrip().getTripId();
        if (tripId == null || tripId.isBlank()) {
            return null;
        }
        String last = tripId.substring(tripId.lastIndexOf('_') + 1).trim();
        return last.isEmpty() ? null : last;
    }
}
