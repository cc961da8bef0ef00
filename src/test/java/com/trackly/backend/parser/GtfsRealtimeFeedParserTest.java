package com.trackly.backend.parser;

import com.google.transit.realtime.GtfsRealtime;
import com.google.transit.realtime.GtfsRealtime.TripUpdate.StopTimeEvent;
import com.google.transit.realtime.GtfsRealtime.TripUpdate.StopTimeUpdate;
import com.trackly.backend.TestCatalogs;
import com.trackly.backend.model.ParseResult;
import com.trackly.backend.model.TerminalCatalog;
import com.trackly.backend.model.TrackAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GtfsRealtimeFeedParserTest {

    private static final long DEPARTS = 1714599000L;

    private GtfsRealtimeFeedParser parser;

    @BeforeEach
    void setUp() {
        parser = new GtfsRealtimeFeedParser(TestCatalogs.pennStation());
    }

    private static GtfsRealtime.FeedEntity trip(String id, String routeId, String tripId, StopTimeUpdate... updates) {
        GtfsRealtime.TripUpdate.Builder tripUpdate = GtfsRealtime.TripUpdate.newBuilder()
                .setTrip(GtfsRealtime.TripDescriptor.newBuilder()
                        .setRouteId(routeId)
                        .setTripId(tripId));
        for (StopTimeUpdate update : updates) {
            tripUpdate.addStopTimeUpdate(update);
        }
        return GtfsRealtime.FeedEntity.newBuilder()
                .setId(id)
                .setTripUpdate(tripUpdate)
                .build();
    }

    private static StopTimeUpdate departure(String stopId, long time) {
        return StopTimeUpdate.newBuilder()
                .setStopId(stopId)
                .setDeparture(StopTimeEvent.newBuilder().setTime(time))
                .build();
    }

    private static StopTimeUpdate arrival(String stopId, long time) {
        return StopTimeUpdate.newBuilder()
                .setStopId(stopId)
                .setArrival(StopTimeEvent.newBuilder().setTime(time))
                .build();
    }

    private static byte[] feed(GtfsRealtime.FeedEntity... entities) {
        GtfsRealtime.FeedMessage.Builder feed = GtfsRealtime.FeedMessage.newBuilder()
                .setHeader(GtfsRealtime.FeedHeader.newBuilder()
                        .setGtfsRealtimeVersion("2.0")
                        .setTimestamp(DEPARTS));
        for (GtfsRealtime.FeedEntity entity : entities) {
            feed.addEntity(entity);
        }
        return feed.build().toByteArray();
    }

    @Test
    void testParse_DepartureWithTrackInStopId() {
        ParseResult result = parser.parse(feed(trip("e1", "1", "GO103_23_2739", departure("NYK_13", DEPARTS))));

        assertEquals(ParseResult.Status.SUCCESS, result.getStatus());
        assertEquals(1, result.getAssignments().size());
        TrackAssignment assignment = result.getAssignments().get(0);
        assertEquals("Babylon", assignment.getDestination());
        assertEquals("13", assignment.getTrack());
        assertEquals("2739", assignment.getTrainNum());
        assertTrue(assignment.isDeparture());
        assertFalse(assignment.isArrival());
        assertEquals(Instant.ofEpochSecond(DEPARTS), assignment.getTimestamp());
    }

    @Test
    void testParse_ArrivalOnlyIsClassifiedAsArrival() {
        ParseResult result = parser.parse(feed(trip("e1", "4", "GO103_23_1710", arrival("NY_07", DEPARTS))));

        TrackAssignment assignment = result.getAssignments().get(0);
        assertEquals("Ronkonkoma", assignment.getDestination());
        assertEquals("7", assignment.getTrack());
        assertTrue(assignment.isArrival());
        assertFalse(assignment.isDeparture());
    }

    @Test
    void testParse_ArrivalAndDepartureCountsAsDeparture() {
        StopTimeUpdate both = StopTimeUpdate.newBuilder()
                .setStopId("NYK_15")
                .setArrival(StopTimeEvent.newBuilder().setTime(DEPARTS - 60))
                .setDeparture(StopTimeEvent.newBuilder().setTime(DEPARTS))
                .build();

        TrackAssignment assignment = parser.parse(feed(trip("e1", "1", "T_2741", both))).getAssignments().get(0);

        assertTrue(assignment.isDeparture());
        assertEquals(Instant.ofEpochSecond(DEPARTS), assignment.getTimestamp());
    }

    @Test
    void testParse_DiscardsInvalidObservations() {
        StopTimeUpdate noTimes = StopTimeUpdate.newBuilder().setStopId("NYK_14").build();

        ParseResult result = parser.parse(feed(
                trip("e1", "1", "T_2739",
                        departure("NYK_25", DEPARTS), // out of range
                        departure("PENN", DEPARTS), // no digits
                        noTimes,
                        departure("NYK_16", DEPARTS)),
                trip("e2", "77", "T_9999", departure("NYK_13", DEPARTS)))); // unknown route

        assertEquals(1, result.getAssignments().size());
        assertEquals("16", result.getAssignments().get(0).getTrack());
        assertEquals(4, result.getDiscarded());
    }

    @Test
    void testParse_VehicleLabelIsTrainNumber() {
        GtfsRealtime.FeedEntity entity = GtfsRealtime.FeedEntity.newBuilder()
                .setId("e1")
                .setTripUpdate(GtfsRealtime.TripUpdate.newBuilder()
                        .setTrip(GtfsRealtime.TripDescriptor.newBuilder().setRouteId("9").setTripId("XYZ"))
                        .setVehicle(GtfsRealtime.VehicleDescriptor.newBuilder().setLabel("1812"))
                        .addStopTimeUpdate(departure("NYK_19", DEPARTS)))
                .build();

        TrackAssignment assignment = parser.parse(feed(entity)).getAssignments().get(0);

        assertEquals("Port Washington", assignment.getDestination());
        assertEquals("1812", assignment.getTrainNum());
    }

    @Test
    void testParse_FeedWithoutTripsIsEmpty() {
        ParseResult result = parser.parse(feed());

        assertEquals(ParseResult.Status.EMPTY, result.getStatus());
        assertTrue(result.getAssignments().isEmpty());
    }

    @Test
    void testParse_MalformedPayloadFails() {
        ParseResult result = parser.parse("not a protobuf".getBytes(StandardCharsets.UTF_8));

        assertEquals(ParseResult.Status.FAILED, result.getStatus());
        assertTrue(result.getAssignments().isEmpty());
        assertNotNull(result.getError());
    }

    @Test
    void testParse_EmptyPayloadFails() {
        assertEquals(ParseResult.Status.FAILED, parser.parse(new byte[0]).getStatus());
        assertEquals(ParseResult.Status.FAILED, parser.parse(null).getStatus());
    }

    @Test
    void testParse_TerminalStopPrefixesSkipBranchStations() {
        TerminalCatalog catalog = TestCatalogs.pennStation();
        catalog.setTerminalStopPrefixes(List.of("NYK_"));
        GtfsRealtimeFeedParser terminalOnly = new GtfsRealtimeFeedParser(catalog);

        // outbound Babylon trip: leaves Penn on track 13, terminates at station 102 with an arrival only
        ParseResult result = terminalOnly.parse(feed(trip("e1", "1", "GO103_23_2739",
                departure("NYK_13", DEPARTS),
                departure("JAM_4", DEPARTS + 1200),
                arrival("BTA_102", DEPARTS + 3600))));

        assertEquals(1, result.getAssignments().size());
        TrackAssignment assignment = result.getAssignments().get(0);
        assertEquals("13", assignment.getTrack());
        assertTrue(assignment.isDeparture());
        assertEquals(2, result.getDiscarded());
        assertTrue(result.getAssignments().stream().noneMatch(TrackAssignment::isArrival));
    }

    @Test
    void testParse_WithoutPrefixesEveryStopIsRead() {
        ParseResult result = parser.parse(feed(trip("e1", "1", "GO103_23_2739",
                departure("NYK_13", DEPARTS),
                arrival("BTA_12", DEPARTS + 3600))));

        assertEquals(2, result.getAssignments().size());
    }
}
