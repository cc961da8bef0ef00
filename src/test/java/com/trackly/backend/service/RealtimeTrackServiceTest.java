package com.trackly.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackly.backend.TestCatalogs;
import com.trackly.backend.client.FeedFetcher;
import com.trackly.backend.exception.FeedUnavailableException;
import com.trackly.backend.model.FetchResult;
import com.trackly.backend.model.Prediction;
import com.trackly.backend.model.PredictionMethod;
import com.trackly.backend.model.PredictionResponse;
import com.trackly.backend.parser.TrainTimeFeedParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeTrackServiceTest {

    private static final String URL = "https://traintime.example.test/api/TrainTime";
    private static final String BOARD = "{\"Trains\":["
            + "{\"Destination\":\"Babylon\",\"TrainNumber\":\"2739\",\"Track\":\"13\",\"ScheduledTime\":\"2024-05-01T17:05:00\"},"
            + "{\"Destination\":\"Babylon\",\"TrainNumber\":\"2741\",\"Track\":\"TBD\",\"ScheduledTime\":\"2024-05-01T17:35:00\"},"
            + "{\"Destination\":\"Ronkonkoma\",\"TrainNumber\":\"1710\",\"Track\":\"20\",\"ScheduledTime\":\"2024-05-01T17:10:00\"}"
            + "]}";

    @Mock
    private FeedFetcher feedFetcher;

    private RealtimeTrackService service;

    @BeforeEach
    void setUp() {
        TrainTimeFeedParser parser = new TrainTimeFeedParser(TestCatalogs.pennStation(), new ObjectMapper());
        service = new RealtimeTrackService(feedFetcher, parser, TestCatalogs.pennStation(),
                Clock.fixed(Instant.parse("2024-05-01T21:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "realtimeUrl", URL);
    }

    @Test
    void testPredict_PassesPostedTracksThrough() {
        when(feedFetcher.fetch(URL)).thenReturn(FetchResult.success(BOARD.getBytes(StandardCharsets.UTF_8), 1));

        PredictionResponse response = service.predict("baby", null);

        assertEquals(2, response.getPredictions().size());
        Prediction posted = response.getPredictions().get(0);
        assertEquals(PredictionMethod.REALTIME, posted.getMethod());
        assertEquals("13", posted.getTrack());
        assertEquals(95, posted.getConfidence());
        Prediction tbd = response.getPredictions().get(1);
        assertNull(tbd.getTrack());
        assertEquals(50, tbd.getConfidence());
        assertTrue(tbd.getReason().contains("TBD"));
    }

    @Test
    void testPredict_MatchesByTrainNumber() {
        when(feedFetcher.fetch(URL)).thenReturn(FetchResult.success(BOARD.getBytes(StandardCharsets.UTF_8), 1));

        PredictionResponse response = service.predict("Montauk", "1710");

        assertEquals(1, response.getPredictions().size());
        assertEquals("20", response.getPredictions().get(0).getTrack());
    }

    @Test
    void testPredict_FetchFailureIsServerFault() {
        when(feedFetcher.fetch(URL)).thenReturn(FetchResult.failed("HTTP 502", 3));

        assertThrows(FeedUnavailableException.class, () -> service.predict("Babylon", null));
    }

    @Test
    void testPredict_UndecodableBoardIsServerFault() {
        when(feedFetcher.fetch(URL)).thenReturn(FetchResult.success("<html>".getBytes(StandardCharsets.UTF_8), 1));

        assertThrows(FeedUnavailableException.class, () -> service.predict("Babylon", null));
    }
}
