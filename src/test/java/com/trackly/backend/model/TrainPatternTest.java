package com.trackly.backend.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrainPatternTest {

    private static final Instant SEEN = Instant.parse("2024-05-01T21:30:00Z");

    private static TrainPattern observe(String... tracks) {
        TrainPattern pattern = new TrainPattern();
        for (String track : tracks) {
            pattern.recordObservation(track, SEEN);
        }
        return pattern;
    }

    @Test
    void testFirstObservation_ConfidenceIsCapped() {
        TrainPattern pattern = observe("13");

        assertEquals("13", pattern.getMostCommonTrack());
        assertEquals(1, pattern.getTotalObservations());
        assertEquals(95, pattern.getConfidence());
        assertTrue(pattern.getAlternativeTracks().isEmpty());
        assertEquals(SEEN, pattern.getLastSeenAt());
    }

    @Test
    void testConfidence_IsRoundedShareOfTopTrack() {
        TrainPattern pattern = observe("13", "13", "15", "13", "15", "13", "13");

        assertEquals(Map.of("13", 5, "15", 2), pattern.getTrackCounts());
        assertEquals("13", pattern.getMostCommonTrack());
        assertEquals(71, pattern.getConfidence());
        assertEquals(List.of("15"), pattern.getAlternativeTracks());
    }

    @Test
    void testTie_FirstSeenTrackWins() {
        TrainPattern pattern = observe("15", "13", "13", "15");

        assertEquals("15", pattern.getMostCommonTrack());
        assertEquals(50, pattern.getConfidence());
        assertEquals(List.of("13"), pattern.getAlternativeTracks());
    }

    @Test
    void testAlternatives_OnlyRepeatedTracksOrderedByCount() {
        TrainPattern pattern = observe("13", "13", "13", "13", "14", "16", "16", "16", "18", "18");

        assertEquals("13", pattern.getMostCommonTrack());
        assertEquals(List.of("16", "18"), pattern.getAlternativeTracks());
    }

    @Test
    void testRepeatedObservation_AddsExactlyTwo() {
        TrainPattern pattern = observe("13", "15", "15");
        int before = pattern.getTrackCounts().get("13");

        pattern.recordObservation("13", SEEN);
        pattern.recordObservation("13", SEEN);

        assertEquals(before + 2, pattern.getTrackCounts().get("13"));
        assertEquals(5, pattern.getTotalObservations());
        assertEquals("13", pattern.getMostCommonTrack());
        assertEquals(60, pattern.getConfidence());
    }

    @Test
    void testInvariants_HoldAfterAnySequence() {
        String[] tracks = { "13", "14", "15", "16", "17" };
        TrainPattern pattern = new TrainPattern();
        for (int i = 0; i < 200; i++) {
            pattern.recordObservation(tracks[(i * 7 + i / 3) % tracks.length], SEEN);

            int max = pattern.getTrackCounts().values().stream().mapToInt(Integer::intValue).max().orElse(0);
            assertEquals(max, pattern.getTrackCounts().get(pattern.getMostCommonTrack()));
            assertTrue(pattern.getConfidence() <= TrainPattern.MAX_CONFIDENCE);
            assertEquals(i + 1, pattern.getTotalObservations());
        }
    }

    @Test
    void testLastSeenAt_KeepsLatest() {
        TrainPattern pattern = new TrainPattern();
        pattern.recordObservation("13", SEEN);
        pattern.recordObservation("13", SEEN.minusSeconds(600));

        assertEquals(SEEN, pattern.getLastSeenAt());
    }
}
