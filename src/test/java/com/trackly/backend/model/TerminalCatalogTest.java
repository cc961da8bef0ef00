package com.trackly.backend.model;

import com.trackly.backend.TestCatalogs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TerminalCatalogTest {

    private final TerminalCatalog catalog = TestCatalogs.pennStation();

    @Test
    void testResolveRoute() {
        assertEquals(Optional.of("Babylon"), catalog.resolveRoute("1"));
        assertTrue(catalog.resolveRoute("99").isEmpty());
        assertTrue(catalog.resolveRoute(null).isEmpty());
    }

    @Test
    void testCanonicalDestination_IgnoresCase() {
        assertEquals("Port Washington", catalog.canonicalDestination("  port washington "));
        assertEquals("City Terminal Zone", catalog.canonicalDestination("CITY TERMINAL ZONE"));
        assertEquals("Montauk", catalog.canonicalDestination("Montauk"));
    }

    @Test
    void testFindSeed_AppliesDefaultConfidence() {
        SeedPattern babylon = catalog.findSeed("babylon").orElseThrow();

        assertEquals(List.of("13", "14", "15", "16"), babylon.getTracks());
        assertEquals(35, babylon.getConfidence());
        assertEquals(30, catalog.findSeed("Port Washington").orElseThrow().getConfidence());
        assertTrue(catalog.findSeed("City Terminal Zone").isEmpty());
    }

    @Test
    void testIsValidTrack() {
        assertFalse(catalog.isValidTrack(0));
        assertTrue(catalog.isValidTrack(1));
        assertTrue(catalog.isValidTrack(21));
        assertFalse(catalog.isValidTrack(22));
    }

    @Test
    void testNormalizeTrack_RangeAndLeadingZero() {
        assertEquals(Optional.of("7"), catalog.normalizeTrack("07"));
        assertEquals(Optional.of("1"), catalog.normalizeTrack("1"));
        assertEquals(Optional.of("21"), catalog.normalizeTrack("21"));
        assertTrue(catalog.normalizeTrack("0").isEmpty());
        assertTrue(catalog.normalizeTrack("22").isEmpty());
        assertTrue(catalog.normalizeTrack("TBD").isEmpty());
    }

    @Test
    void testNormalizeTrack_AcceptsEveryTrackInRange() {
        for (int track = 1; track <= 21; track++) {
            assertTrue(catalog.normalizeTrack(String.valueOf(track)).isPresent(), "track " + track);
        }
    }

    @Test
    void testIsTerminalStop() {
        assertTrue(catalog.isTerminalStop("BTA_102"));

        catalog.setTerminalStopPrefixes(List.of("nyk_", "PENN"));
        assertTrue(catalog.isTerminalStop("NYK_13"));
        assertTrue(catalog.isTerminalStop("penn7"));
        assertFalse(catalog.isTerminalStop("BTA_102"));
        assertFalse(catalog.isTerminalStop(null));
    }
}
