package com.trackly.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.trackly.backend.util.TrackCodes;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static reference data for the modelled terminal: the valid platform range,
 * which destination each feed route serves, the seed track table and which
 * stop ids belong to the terminal. Loaded
 * once at startup and shared read-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TerminalCatalog {

    private String terminal;

    @Builder.Default
    private PlatformRange platformRange = new PlatformRange(1, 21);

    @Builder.Default
    private int defaultSeedConfidence = 35;

    @Builder.Default
    private Map<String, String> routes = new LinkedHashMap<>(); // routeId -> destination

    @Builder.Default
    private Map<String, SeedPattern> seedPatterns = new LinkedHashMap<>(); // destination -> seed

    // stop ids at the terminal itself; empty means every stop of a trip is read
    @Builder.Default
    private List<String> terminalStopPrefixes = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlatformRange {
        private int min;
        private int max;
    }

    public boolean isValidTrack(int track) {
        return track >= platformRange.getMin() && track <= platformRange.getMax();
    }

    /**
     * Canonical text of a track code at this terminal ("07" becomes "7"), or
     * empty when the code is not a number inside the platform range.
     */
    public Optional<String> normalizeTrack(String code) {
        return TrackCodes.parse(code).filter(this::isValidTrack).map(String::valueOf);
    }

    public boolean isTerminalStop(String stopId) {
        if (terminalStopPrefixes == null || terminalStopPrefixes.isEmpty()) {
            return true;
        }
        if (stopId == null) {
            return false;
        }
        String upper = stopId.trim().toUpperCase(Locale.ROOT);
        return terminalStopPrefixes.stream()
                .anyMatch(prefix -> upper.startsWith(prefix.trim().toUpperCase(Locale.ROOT)));
    }

    public Optional<String> resolveRoute(String routeId) {
        if (routeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(routes.get(routeId.trim()));
    }

    /**
     * Returns the catalog spelling of a destination, matched case-insensitively
     * against the route and seed tables, or the trimmed input when unknown.
     */
    public String canonicalDestination(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (String known : seedPatterns.keySet()) {
            if (known.equalsIgnoreCase(trimmed)) {
                return known;
            }
        }
        for (String known : routes.values()) {
            if (known.equalsIgnoreCase(trimmed)) {
                return known;
            }
        }
        return trimmed;
    }

    public boolean isKnownDestination(String name) {
        if (name == null) {
            return false;
        }
        String canonical = canonicalDestination(name);
        return seedPatterns.containsKey(canonical) || routes.containsValue(canonical);
    }

    public Optional<SeedPattern> findSeed(String destination) {
        SeedPattern seed = seedPatterns.get(canonicalDestination(destination));
        if (seed == null || seed.getTracks() == null || seed.getTracks().isEmpty()) {
            return Optional.empty();
        }
        int confidence = seed.getConfidence() != null ? seed.getConfidence() : defaultSeedConfidence;
        return Optional.of(SeedPattern.builder()
                .tracks(List.copyOf(seed.getTracks()))
                .confidence(confidence)
                .build());
    }
}
