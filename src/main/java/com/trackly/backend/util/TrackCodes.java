package com.trackly.backend.util;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a platform track number out of feed stop identifiers.
 */
public final class TrackCodes {

    // Highest priority first: "NYK_13", then "something9", then any digit run.
    private static final List<Pattern> EXTRACTION_RULES = List.of(
            Pattern.compile("[A-Za-z]+_(\\d+)"),
            Pattern.compile("(\\d+)$"),
            Pattern.compile("(\\d+)"));

    private TrackCodes() {
    }

    /**
     * Extracts the candidate track text from a stop identifier, without range
     * validation.
     */
    public static Optional<String> extract(String stopId) {
        if (stopId == null || stopId.isBlank()) {
            return Optional.empty();
        }
        String trimmed = stopId.trim();
        for (Pattern rule : EXTRACTION_RULES) {
            Matcher matcher = rule.matcher(trimmed);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a track code as a plain non-negative integer ("07" gives 7).
     * Range checks belong to the terminal catalog.
     *
     * @return the integer value, or empty if the text is not a number
     */
    public static Optional<Integer> parse(String track) {
        if (track == null) {
            return Optional.empty();
        }
        String trimmed = track.trim();
        if (trimmed.isEmpty() || trimmed.length() > 9 || !trimmed.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(trimmed));
    }
}
