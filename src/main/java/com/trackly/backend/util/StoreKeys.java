package com.trackly.backend.util;

/**
 * Key layout of the learned-data store.
 */
public final class StoreKeys {

    public static final String PATTERN_PREFIX = "pattern:";
    public static final String ARRIVAL_PREFIX = "arrival:";
    public static final String STATS = "stats:learning";
    public static final String UNKNOWN_TRAIN = "unknown";

    private StoreKeys() {
    }

    public static String pattern(String destination, TimeBucket bucket, String trainNum) {
        String train = trainNum == null || trainNum.isBlank() ? UNKNOWN_TRAIN : trainNum.trim();
        return PATTERN_PREFIX + destination + ":" + bucket.getDayOfWeek() + ":" + bucket.getHour() + ":" + train;
    }

    public static String arrival(String destination) {
        return ARRIVAL_PREFIX + destination;
    }
}
