package com.trackly.backend.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class StoreKeysTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void testPatternKey_UsesLocalDayAndHour() {
        // Wednesday 2024-05-01 21:30 UTC is 17:30 in New York
        TimeBucket bucket = TimeBucket.of(Instant.parse("2024-05-01T21:30:00Z"), NEW_YORK);

        assertEquals(3, bucket.getDayOfWeek());
        assertEquals(17, bucket.getHour());
        assertEquals("pattern:Babylon:3:17:2739", StoreKeys.pattern("Babylon", bucket, "2739"));
    }

    @Test
    void testPatternKey_SundayIsZero() {
        TimeBucket bucket = TimeBucket.of(Instant.parse("2024-05-05T14:00:00Z"), NEW_YORK);

        assertEquals(0, bucket.getDayOfWeek());
        assertEquals(10, bucket.getHour());
    }

    @Test
    void testPatternKey_MissingTrainNumber() {
        TimeBucket bucket = new TimeBucket(1, 8);

        assertEquals("pattern:Hempstead:1:8:unknown", StoreKeys.pattern("Hempstead", bucket, null));
        assertEquals("pattern:Hempstead:1:8:unknown", StoreKeys.pattern("Hempstead", bucket, " "));
    }

    @Test
    void testArrivalKey() {
        assertEquals("arrival:Long Beach", StoreKeys.arrival("Long Beach"));
    }
}
