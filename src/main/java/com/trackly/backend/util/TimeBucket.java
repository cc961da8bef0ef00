package com.trackly.backend.util;

import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Day-of-week and hour-of-day slot used to partition learned patterns.
 * Days run 0 (Sunday) to 6 (Saturday).
 */
@Value
public class TimeBucket {
    int dayOfWeek;
    int hour;

    public static TimeBucket of(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        return new TimeBucket(local.getDayOfWeek().getValue() % 7, local.getHour());
    }
}
