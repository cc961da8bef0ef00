package com.trackly.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single validated track observation decoded from one feed fetch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackAssignment {
    private String destination;
    private String track;
    private String trainNum; // may be null when the feed carries no train number
    private boolean arrival;
    private boolean departure;
    private Instant timestamp;
}
