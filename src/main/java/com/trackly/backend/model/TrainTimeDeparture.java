package com.trackly.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the TrainTime departure board.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainTimeDeparture {
    @JsonProperty("Destination")
    private String destination;

    @JsonProperty("TrainNumber")
    private String trainNumber;

    @JsonProperty("Track")
    private String track; // "TBD" until posted

    @JsonProperty("Status")
    private String status;

    @JsonProperty("ScheduledTime")
    private String scheduledTime;
}
