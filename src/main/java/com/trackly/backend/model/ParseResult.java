package com.trackly.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseResult {

    public enum Status {
        SUCCESS,
        EMPTY,
        FAILED
    }

    private Status status;
    @Builder.Default
    private List<TrackAssignment> assignments = Collections.emptyList();
    private int discarded;
    private String error;

    public static ParseResult of(List<TrackAssignment> assignments, int discarded) {
        return ParseResult.builder()
                .status(assignments.isEmpty() ? Status.EMPTY : Status.SUCCESS)
                .assignments(List.copyOf(assignments))
                .discarded(discarded)
                .build();
    }

    public static ParseResult failed(String error) {
        return ParseResult.builder().status(Status.FAILED).error(error).build();
    }
}
