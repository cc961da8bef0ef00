package com.trackly.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Prediction {
    private PredictionMethod method;
    private String track; // single-track methods
    private List<String> tracks; // branch pattern lists every usual track
    private int confidence;
    private String reason;
    private List<String> alternatives;
}
