package com.trackly.backend.controller;

import com.trackly.backend.model.PredictionResponse;
import com.trackly.backend.service.RealtimeTrackService;
import com.trackly.backend.service.TrackPredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/predict")
@RequiredArgsConstructor
@Tag(name = "Predictions", description = "Ranked platform track predictions for outbound trains")
public class PredictionController {

    private final TrackPredictionService trackPredictionService;
    private final RealtimeTrackService realtimeTrackService;

    @Operation(summary = "Predict Track", description = "Ranks likely departure tracks for a destination (and optionally a train number) from recent inbound arrivals, learned history and the branch seed table.")
    @ApiResponse(responseCode = "200", description = "Predictions, possibly empty when there is not enough data")
    @ApiResponse(responseCode = "400", description = "Missing destination")
    @GetMapping
    public PredictionResponse predict(
            @Parameter(description = "Destination branch (e.g. Babylon)", required = true) @RequestParam String destination,
            @Parameter(description = "Train number (e.g. 2739)") @RequestParam(required = false) String trainNum) {
        return trackPredictionService.predict(destination, trainNum);
    }

    @Operation(summary = "Live Track Board", description = "Reads the live TrainTime board for this request and passes posted tracks through. Fallback mode with no learning.")
    @ApiResponse(responseCode = "200", description = "Live rows matching the destination or train number")
    @ApiResponse(responseCode = "503", description = "The live board could not be fetched")
    @GetMapping("/realtime")
    public PredictionResponse predictRealtime(
            @Parameter(description = "Destination substring (e.g. Babylon)", required = true) @RequestParam String destination,
            @Parameter(description = "Train number (e.g. 2739)") @RequestParam(required = false) String trainNum) {
        return realtimeTrackService.predict(destination, trainNum);
    }
}
