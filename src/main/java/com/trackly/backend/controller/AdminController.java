package com.trackly.backend.controller;

import com.trackly.backend.model.LearningCycleSummary;
import com.trackly.backend.service.TrackLearningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Administrative operations for the learning loop")
public class AdminController {

    private final TrackLearningService trackLearningService;

    @Operation(summary = "Trigger Learning Cycle", description = "Runs one fetch, parse and learn cycle immediately and returns its summary.")
    @ApiResponse(responseCode = "200", description = "Cycle finished (check status for SUCCESS or FAILED)")
    @PostMapping("/learn")
    public ResponseEntity<LearningCycleSummary> learn() {
        log.info("🔄 ADMIN: Manual learning cycle triggered");
        return ResponseEntity.ok(trackLearningService.runCycle());
    }
}
