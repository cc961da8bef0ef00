package com.trackly.backend.scheduler;

import com.trackly.backend.service.TrackLearningService;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TrackLearningScheduler {

    private final TrackLearningService trackLearningService;

    /**
     * Run one learning cycle, then sleep for the configured interval
     */
    @Scheduled(fixedDelayString = "${learning.interval:30000}", initialDelayString = "${learning.initial-delay:0}")
    public void learn() {
        trackLearningService.runCycle();
    }

}
