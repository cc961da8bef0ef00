package com.trackly.backend.service;

import com.trackly.backend.client.FeedFetcher;
import com.trackly.backend.model.FetchResult;
import com.trackly.backend.model.HealthStats;
import com.trackly.backend.model.LearningCycleSummary;
import com.trackly.backend.model.LearningState;
import com.trackly.backend.model.ParseResult;
import com.trackly.backend.model.RecentArrival;
import com.trackly.backend.model.TrackAssignment;
import com.trackly.backend.model.TrainPattern;
import com.trackly.backend.parser.FeedParser;
import com.trackly.backend.repository.LearnedDataWriter;
import com.trackly.backend.util.TimeBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The learning loop: fetch the feed, decode it, fold every observation into
 * the learned patterns and refresh the health stats. This is the only writer
 * of learned data; cycles never overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackLearningService {

        private final FeedFetcher feedFetcher;
        private final List<FeedParser> feedParsers;
        private final LearnedDataWriter learnedData;
        private final MonitoringService monitoringService;
        private final Clock clock;

        private final AtomicReference<LearningState> state = new AtomicReference<>(LearningState.IDLE);

        @Value("${feed.format:gtfs-rt}")
        private String feedFormat;

        @Value("${learning.time-zone:America/New_York}")
        private String timeZone;

        @Value("${learning.staleness-threshold-ms:300000}")
        private long stalenessThresholdMs;

        public LearningState getState() {
                return state.get();
        }

        /**
         * Runs one full cycle. Never throws: any failure is logged, counted and
         * reported in the returned summary.
         */
        public synchronized LearningCycleSummary runCycle() {
                Instant startedAt = clock.instant();
                long startMillis = System.currentTimeMillis();

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("🚆 LEARNING CYCLE STARTED | Format: {} | Time: {}", feedFormat, startedAt);
                log.info("═══════════════════════════════════════════════════════════════════");

                try {
                        state.set(LearningState.FETCHING);
                        FetchResult fetch = feedFetcher.fetch();
                        if (!fetch.isSuccess()) {
                                return failedCycle(startedAt, startMillis, fetch.getAttempts(),
                                                "Feed fetch failed: " + fetch.getError());
                        }
                        log.info("✅ Feed fetched | {} bytes | {} attempt(s)", fetch.getPayload().length,
                                        fetch.getAttempts());

                        state.set(LearningState.PARSING);
                        ParseResult parsed = activeParser().parse(fetch.getPayload());
                        if (parsed.getStatus() == ParseResult.Status.FAILED) {
                                // the fetch itself succeeded, so the cycle still counts; it just learns nothing
                                log.warn("⚠️ Feed payload unreadable, learning nothing this cycle: {}", parsed.getError());
                                parsed = ParseResult.of(List.of(), 0);
                        }

                        state.set(LearningState.UPDATING);
                        int patternsUpdated = 0;
                        int arrivalsRecorded = 0;
                        ZoneId zone = ZoneId.of(timeZone);
                        for (TrackAssignment assignment : parsed.getAssignments()) {
                                if (learnPattern(assignment, zone)) {
                                        patternsUpdated++;
                                }
                                if (assignment.isArrival() && recordArrival(assignment)) {
                                        arrivalsRecorded++;
                                }
                        }

                        Instant now = clock.instant();
                        HealthStats stats = currentStats();
                        stats.setSuccessfulFetches(stats.getSuccessfulFetches() + 1);
                        stats.setTotalPatterns(learnedData.countPatterns());
                        stats.setLastUpdateAt(now);
                        stats.setHealthy(isFresh(now, now));
                        learnedData.saveStats(stats);

                        long duration = System.currentTimeMillis() - startMillis;
                        int observations = parsed.getAssignments().size();
                        log.info("✅ SUMMARY: {} observations → {} patterns updated, {} arrivals | {} discarded | {} patterns known | Took: {}ms",
                                        observations, patternsUpdated, arrivalsRecorded, parsed.getDiscarded(),
                                        stats.getTotalPatterns(), duration);

                        LearningCycleSummary summary = LearningCycleSummary.builder()
                                        .timestamp(startedAt)
                                        .status("SUCCESS")
                                        .fetchAttempts(fetch.getAttempts())
                                        .observationsReceived(observations)
                                        .observationsDiscarded(parsed.getDiscarded())
                                        .patternsUpdated(patternsUpdated)
                                        .arrivalsRecorded(arrivalsRecorded)
                                        .processingTimeMs(duration)
                                        .message(String.format("Learned from %d observations", observations))
                                        .build();
                        monitoringService.recordCycle(summary);
                        return summary;
                } catch (Exception e) {
                        log.error("❌ Unexpected error during learning cycle", e);
                        return failedCycle(startedAt, startMillis, 0, "Error during learning cycle: " + e.getMessage());
                } finally {
                        state.set(LearningState.SLEEPING);
                }
        }

        private boolean learnPattern(TrackAssignment assignment, ZoneId zone) {
                TimeBucket bucket = TimeBucket.of(assignment.getTimestamp(), zone);
                TrainPattern pattern = learnedData
                                .findPattern(assignment.getDestination(), bucket, assignment.getTrainNum())
                                .orElseGet(TrainPattern::new);
                pattern.recordObservation(assignment.getTrack(), assignment.getTimestamp());
                boolean saved = learnedData.savePattern(assignment.getDestination(), bucket,
                                assignment.getTrainNum(), pattern);
                if (!saved) {
                        log.warn("⚠️ Could not save pattern for {} train {}", assignment.getDestination(),
                                        assignment.getTrainNum());
                }
                log.trace("Learned {} train {} → track {} (bucket {}/{})", assignment.getDestination(),
                                assignment.getTrainNum(), assignment.getTrack(), bucket.getDayOfWeek(), bucket.getHour());
                return saved;
        }

        private boolean recordArrival(TrackAssignment assignment) {
                return learnedData.saveRecentArrival(assignment.getDestination(), RecentArrival.builder()
                                .track(assignment.getTrack())
                                .trainNum(assignment.getTrainNum())
                                .observedAt(assignment.getTimestamp())
                                .build());
        }

        private LearningCycleSummary failedCycle(Instant startedAt, long startMillis, int attempts, String message) {
                long duration = System.currentTimeMillis() - startMillis;
                log.warn("⚠️  STATUS: FAILED | {} | Took: {}ms", message, duration);
                try {
                        HealthStats stats = currentStats();
                        stats.setFailedFetches(stats.getFailedFetches() + 1);
                        stats.setHealthy(isFresh(stats.getLastUpdateAt(), clock.instant()));
                        learnedData.saveStats(stats);
                } catch (RuntimeException e) {
                        log.error("Failed to record failed learning cycle", e);
                }

                LearningCycleSummary summary = LearningCycleSummary.builder()
                                .timestamp(startedAt)
                                .status("FAILED")
                                .fetchAttempts(attempts)
                                .observationsReceived(0)
                                .observationsDiscarded(0)
                                .patternsUpdated(0)
                                .arrivalsRecorded(0)
                                .processingTimeMs(duration)
                                .message(message)
                                .build();
                monitoringService.recordCycle(summary);
                return summary;
        }

        private HealthStats currentStats() {
                return learnedData.findStats().orElseGet(HealthStats::empty);
        }

        private boolean isFresh(Instant lastUpdateAt, Instant now) {
                return lastUpdateAt != null
                                && Duration.between(lastUpdateAt, now).toMillis() < stalenessThresholdMs;
        }

        private FeedParser activeParser() {
                return feedParsers.stream()
                                .filter(parser -> parser.format().equalsIgnoreCase(feedFormat))
                                .findFirst()
                                .orElseThrow(() -> new IllegalStateException("No feed parser for format: " + feedFormat));
        }
}
