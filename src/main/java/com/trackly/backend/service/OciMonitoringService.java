package com.trackly.backend.service;

import com.oracle.bmc.auth.InstancePrincipalsAuthenticationDetailsProvider;
import com.oracle.bmc.monitoring.MonitoringClient;
import com.oracle.bmc.monitoring.model.Datapoint;
import com.oracle.bmc.monitoring.model.MetricDataDetails;
import com.oracle.bmc.monitoring.model.PostMetricDataDetails;
import com.oracle.bmc.monitoring.requests.PostMetricDataRequest;
import com.trackly.backend.model.LearningCycleSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Publishes one batch of learning-cycle metrics to OCI Monitoring per cycle.
 * Disabled unless {@code oci.monitoring.enabled=true}.
 */
@Service
@Slf4j
public class OciMonitoringService implements MonitoringService {

    static final String CYCLE_DURATION = "LearningCycleDuration";
    static final String OBSERVATIONS = "ObservationsLearned";
    static final String DISCARDED = "ObservationsDiscarded";
    static final String FETCH_ATTEMPTS = "FeedFetchAttempts";

    private MonitoringClient monitoringClient;

    @Value("${oci.monitoring.compartment-id:}")
    private String compartmentId;

    @Value("${oci.monitoring.namespace:trackly_learning}")
    private String namespace;

    @Value("${oci.monitoring.enabled:false}")
    private boolean enabled;

    @Value("${feed.format:gtfs-rt}")
    private String feedFormat;

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("📉 OCI Monitoring disabled, learning metrics are not exported");
            return;
        }
        try {
            InstancePrincipalsAuthenticationDetailsProvider provider = InstancePrincipalsAuthenticationDetailsProvider
                    .builder().build();
            String region = provider.getRegion().getRegionId();
            monitoringClient = MonitoringClient.builder().build(provider);
            // metric ingestion has its own endpoint, separate from the query API
            monitoringClient.setEndpoint("https://telemetry-ingestion." + region + ".oraclecloud.com");
            log.info("📈 OCI Monitoring ready | Region: {} | Namespace: {}", region, sanitizeNamespace(namespace));
        } catch (Exception e) {
            log.error("❌ OCI Monitoring client could not be created, metrics disabled", e);
            enabled = false;
        }
    }

    @Override
    public void recordCycle(LearningCycleSummary summary) {
        if (!enabled || summary == null) {
            return;
        }
        List<MetricDataDetails> batch = toMetrics(summary);
        try {
            monitoringClient.postMetricData(PostMetricDataRequest.builder()
                    .postMetricDataDetails(PostMetricDataDetails.builder().metricData(batch).build())
                    .build());
            log.debug("Published {} learning metrics ({})", batch.size(), summary.getStatus());
        } catch (Exception e) {
            log.warn("⚠️ Dropped {} learning metrics: {}", batch.size(), e.getMessage());
        }
    }

    List<MetricDataDetails> toMetrics(LearningCycleSummary summary) {
        Date at = summary.getTimestamp() == null ? new Date() : Date.from(summary.getTimestamp());
        Map<String, String> dimensions = Map.of(
                "status", String.valueOf(summary.getStatus()),
                "feed", feedFormat);

        List<MetricDataDetails> metrics = new ArrayList<>();
        metrics.add(metric(CYCLE_DURATION, valueOf(summary.getProcessingTimeMs()), "milliseconds", dimensions, at));
        metrics.add(metric(FETCH_ATTEMPTS, valueOf(summary.getFetchAttempts()), "count", dimensions, at));
        if ("SUCCESS".equals(summary.getStatus())) {
            metrics.add(metric(OBSERVATIONS, valueOf(summary.getObservationsReceived()), "count", dimensions, at));
            metrics.add(metric(DISCARDED, valueOf(summary.getObservationsDiscarded()), "count", dimensions, at));
        }
        return metrics;
    }

    private MetricDataDetails metric(String name, double value, String unit, Map<String, String> dimensions,
            Date at) {
        return MetricDataDetails.builder()
                .namespace(sanitizeNamespace(namespace))
                .compartmentId(compartmentId)
                .name(name)
                .metadata(Map.of("unit", unit))
                .dimensions(dimensions)
                .datapoints(List.of(Datapoint.builder().timestamp(at).value(value).count(1).build()))
                .build();
    }

    private static double valueOf(Number number) {
        return number == null ? 0d : number.doubleValue();
    }

    static String sanitizeNamespace(String namespace) {
        // OCI accepts ^[a-z][a-z0-9_]*[a-z0-9]$
        String sanitized = namespace.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (!sanitized.isEmpty() && !Character.isLetter(sanitized.charAt(0))) {
            sanitized = "n_" + sanitized;
        }
        return sanitized;
    }

    @PreDestroy
    public void close() {
        if (monitoringClient != null) {
            monitoringClient.close();
        }
    }
}
