package com.dealereye.edgeanalytics.config;

import com.dealereye.analytics.correlation.CorrelationSettings;
import com.dealereye.analytics.scan.ScannerSettings;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Site identity and analytics tunables, bound from {@code dealereye.analytics.*}.
 *
 * <pre>
 * dealereye:
 *   analytics:
 *     tenant-id: acme-motors
 *     site-id: store-042
 *     layout-file: file:/etc/dealereye/layouts.json
 *     throughput-interval: 1h
 *     scanner:
 *       scan-interval: 1s
 *       default-dwell-threshold: 2s
 *       greet-proximity: 1s
 *       max-track-age: 60s
 *     correlation:
 *       ttg-match-window: 5m
 *       arrival-retention: 1h
 *       arrival-capacity: 10000
 *       bay-entry-retention: 12h
 * </pre>
 *
 * @param tenantId tenant owning the site. Required.
 * @param siteId site this edge node serves. Required.
 * @param serviceName value of the {@code service} tag on every meter
 * @param layoutFile JSON document with the zones and lines of every camera; none means no cameras
 * @param throughputInterval how often drive throughput is sampled
 * @param scanner per-camera scan tunables
 * @param correlation correlation buffer tunables
 */
@ConfigurationProperties(prefix = "dealereye.analytics")
@Validated
public record AnalyticsProperties(
        @NotBlank String tenantId,
        @NotBlank String siteId,
        String serviceName,
        Resource layoutFile,
        Duration throughputInterval,
        Scanner scanner,
        Correlation correlation) {

    public static final String DEFAULT_SERVICE_NAME = "edge-analytics";
    public static final Duration DEFAULT_THROUGHPUT_INTERVAL = Duration.ofHours(1);

    /**
     * Compact constructor; applies defaults for optional fields before Bean Validation runs.
     */
    public AnalyticsProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        if (throughputInterval == null || throughputInterval.isNegative() || throughputInterval.isZero()) {
            throughputInterval = DEFAULT_THROUGHPUT_INTERVAL;
        }
        if (scanner == null) {
            scanner = new Scanner(null, null, null, null);
        }
        if (correlation == null) {
            correlation = new Correlation(null, null, 0, null);
        }
    }

    public ScannerSettings scannerSettings() {
        return new ScannerSettings(
                scanner.scanInterval(), scanner.defaultDwellThreshold(),
                scanner.greetProximity(), scanner.maxTrackAge());
    }

    public CorrelationSettings correlationSettings() {
        return new CorrelationSettings(
                correlation.ttgMatchWindow(), correlation.arrivalRetention(),
                correlation.arrivalCapacity(), correlation.bayEntryRetention());
    }

    /** Unset values fall back to the {@link ScannerSettings} defaults. */
    public record Scanner(
            Duration scanInterval,
            Duration defaultDwellThreshold,
            Duration greetProximity,
            Duration maxTrackAge) {
    }

    /** Unset values fall back to the {@link CorrelationSettings} defaults. */
    public record Correlation(
            Duration ttgMatchWindow,
            Duration arrivalRetention,
            int arrivalCapacity,
            Duration bayEntryRetention) {
    }
}
