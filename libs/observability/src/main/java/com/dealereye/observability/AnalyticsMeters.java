package com.dealereye.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the analytics pipeline.
 * <p>
 * Every recoverable condition the pipeline absorbs (configuration misses, unmatched
 * correlations, malformed input, failed deliveries) is surfaced here as a counter instead of
 * an exception. Every meter carries a {@code service} tag.
 */
public final class AnalyticsMeters {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    public static final String CLASSIFIER_MISSES = "dealereye.classifier.misses";
    public static final String CORRELATION_UNMATCHED = "dealereye.correlation.unmatched";
    public static final String EVENTS_MALFORMED = "dealereye.events.malformed";
    public static final String EVENTS_EMITTED = "dealereye.events.emitted";
    public static final String METRICS_COMPUTED = "dealereye.metrics.computed";
    public static final String PUBLISH_FAILURES = "dealereye.publish.failures";
    public static final String TRACKS_ACTIVE = "dealereye.tracks.active";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, AtomicLong> activeTracks = new ConcurrentHashMap<>();

    /**
     * Creates meters bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public AnalyticsMeters(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * A primitive referenced a line, zone or camera that is not in the loaded layout.
     *
     * @param reason e.g. "unknown_line", "unknown_zone", "unknown_camera"
     */
    public void classificationMiss(String reason) {
        counter(CLASSIFIER_MISSES, "Primitives referencing unknown configuration", "reason", reason).increment();
    }

    /**
     * An event had no counterpart to correlate with.
     *
     * @param kind e.g. "greet", "bay_exit"
     */
    public void unmatchedCorrelation(String kind) {
        counter(CORRELATION_UNMATCHED, "Events with no matching counterpart", "kind", kind).increment();
    }

    /**
     * An input was dropped because required fields were missing or it could not be decoded.
     *
     * @param stage where it was dropped, e.g. "primitive", "correlation", "feed"
     */
    public void malformedEvent(String stage) {
        counter(EVENTS_MALFORMED, "Inputs dropped as malformed", "stage", stage).increment();
    }

    /** A domain event of the given type was emitted. */
    public void eventEmitted(String eventType) {
        counter(EVENTS_EMITTED, "Domain events emitted", "type", eventType).increment();
    }

    /** A metric value with the given name was computed. */
    public void metricComputed(String metricName) {
        counter(METRICS_COMPUTED, "Metric values computed", "metric", metricName).increment();
    }

    /** A publisher or sink threw while accepting a delivery. */
    public void publishFailure(String target) {
        counter(PUBLISH_FAILURES, "Deliveries rejected by a publisher or sink", "target", target).increment();
    }

    /**
     * Gauge of tracks currently held by a camera's registry. The same instance is returned
     * for repeated calls with the same camera.
     */
    public AtomicLong activeTracks(String cameraId) {
        return activeTracks.computeIfAbsent(cameraId, id -> {
            AtomicLong value = new AtomicLong(0);
            Gauge.builder(TRACKS_ACTIVE, value, AtomicLong::doubleValue)
                    .description("Tracks currently under observation")
                    .tags(baseTags("camera", id))
                    .register(registry);
            return value;
        });
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
