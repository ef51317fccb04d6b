package com.dealereye.eventmodel.metric;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One computed metric sample.
 *
 * @param metricId identifier; for event-triggered metrics this is the triggering event's id
 * @param tenantId organization owning the site
 * @param siteId dealership location the metric describes
 * @param metricName which metric this is
 * @param windowStart start of the window the value belongs to
 * @param windowSize length of that window
 * @param value numeric value, in {@code unit}
 * @param unit e.g. "seconds", "persons", "vehicles"
 * @param dimensions drill-down tags such as camera, zone, bay or door id
 * @param estimated true when the value has not been confirmed by a ground-truth system
 */
public record MetricValue(
        String metricId,
        String tenantId,
        String siteId,
        MetricName metricName,
        Instant windowStart,
        WindowSize windowSize,
        double value,
        String unit,
        Map<String, String> dimensions,
        @JsonProperty("is_estimated") boolean estimated) {

    public MetricValue {
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
    }
}
