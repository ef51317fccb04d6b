package com.dealereye.analytics.layout;

import java.time.Duration;
import java.util.List;

/**
 * Polygonal analytics zone on one camera.
 *
 * @param zoneId unique identifier, referenced by zone entry/exit primitives
 * @param cameraId camera the polygon is drawn on
 * @param name display name
 * @param zoneType semantic role
 * @param points closed polygon, at least three vertices, order significant
 * @param dwellThresholdSeconds residency before a dwell event fires; null falls back to the
 *     scanner default
 */
public record Zone(
        String zoneId,
        String cameraId,
        String name,
        ZoneType zoneType,
        List<Point> points,
        Double dwellThresholdSeconds) {

    public Zone {
        if (zoneId == null || zoneId.isBlank()) {
            throw new IllegalArgumentException("zoneId must not be null or blank");
        }
        if (zoneType == null) {
            throw new IllegalArgumentException("zoneType must not be null for zone " + zoneId);
        }
        if (points == null || points.size() < 3) {
            throw new IllegalArgumentException("Zone " + zoneId + " must have at least 3 points");
        }
        if (dwellThresholdSeconds != null && dwellThresholdSeconds <= 0) {
            throw new IllegalArgumentException("dwellThresholdSeconds must be positive for zone " + zoneId);
        }
        points = List.copyOf(points);
    }

    /** Dwell threshold of this zone, or {@code fallback} when none is configured. */
    public Duration dwellThreshold(Duration fallback) {
        if (dwellThresholdSeconds == null) {
            return fallback;
        }
        return Duration.ofNanos(Math.round(dwellThresholdSeconds * 1_000_000_000L));
    }
}
