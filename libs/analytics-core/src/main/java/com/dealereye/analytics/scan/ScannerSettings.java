package com.dealereye.analytics.scan;

import java.time.Duration;

/**
 * Tunables of the periodic dwell and greet-proximity scan.
 *
 * @param scanInterval cadence of scan ticks (default 1s)
 * @param defaultDwellThreshold dwell threshold for zones that do not configure one (default 2s)
 * @param greetProximity minimum shared residency of a vehicle and a person in a greet zone
 *     before a greet fires (default 1s)
 * @param maxTrackAge tracks with no primitive for longer than this are reaped (default 60s)
 */
public record ScannerSettings(
        Duration scanInterval,
        Duration defaultDwellThreshold,
        Duration greetProximity,
        Duration maxTrackAge) {

    public static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_DWELL_THRESHOLD = Duration.ofSeconds(2);
    public static final Duration DEFAULT_GREET_PROXIMITY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_TRACK_AGE = Duration.ofSeconds(60);

    /**
     * Compact constructor; replaces missing or non-positive durations with defaults.
     */
    public ScannerSettings {
        scanInterval = positiveOr(scanInterval, DEFAULT_SCAN_INTERVAL);
        defaultDwellThreshold = positiveOr(defaultDwellThreshold, DEFAULT_DWELL_THRESHOLD);
        greetProximity = positiveOr(greetProximity, DEFAULT_GREET_PROXIMITY);
        maxTrackAge = positiveOr(maxTrackAge, DEFAULT_MAX_TRACK_AGE);
    }

    public static ScannerSettings defaults() {
        return new ScannerSettings(null, null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
