package com.dealereye.analytics.correlation;

import java.time.Duration;

/**
 * Time horizons and bounds of the per-site correlation buffers.
 *
 * @param ttgMatchWindow longest arrival-to-greet delay that still counts as a match (default 5 min)
 * @param arrivalRetention how long arrivals stay buffered (default 1 h)
 * @param arrivalCapacity most arrivals buffered per site; oldest are evicted first (default 10 000)
 * @param bayEntryRetention how long an open bay entry waits for its exit (default 12 h)
 */
public record CorrelationSettings(
        Duration ttgMatchWindow,
        Duration arrivalRetention,
        int arrivalCapacity,
        Duration bayEntryRetention) {

    public static final Duration DEFAULT_TTG_MATCH_WINDOW = Duration.ofMinutes(5);
    public static final Duration DEFAULT_ARRIVAL_RETENTION = Duration.ofHours(1);
    public static final int DEFAULT_ARRIVAL_CAPACITY = 10_000;
    public static final Duration DEFAULT_BAY_ENTRY_RETENTION = Duration.ofHours(12);

    /**
     * Compact constructor; replaces missing or non-positive values with defaults.
     */
    public CorrelationSettings {
        ttgMatchWindow = positiveOr(ttgMatchWindow, DEFAULT_TTG_MATCH_WINDOW);
        arrivalRetention = positiveOr(arrivalRetention, DEFAULT_ARRIVAL_RETENTION);
        if (arrivalCapacity <= 0) {
            arrivalCapacity = DEFAULT_ARRIVAL_CAPACITY;
        }
        bayEntryRetention = positiveOr(bayEntryRetention, DEFAULT_BAY_ENTRY_RETENTION);
    }

    public static CorrelationSettings defaults() {
        return new CorrelationSettings(null, null, 0, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
