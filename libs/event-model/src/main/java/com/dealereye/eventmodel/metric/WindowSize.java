package com.dealereye.eventmodel.metric;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/** Standard aggregation windows for metric values. */
public enum WindowSize {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    ONE_DAY("1d", Duration.ofDays(1)),
    ONE_WEEK("1w", Duration.ofDays(7));

    private final String value;
    private final Duration length;

    WindowSize(String value, Duration length) {
        this.value = value;
        this.length = length;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Duration length() {
        return length;
    }

    /**
     * Smallest window at least as long as {@code range}; ranges longer than a week map to
     * {@link #ONE_WEEK}.
     */
    public static WindowSize covering(Duration range) {
        for (WindowSize size : values()) {
            if (size.length.compareTo(range) >= 0) {
                return size;
            }
        }
        return ONE_WEEK;
    }
}
