package com.dealereye.eventmodel.metric;

import com.fasterxml.jackson.annotation.JsonValue;

/** Metrics derived by correlating domain events. */
public enum MetricName {
    TIME_TO_GREET("time_to_greet", "seconds"),
    RACK_TIME("rack_time", "seconds"),
    LOBBY_OCCUPANCY("lobby_occupancy", "persons"),
    DRIVE_THROUGHPUT("drive_throughput", "vehicles");

    private final String value;
    private final String unit;

    MetricName(String value, String unit) {
        this.value = value;
        this.unit = unit;
    }

    /** Canonical string representation. */
    @JsonValue
    public String value() {
        return value;
    }

    /** Unit every value of this metric is expressed in. */
    public String unit() {
        return unit;
    }
}
