package com.dealereye.eventmodel;

/**
 * All domain event types emitted by the edge analytics.
 *
 * <p>The {@code value} field holds the canonical string used as the {@code event_type}
 * discriminator in the JSON wire form.
 */
public enum EventType {

    // ---- Service lane ----
    VEHICLE_ARRIVAL("vehicle_arrival"),
    VEHICLE_EXIT("vehicle_exit"),
    GREET_STARTED("greet_started"),

    // ---- Service bays ----
    BAY_ENTRY("bay_entry"),
    BAY_EXIT("bay_exit"),

    // ---- Lobby ----
    LOBBY_ENTER("lobby_enter"),
    LOBBY_EXIT("lobby_exit"),

    // ---- Generic geometry ----
    ZONE_DWELL("zone_dwell"),
    LINE_CROSSING("line_crossing");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "vehicle_arrival"). */
    public String value() {
        return value;
    }
}
