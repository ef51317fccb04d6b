package com.dealereye.analytics.layout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Semantic role of a zone. */
public enum ZoneType {
    GREET_ZONE("greet_zone"),
    BAY("bay"),
    LOBBY("lobby"),
    WAITING_AREA("waiting_area"),
    PERIMETER("perimeter"),
    PARKING("parking"),
    CUSTOM("custom");

    private final String value;

    ZoneType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ZoneType fromValue(String value) {
        for (ZoneType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown zone type: " + value);
    }
}
