package com.dealereye.analytics.layout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Semantic role of a line; decides which domain event a crossing produces. */
public enum LineType {
    ENTRY("entry"),
    EXIT("exit"),
    BAY_ENTRY("bay_entry"),
    BAY_EXIT("bay_exit"),
    DOOR("door"),
    PERIMETER("perimeter"),
    CUSTOM("custom");

    private final String value;

    LineType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static LineType fromValue(String value) {
        for (LineType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown line type: " + value);
    }
}
