package com.dealereye.eventmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Object classes reported by the upstream detector. */
public enum ObjectClass {
    PERSON("person"),
    VEHICLE("vehicle"),
    BICYCLE("bicycle"),
    MOTORCYCLE("motorcycle"),
    TRUCK("truck"),
    BUS("bus");

    private final String value;

    ObjectClass(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a detector label, ignoring case.
     *
     * @throws IllegalArgumentException if the label is not a known class
     */
    @JsonCreator
    public static ObjectClass fromValue(String value) {
        for (ObjectClass objectClass : values()) {
            if (objectClass.value.equalsIgnoreCase(value)) {
                return objectClass;
            }
        }
        throw new IllegalArgumentException("Unknown object class: " + value);
    }
}
