package com.dealereye.analytics.layout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Zones and lines configured for one camera, indexed by identifier.
 * <p>
 * Immutable. A configuration change replaces the whole layout of a camera.
 */
public final class CameraLayout {

    private final String cameraId;
    private final Map<String, Zone> zones;
    private final Map<String, Line> lines;

    @JsonCreator
    public CameraLayout(
            @JsonProperty("camera_id") String cameraId,
            @JsonProperty("zones") List<Zone> zones,
            @JsonProperty("lines") List<Line> lines) {
        if (cameraId == null || cameraId.isBlank()) {
            throw new IllegalArgumentException("cameraId must not be null or blank");
        }
        this.cameraId = cameraId;
        this.zones = index(zones, Zone::zoneId, "zone");
        this.lines = index(lines, Line::lineId, "line");
    }

    /** A layout with no zones and no lines; every primitive is a configuration miss. */
    public static CameraLayout empty(String cameraId) {
        return new CameraLayout(cameraId, List.of(), List.of());
    }

    public String cameraId() {
        return cameraId;
    }

    public Optional<Zone> zone(String zoneId) {
        return Optional.ofNullable(zones.get(zoneId));
    }

    public Optional<Line> line(String lineId) {
        return Optional.ofNullable(lines.get(lineId));
    }

    public Collection<Zone> zones() {
        return zones.values();
    }

    public Collection<Line> lines() {
        return lines.values();
    }

    /** Zones of the given type, in configuration order. */
    public List<Zone> zonesOfType(ZoneType type) {
        return zones.values().stream().filter(zone -> zone.zoneType() == type).toList();
    }

    private static <T> Map<String, T> index(
            List<T> items, Function<T, String> idOf, String kind) {
        if (items == null || items.isEmpty()) {
            return Map.of();
        }
        Map<String, T> byId = new LinkedHashMap<>();
        for (T item : items) {
            if (byId.put(idOf.apply(item), item) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " id: " + idOf.apply(item));
            }
        }
        return Collections.unmodifiableMap(byId);
    }

    @Override
    public String toString() {
        return "CameraLayout[cameraId=" + cameraId + ", zones=" + zones.size() + ", lines=" + lines.size() + "]";
    }
}
