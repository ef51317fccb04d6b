package com.dealereye.analytics.track;

import com.dealereye.eventmodel.ObjectClass;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one track on one camera while it is under observation.
 * <p>
 * A zone id present in {@link #zoneEntryTimes()} means the object is currently inside that
 * zone. Mutation goes through {@link TrackStateRegistry}; callers see read-only views.
 */
public final class TrackedObject {

    private final String trackId;
    private final ObjectClass objectClass;
    private final Instant firstSeen;
    private Instant lastSeen;
    private final Map<String, Instant> zoneEntryTimes = new LinkedHashMap<>();
    private final Set<String> linesCrossed = new LinkedHashSet<>();

    TrackedObject(String trackId, ObjectClass objectClass, Instant seenAt) {
        this.trackId = trackId;
        this.objectClass = objectClass;
        this.firstSeen = seenAt;
        this.lastSeen = seenAt;
    }

    public String trackId() {
        return trackId;
    }

    /** Class reported when the track was first seen. */
    public ObjectClass objectClass() {
        return objectClass;
    }

    public Instant firstSeen() {
        return firstSeen;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    /** Zones currently occupied, mapped to the time residency started (or was last re-armed). */
    public Map<String, Instant> zoneEntryTimes() {
        return Collections.unmodifiableMap(zoneEntryTimes);
    }

    /** Entry time for {@code zoneId}, empty if the object is not inside it. */
    public Optional<Instant> entryTime(String zoneId) {
        return Optional.ofNullable(zoneEntryTimes.get(zoneId));
    }

    public boolean isIn(String zoneId) {
        return zoneEntryTimes.containsKey(zoneId);
    }

    /** Lines crossed, in first-crossing order. */
    public Set<String> linesCrossed() {
        return Collections.unmodifiableSet(linesCrossed);
    }

    void seen(Instant at) {
        lastSeen = at;
    }

    boolean enter(String zoneId, Instant at) {
        return zoneEntryTimes.putIfAbsent(zoneId, at) == null;
    }

    boolean exit(String zoneId) {
        return zoneEntryTimes.remove(zoneId) != null;
    }

    void rearm(String zoneId, Instant at) {
        zoneEntryTimes.replace(zoneId, at);
    }

    void crossed(String lineId) {
        linesCrossed.add(lineId);
    }

    @Override
    public String toString() {
        return "TrackedObject[trackId=" + trackId + ", class=" + objectClass
                + ", zones=" + zoneEntryTimes.keySet() + "]";
    }
}
