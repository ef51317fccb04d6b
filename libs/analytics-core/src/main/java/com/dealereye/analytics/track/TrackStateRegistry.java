package com.dealereye.analytics.track;

import com.dealereye.eventmodel.ObjectClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative record of the tracks one camera currently observes and the zones each occupies.
 * <p>
 * Not thread-safe. A registry is owned by exactly one camera worker, which runs primitive
 * processing and scan ticks on the same thread.
 */
public final class TrackStateRegistry {

    private static final Logger log = LoggerFactory.getLogger(TrackStateRegistry.class);

    private final String cameraId;
    private final Clock clock;
    private final Map<String, TrackedObject> tracks = new LinkedHashMap<>();

    public TrackStateRegistry(String cameraId, Clock clock) {
        if (cameraId == null || cameraId.isBlank()) {
            throw new IllegalArgumentException("cameraId must not be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.cameraId = cameraId;
        this.clock = clock;
    }

    /**
     * Creates the track if it is unseen, otherwise refreshes its last-seen time. The class
     * of an existing track is not changed.
     *
     * @return the tracked object
     */
    public TrackedObject touch(String trackId, ObjectClass objectClass) {
        Instant now = clock.instant();
        TrackedObject tracked = tracks.get(trackId);
        if (tracked == null) {
            tracked = new TrackedObject(trackId, objectClass, now);
            tracks.put(trackId, tracked);
            log.debug("New track {} ({}) on camera {}", trackId, objectClass, cameraId);
        } else {
            tracked.seen(now);
        }
        return tracked;
    }

    /**
     * Records that the track entered {@code zoneId} now. Idempotent: a second entry before an
     * exit keeps the original entry time.
     *
     * @return true if residency started with this call; false if already inside or the track is unknown
     */
    public boolean enterZone(String trackId, String zoneId) {
        TrackedObject tracked = tracks.get(trackId);
        return tracked != null && tracked.enter(zoneId, clock.instant());
    }

    /**
     * Ends residency of the track in {@code zoneId}. An exit without a matching entry is not an
     * error; upstream tracking can lose and regain a track.
     *
     * @return true if a residency record was removed
     */
    public boolean exitZone(String trackId, String zoneId) {
        TrackedObject tracked = tracks.get(trackId);
        return tracked != null && tracked.exit(zoneId);
    }

    /** Appends {@code lineId} to the track's crossed lines if it is not already there. */
    public void recordCrossing(String trackId, String lineId) {
        TrackedObject tracked = tracks.get(trackId);
        if (tracked != null) {
            tracked.crossed(lineId);
        }
    }

    /** Restarts the residency clock of a track in a zone it already occupies. */
    public void rearm(String trackId, String zoneId, Instant at) {
        TrackedObject tracked = tracks.get(trackId);
        if (tracked != null) {
            tracked.rearm(zoneId, at);
        }
    }

    /**
     * Removes every track whose last primitive is older than {@code maxAge}. A later primitive
     * for an evicted track id starts a fresh track.
     */
    public void reap(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int before = tracks.size();
        for (Iterator<TrackedObject> it = tracks.values().iterator(); it.hasNext(); ) {
            if (it.next().lastSeen().isBefore(cutoff)) {
                it.remove();
            }
        }
        if (tracks.size() < before) {
            log.debug("Reaped {} stale tracks on camera {}", before - tracks.size(), cameraId);
        }
    }

    public Optional<TrackedObject> find(String trackId) {
        return Optional.ofNullable(tracks.get(trackId));
    }

    /** Live read-only view, in creation order. */
    public Collection<TrackedObject> tracks() {
        return Collections.unmodifiableCollection(tracks.values());
    }

    public int size() {
        return tracks.size();
    }

    public String cameraId() {
        return cameraId;
    }

    public Clock clock() {
        return clock;
    }
}
