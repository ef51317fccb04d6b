package com.dealereye.analytics.correlation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Vehicle arrivals of one site, indexed by arrival time.
 * <p>
 * Bounded by age and by count; both bounds are enforced on every {@link #add}. Not
 * thread-safe; guarded by the owning site's lock.
 */
final class ArrivalBuffer {

    private final NavigableMap<Instant, List<String>> byTime = new TreeMap<>();
    private final Duration retention;
    private final int capacity;
    private int size;

    ArrivalBuffer(Duration retention, int capacity) {
        this.retention = retention;
        this.capacity = capacity;
    }

    /**
     * Buffers an arrival, then drops everything at or before {@code newest - retention} and, if
     * still over capacity, the oldest arrivals.
     */
    void add(String trackId, Instant at) {
        byTime.computeIfAbsent(at, key -> new ArrayList<>(1)).add(trackId);
        size++;

        Instant cutoff = byTime.lastKey().minus(retention);
        NavigableMap<Instant, List<String>> expired = byTime.headMap(cutoff, true);
        for (List<String> tracks : expired.values()) {
            size -= tracks.size();
        }
        expired.clear();

        while (size > capacity) {
            Map.Entry<Instant, List<String>> oldest = byTime.firstEntry();
            oldest.getValue().remove(0);
            size--;
            if (oldest.getValue().isEmpty()) {
                byTime.remove(oldest.getKey());
            }
        }
    }

    /**
     * Latest arrival of {@code trackId} strictly before {@code at} and strictly less than
     * {@code window} earlier; that is the candidate with the smallest positive delta.
     */
    Optional<Instant> nearestBefore(String trackId, Instant at, Duration window) {
        NavigableMap<Instant, List<String>> candidates =
                byTime.subMap(at.minus(window), false, at, false).descendingMap();
        for (Map.Entry<Instant, List<String>> entry : candidates.entrySet()) {
            if (entry.getValue().contains(trackId)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /** Number of distinct tracks that arrived within {@code [start, end]}. */
    int distinctTracks(Instant start, Instant end) {
        Set<String> tracks = new HashSet<>();
        for (List<String> arrivals : byTime.subMap(start, true, end, true).values()) {
            tracks.addAll(arrivals);
        }
        return tracks.size();
    }

    int size() {
        return size;
    }
}
