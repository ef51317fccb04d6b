package com.dealereye.analytics.correlation;

import com.dealereye.eventmodel.DomainEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Correlation buffers of one site. Every access happens while holding this object's monitor.
 */
final class SiteCorrelationState {

    final ArrivalBuffer arrivals;
    private final Map<String, DomainEvent.BayEntry> openBayEntries = new LinkedHashMap<>();
    private final Duration bayEntryRetention;
    private int lobbyOccupancy;

    SiteCorrelationState(CorrelationSettings settings) {
        this.arrivals = new ArrivalBuffer(settings.arrivalRetention(), settings.arrivalCapacity());
        this.bayEntryRetention = settings.bayEntryRetention();
    }

    /** Stores the entry under its track, replacing any unmatched entry, and drops stale ones. */
    void openBay(DomainEvent.BayEntry entry) {
        openBayEntries.put(entry.trackId(), entry);
        Instant cutoff = entry.occurredAt().minus(bayEntryRetention);
        openBayEntries.values().removeIf(open -> open.occurredAt().isBefore(cutoff));
    }

    DomainEvent.BayEntry closeBay(String trackId) {
        return openBayEntries.remove(trackId);
    }

    int openBayCount() {
        return openBayEntries.size();
    }

    int enterLobby() {
        return ++lobbyOccupancy;
    }

    int exitLobby() {
        lobbyOccupancy = Math.max(0, lobbyOccupancy - 1);
        return lobbyOccupancy;
    }

    int lobbyOccupancy() {
        return lobbyOccupancy;
    }
}
