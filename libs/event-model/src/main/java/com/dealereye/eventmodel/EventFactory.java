package com.dealereye.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Creates {@link DomainEvent} instances for one camera.
 * <p>
 * Holds the tenant/site/camera identity and generates event ids, so the classifier and
 * scanner only supply what they observed.
 */
public final class EventFactory {

    /** Confidence attached to dwell events, which are derived from residency rather than a detection. */
    public static final double DWELL_CONFIDENCE = 0.9;

    /** Confidence attached to greet events. */
    public static final double GREET_CONFIDENCE = 0.85;

    private final EventSource source;

    public EventFactory(EventSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = source;
    }

    /** The identity stamped on every event from this factory. */
    public EventSource source() {
        return source;
    }

    public DomainEvent.VehicleArrival vehicleArrival(
            String trackId, String lineId, double confidence, Instant at) {
        return new DomainEvent.VehicleArrival(newId(), source, at, trackId, lineId, confidence);
    }

    public DomainEvent.VehicleExit vehicleExit(
            String trackId, String lineId, double confidence, Instant at) {
        return new DomainEvent.VehicleExit(newId(), source, at, trackId, lineId, confidence);
    }

    public DomainEvent.BayEntry bayEntry(String trackId, String bayId, double confidence, Instant at) {
        return new DomainEvent.BayEntry(newId(), source, at, trackId, bayId, confidence);
    }

    public DomainEvent.BayExit bayExit(String trackId, String bayId, double confidence, Instant at) {
        return new DomainEvent.BayExit(newId(), source, at, trackId, bayId, confidence);
    }

    public DomainEvent.LobbyEnter lobbyEnter(String trackId, String doorId, double confidence, Instant at) {
        return new DomainEvent.LobbyEnter(newId(), source, at, trackId, doorId, confidence);
    }

    public DomainEvent.LobbyExit lobbyExit(String trackId, String doorId, double confidence, Instant at) {
        return new DomainEvent.LobbyExit(newId(), source, at, trackId, doorId, confidence);
    }

    public DomainEvent.LineCrossing lineCrossing(
            String trackId, ObjectClass objectClass, String lineId,
            String direction, double confidence, Instant at) {
        return new DomainEvent.LineCrossing(
                newId(), source, at, trackId, objectClass, lineId, direction, confidence);
    }

    public DomainEvent.ZoneDwell zoneDwell(
            String trackId, ObjectClass objectClass, String zoneId, double dwellSeconds, Instant at) {
        return new DomainEvent.ZoneDwell(
                newId(), source, at, trackId, objectClass, zoneId, dwellSeconds, DWELL_CONFIDENCE);
    }

    public DomainEvent.GreetStarted greetStarted(
            String vehicleTrackId, String personTrackId, String zoneId,
            double proximitySeconds, Instant at) {
        return new DomainEvent.GreetStarted(
                newId(), source, at, vehicleTrackId, personTrackId, zoneId,
                proximitySeconds, GREET_CONFIDENCE);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
