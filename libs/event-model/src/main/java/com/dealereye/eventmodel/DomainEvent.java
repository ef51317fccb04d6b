package com.dealereye.eventmodel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Business-meaningful event derived from camera perception primitives.
 *
 * <p>The family is closed: every event type is one of the nested records below, and each record
 * reports a fixed {@link EventType}. Consumers dispatch with an exhaustive {@code switch} over
 * {@link #eventType()} so that adding a type fails compilation until every consumer handles it.
 *
 * <p>Events are immutable and are produced exactly once per triggering condition.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DomainEvent.VehicleArrival.class, name = "vehicle_arrival"),
        @JsonSubTypes.Type(value = DomainEvent.VehicleExit.class, name = "vehicle_exit"),
        @JsonSubTypes.Type(value = DomainEvent.GreetStarted.class, name = "greet_started"),
        @JsonSubTypes.Type(value = DomainEvent.BayEntry.class, name = "bay_entry"),
        @JsonSubTypes.Type(value = DomainEvent.BayExit.class, name = "bay_exit"),
        @JsonSubTypes.Type(value = DomainEvent.LobbyEnter.class, name = "lobby_enter"),
        @JsonSubTypes.Type(value = DomainEvent.LobbyExit.class, name = "lobby_exit"),
        @JsonSubTypes.Type(value = DomainEvent.ZoneDwell.class, name = "zone_dwell"),
        @JsonSubTypes.Type(value = DomainEvent.LineCrossing.class, name = "line_crossing")
})
public sealed interface DomainEvent {

    /** Unique identifier for this event instance (UUID v4). */
    String eventId();

    /** Tenant, site and camera that produced the event. */
    EventSource source();

    /** When the triggering condition was observed. */
    Instant occurredAt();

    /** The fixed type of this record. */
    EventType eventType();

    /** Vehicle crosses the entry line into the service lane. */
    record VehicleArrival(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, String lineId, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.VEHICLE_ARRIVAL;
        }
    }

    /** Vehicle crosses the exit line out of the service lane. */
    record VehicleExit(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, String lineId, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.VEHICLE_EXIT;
        }
    }

    /**
     * A person and a vehicle have both been resident in a greet zone.
     *
     * @param proximitySeconds the shorter of the two residencies at the time of the scan
     */
    record GreetStarted(
            String eventId, EventSource source, Instant occurredAt,
            String vehicleTrackId, String personTrackId, String zoneId,
            double proximitySeconds, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.GREET_STARTED;
        }
    }

    /** Vehicle enters a service bay. The bay is identified by its entry line. */
    record BayEntry(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, String bayId, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.BAY_ENTRY;
        }
    }

    /** Vehicle leaves a service bay. */
    record BayExit(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, String bayId, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.BAY_EXIT;
        }
    }

    /** Person crosses a lobby door line in its forward direction. */
    record LobbyEnter(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, String doorId, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.LOBBY_ENTER;
        }
    }

    /** Person crosses a lobby door line in any other direction. */
    record LobbyExit(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, String doorId, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.LOBBY_EXIT;
        }
    }

    /** An object stayed in a zone for at least the zone's dwell threshold. */
    record ZoneDwell(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, ObjectClass objectClass, String zoneId,
            double dwellSeconds, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.ZONE_DWELL;
        }
    }

    /** Crossing of a line with no more specific meaning. Direction is passed through verbatim. */
    record LineCrossing(
            String eventId, EventSource source, Instant occurredAt,
            String trackId, ObjectClass objectClass, String lineId,
            String direction, double confidence) implements DomainEvent {

        @Override
        public EventType eventType() {
            return EventType.LINE_CROSSING;
        }
    }
}
