package com.dealereye.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a {@link DomainEvent} for the fields correlation depends on.
 *
 * <p>Events arriving over a feed may have been decoded from partial JSON, so records can carry
 * nulls. All errors are collected at once in a {@link ValidationResult}.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates the header (id, timestamp, tenant and site) and the type-specific track and
     * reference identifiers.
     *
     * @param event the event to validate; null is reported as an error
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(DomainEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        var errors = new ArrayList<String>();

        requireText(event.eventId(), "eventId", errors);
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (event.source() == null) {
            errors.add("source must not be null");
        } else {
            requireText(event.source().tenantId(), "source.tenantId", errors);
            requireText(event.source().siteId(), "source.siteId", errors);
        }

        switch (event.eventType()) {
            case VEHICLE_ARRIVAL -> requireText(((DomainEvent.VehicleArrival) event).trackId(), "trackId", errors);
            case VEHICLE_EXIT -> requireText(((DomainEvent.VehicleExit) event).trackId(), "trackId", errors);
            case GREET_STARTED -> {
                var greet = (DomainEvent.GreetStarted) event;
                requireText(greet.vehicleTrackId(), "vehicleTrackId", errors);
                requireText(greet.personTrackId(), "personTrackId", errors);
            }
            case BAY_ENTRY -> requireText(((DomainEvent.BayEntry) event).trackId(), "trackId", errors);
            case BAY_EXIT -> requireText(((DomainEvent.BayExit) event).trackId(), "trackId", errors);
            case LOBBY_ENTER -> requireText(((DomainEvent.LobbyEnter) event).trackId(), "trackId", errors);
            case LOBBY_EXIT -> requireText(((DomainEvent.LobbyExit) event).trackId(), "trackId", errors);
            case ZONE_DWELL -> requireText(((DomainEvent.ZoneDwell) event).trackId(), "trackId", errors);
            case LINE_CROSSING -> requireText(((DomainEvent.LineCrossing) event).trackId(), "trackId", errors);
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static void requireText(String value, String field, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be null or blank");
        }
    }
}
