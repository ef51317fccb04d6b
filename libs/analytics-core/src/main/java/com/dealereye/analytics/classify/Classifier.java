package com.dealereye.analytics.classify;

import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.layout.Line;
import com.dealereye.analytics.track.TrackStateRegistry;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventFactory;
import com.dealereye.eventmodel.ObjectClass;
import com.dealereye.observability.AnalyticsMeters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Turns primitives into at most one typed domain event, using the semantic type of the line
 * involved. Zone entries and exits only update the registry.
 * <p>
 * A primitive that references a line or zone missing from the layout produces nothing and is
 * counted as a classification miss; processing of later primitives is unaffected.
 */
public final class Classifier {

    private static final Logger log = LoggerFactory.getLogger(Classifier.class);

    static final String MISS_UNKNOWN_LINE = "unknown_line";
    static final String MISS_UNKNOWN_ZONE = "unknown_zone";

    private final TrackStateRegistry registry;
    private final EventFactory events;
    private final AnalyticsMeters meters;

    public Classifier(TrackStateRegistry registry, EventFactory events, AnalyticsMeters meters) {
        this.registry = registry;
        this.events = events;
        this.meters = meters;
    }

    /**
     * Applies one primitive to the registry and classifies it against {@code layout}.
     *
     * @return the domain event for a recognized line crossing; empty otherwise
     */
    public Optional<DomainEvent> classify(PrimitiveEvent primitive, CameraLayout layout) {
        registry.touch(primitive.trackId(), primitive.objectClass());
        return switch (primitive.kind()) {
            case LINE_CROSSING -> onLineCrossing(primitive, layout);
            case ZONE_ENTRY -> {
                onZoneEntry(primitive, layout);
                yield Optional.empty();
            }
            case ZONE_EXIT -> {
                registry.exitZone(primitive.trackId(), primitive.referenceId());
                yield Optional.empty();
            }
        };
    }

    private Optional<DomainEvent> onLineCrossing(PrimitiveEvent primitive, CameraLayout layout) {
        Optional<Line> line = layout.line(primitive.referenceId());
        if (line.isEmpty()) {
            meters.classificationMiss(MISS_UNKNOWN_LINE);
            log.debug("Line {} is not configured; crossing by track {} ignored",
                    primitive.referenceId(), primitive.trackId());
            return Optional.empty();
        }
        registry.recordCrossing(primitive.trackId(), primitive.referenceId());

        String trackId = primitive.trackId();
        String lineId = primitive.referenceId();
        double confidence = primitive.confidence();
        // same clock as the scanner, so arrival-to-greet deltas exclude pipeline latency and skew
        Instant at = registry.clock().instant();

        DomainEvent event = switch (line.get().lineType()) {
            case ENTRY -> events.vehicleArrival(trackId, lineId, confidence, at);
            case EXIT -> events.vehicleExit(trackId, lineId, confidence, at);
            case BAY_ENTRY -> events.bayEntry(trackId, lineId, confidence, at);
            case BAY_EXIT -> events.bayExit(trackId, lineId, confidence, at);
            case DOOR -> primitive.objectClass() == ObjectClass.PERSON
                    ? doorCrossing(primitive, at)
                    : genericCrossing(primitive, at);
            case PERIMETER, CUSTOM -> genericCrossing(primitive, at);
        };
        return Optional.of(event);
    }

    private DomainEvent doorCrossing(PrimitiveEvent primitive, Instant at) {
        if (PrimitiveEvent.FORWARD.equals(primitive.direction())) {
            return events.lobbyEnter(primitive.trackId(), primitive.referenceId(), primitive.confidence(), at);
        }
        return events.lobbyExit(primitive.trackId(), primitive.referenceId(), primitive.confidence(), at);
    }

    private DomainEvent genericCrossing(PrimitiveEvent primitive, Instant at) {
        return events.lineCrossing(
                primitive.trackId(), primitive.objectClass(), primitive.referenceId(),
                primitive.direction(), primitive.confidence(), at);
    }

    private void onZoneEntry(PrimitiveEvent primitive, CameraLayout layout) {
        if (layout.zone(primitive.referenceId()).isEmpty()) {
            meters.classificationMiss(MISS_UNKNOWN_ZONE);
            log.debug("Zone {} is not configured; entry by track {} ignored",
                    primitive.referenceId(), primitive.trackId());
            return;
        }
        registry.enterZone(primitive.trackId(), primitive.referenceId());
    }
}
