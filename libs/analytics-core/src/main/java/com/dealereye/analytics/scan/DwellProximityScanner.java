package com.dealereye.analytics.scan;

import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.layout.Zone;
import com.dealereye.analytics.layout.ZoneType;
import com.dealereye.analytics.track.TrackStateRegistry;
import com.dealereye.analytics.track.TrackedObject;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventFactory;
import com.dealereye.eventmodel.ObjectClass;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Periodic sweep over a camera's registry that fires dwell and greet events whether or not
 * new primitives arrive.
 * <p>
 * Runs on the camera worker thread that owns the registry.
 */
public final class DwellProximityScanner {

    private final TrackStateRegistry registry;
    private final EventFactory events;
    private final ScannerSettings settings;
    private final Clock clock;

    public DwellProximityScanner(
            TrackStateRegistry registry, EventFactory events, ScannerSettings settings, Clock clock) {
        this.registry = registry;
        this.events = events;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * One scan tick: dwell check, then greet check, then stale-track eviction. Eviction is part
     * of every tick so registry size stays bounded.
     */
    public List<DomainEvent> scan(CameraLayout layout) {
        List<DomainEvent> emitted = new ArrayList<>(checkDwell(layout));
        emitted.addAll(checkGreetProximity(layout));
        registry.reap(settings.maxTrackAge());
        return emitted;
    }

    /**
     * Emits a dwell event for every (track, zone) residency that reached the zone's threshold and
     * restarts that residency's clock, so a pair fires at most once per threshold interval.
     */
    public List<DomainEvent.ZoneDwell> checkDwell(CameraLayout layout) {
        Instant now = clock.instant();
        List<DomainEvent.ZoneDwell> emitted = new ArrayList<>();
        for (TrackedObject tracked : registry.tracks()) {
            for (Map.Entry<String, Instant> residency : tracked.zoneEntryTimes().entrySet()) {
                Zone zone = layout.zone(residency.getKey()).orElse(null);
                if (zone == null) {
                    continue;
                }
                Duration dwell = Duration.between(residency.getValue(), now);
                if (dwell.compareTo(zone.dwellThreshold(settings.defaultDwellThreshold())) >= 0) {
                    emitted.add(events.zoneDwell(
                            tracked.trackId(), tracked.objectClass(), zone.zoneId(), seconds(dwell), now));
                }
            }
        }
        // re-arm after the sweep; the residency views are live
        for (DomainEvent.ZoneDwell dwell : emitted) {
            registry.rearm(dwell.trackId(), dwell.zoneId(), now);
        }
        return emitted;
    }

    /**
     * Emits a greet for every (vehicle, person) pair resident in the same greet zone whose shorter
     * residency is at least the greet proximity. Every pair fires; there is no exclusive pairing.
     */
    public List<DomainEvent.GreetStarted> checkGreetProximity(CameraLayout layout) {
        Instant now = clock.instant();
        List<DomainEvent.GreetStarted> emitted = new ArrayList<>();
        for (Zone zone : layout.zonesOfType(ZoneType.GREET_ZONE)) {
            List<TrackedObject> vehicles = new ArrayList<>();
            List<TrackedObject> persons = new ArrayList<>();
            for (TrackedObject tracked : registry.tracks()) {
                if (!tracked.isIn(zone.zoneId())) {
                    continue;
                }
                if (tracked.objectClass() == ObjectClass.VEHICLE) {
                    vehicles.add(tracked);
                } else if (tracked.objectClass() == ObjectClass.PERSON) {
                    persons.add(tracked);
                }
            }

            for (TrackedObject vehicle : vehicles) {
                Duration vehicleDwell = Duration.between(vehicle.zoneEntryTimes().get(zone.zoneId()), now);
                for (TrackedObject person : persons) {
                    Duration personDwell = Duration.between(person.zoneEntryTimes().get(zone.zoneId()), now);
                    Duration proximity = vehicleDwell.compareTo(personDwell) <= 0 ? vehicleDwell : personDwell;
                    if (proximity.compareTo(settings.greetProximity()) >= 0) {
                        emitted.add(events.greetStarted(
                                vehicle.trackId(), person.trackId(), zone.zoneId(), seconds(proximity), now));
                    }
                }
            }
        }
        return emitted;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
