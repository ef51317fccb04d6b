package com.dealereye.analytics.correlation;

import com.dealereye.analytics.sink.EventPublisher;
import com.dealereye.analytics.sink.MetricSink;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventValidator;
import com.dealereye.eventmodel.ValidationResult;
import com.dealereye.eventmodel.metric.MetricName;
import com.dealereye.eventmodel.metric.MetricValue;
import com.dealereye.eventmodel.metric.WindowSize;
import com.dealereye.observability.AnalyticsMeters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives metrics by correlating domain events across time and cameras, per site.
 * <p>
 * Computes time-to-greet (arrival matched to greet), rack time (bay entry matched to bay exit),
 * lobby occupancy (running count of door crossings) and, on demand, drive throughput (distinct
 * arrivals in a range). Each site's buffers are guarded by one lock; sites are independent.
 * <p>
 * Unmatched greets and bay exits are normal under churn and only counted. Events missing a
 * timestamp, tenant or site are dropped with a warning. No input makes the engine throw.
 */
public final class MetricsCorrelationEngine implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(MetricsCorrelationEngine.class);

    static final String UNMATCHED_GREET = "greet";
    static final String UNMATCHED_BAY_EXIT = "bay_exit";

    private final CorrelationSettings settings;
    private final MetricSink sink;
    private final AnalyticsMeters meters;
    private final Map<String, SiteCorrelationState> sites = new ConcurrentHashMap<>();

    public MetricsCorrelationEngine(CorrelationSettings settings, MetricSink sink, AnalyticsMeters meters) {
        this.settings = settings;
        this.sink = sink;
        this.meters = meters;
    }

    /** Same as {@link #process(DomainEvent)}; lets the engine sit behind a publisher fan-out. */
    @Override
    public void publish(DomainEvent event) {
        process(event);
    }

    /**
     * Correlates one event with the site's buffers and hands every resulting metric to the sink.
     *
     * @return the metrics computed from this event, possibly none
     */
    public List<MetricValue> process(DomainEvent event) {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            meters.malformedEvent("correlation");
            log.warn("Skipping malformed {} event {}: {}",
                    event == null ? "null" : event.eventType().value(),
                    event == null ? null : event.eventId(),
                    validation.errors());
            return List.of();
        }

        SiteCorrelationState state = sites.computeIfAbsent(
                event.source().siteId(), siteId -> new SiteCorrelationState(settings));
        List<MetricValue> metrics;
        synchronized (state) {
            metrics = switch (event.eventType()) {
                case VEHICLE_ARRIVAL -> onVehicleArrival(state, (DomainEvent.VehicleArrival) event);
                case GREET_STARTED -> onGreetStarted(state, (DomainEvent.GreetStarted) event);
                case BAY_ENTRY -> onBayEntry(state, (DomainEvent.BayEntry) event);
                case BAY_EXIT -> onBayExit(state, (DomainEvent.BayExit) event);
                case LOBBY_ENTER -> lobbySample(event, ((DomainEvent.LobbyEnter) event).doorId(), state.enterLobby());
                case LOBBY_EXIT -> lobbySample(event, ((DomainEvent.LobbyExit) event).doorId(), state.exitLobby());
                case VEHICLE_EXIT, ZONE_DWELL, LINE_CROSSING -> List.of();
            };
        }

        for (MetricValue metric : metrics) {
            deliver(metric);
        }
        return metrics;
    }

    /**
     * Number of distinct vehicle tracks among buffered arrivals of a site within
     * {@code [start, end]}. Only arrivals still inside the retention horizon are counted.
     */
    public int computeThroughput(String siteId, Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        SiteCorrelationState state = sites.get(siteId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.arrivals.distinctTracks(start, end);
        }
    }

    /**
     * Computes drive throughput for a range and records it as a metric value.
     */
    public MetricValue sampleThroughput(String tenantId, String siteId, Instant start, Instant end) {
        int count = computeThroughput(siteId, start, end);
        MetricValue metric = new MetricValue(
                UUID.randomUUID().toString(), tenantId, siteId, MetricName.DRIVE_THROUGHPUT,
                start, WindowSize.covering(Duration.between(start, end)), count,
                MetricName.DRIVE_THROUGHPUT.unit(), Map.of(), false);
        deliver(metric);
        return metric;
    }

    /** Current lobby headcount of a site; zero for a site with no lobby events yet. */
    public int lobbyOccupancy(String siteId) {
        SiteCorrelationState state = sites.get(siteId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.lobbyOccupancy();
        }
    }

    private List<MetricValue> onVehicleArrival(SiteCorrelationState state, DomainEvent.VehicleArrival arrival) {
        state.arrivals.add(arrival.trackId(), arrival.occurredAt());
        return List.of();
    }

    private List<MetricValue> onGreetStarted(SiteCorrelationState state, DomainEvent.GreetStarted greet) {
        Optional<Instant> arrival = state.arrivals.nearestBefore(
                greet.vehicleTrackId(), greet.occurredAt(), settings.ttgMatchWindow());
        if (arrival.isEmpty()) {
            meters.unmatchedCorrelation(UNMATCHED_GREET);
            log.debug("No arrival within {} for greet {} of vehicle {}",
                    settings.ttgMatchWindow(), greet.eventId(), greet.vehicleTrackId());
            return List.of();
        }

        double ttgSeconds = seconds(Duration.between(arrival.get(), greet.occurredAt()));
        log.info("TTG computed: {}s for site {}", String.format("%.1f", ttgSeconds), greet.source().siteId());
        return List.of(metric(greet, MetricName.TIME_TO_GREET, ttgSeconds,
                dimensions("camera_id", greet.source().cameraId(), "zone_id", greet.zoneId()), false));
    }

    private List<MetricValue> onBayEntry(SiteCorrelationState state, DomainEvent.BayEntry entry) {
        state.openBay(entry);
        return List.of();
    }

    private List<MetricValue> onBayExit(SiteCorrelationState state, DomainEvent.BayExit exit) {
        DomainEvent.BayEntry entry = state.closeBay(exit.trackId());
        if (entry == null) {
            meters.unmatchedCorrelation(UNMATCHED_BAY_EXIT);
            log.warn("No bay entry found for track {} leaving bay {}", exit.trackId(), exit.bayId());
            return List.of();
        }
        Duration rack = Duration.between(entry.occurredAt(), exit.occurredAt());
        if (rack.isNegative()) {
            meters.unmatchedCorrelation(UNMATCHED_BAY_EXIT);
            log.warn("Bay exit {} of track {} precedes its entry {}; discarded",
                    exit.eventId(), exit.trackId(), entry.eventId());
            return List.of();
        }

        double rackSeconds = seconds(rack);
        log.info("Rack time computed: {}s for site {}", String.format("%.1f", rackSeconds), exit.source().siteId());
        // estimated until corroborated by a service-order system
        return List.of(metric(exit, MetricName.RACK_TIME, rackSeconds, dimensions("bay_id", exit.bayId()), true));
    }

    private List<MetricValue> lobbySample(DomainEvent event, String doorId, int occupancy) {
        return List.of(metric(event, MetricName.LOBBY_OCCUPANCY, occupancy, dimensions("door_id", doorId), false));
    }

    private void deliver(MetricValue metric) {
        meters.metricComputed(metric.metricName().value());
        try {
            sink.record(metric);
        } catch (RuntimeException e) {
            meters.publishFailure("metric_sink");
            log.warn("Metric sink rejected {} {}: {}", metric.metricName().value(), metric.metricId(), e.getMessage(), e);
        }
    }

    private static MetricValue metric(
            DomainEvent trigger, MetricName name, double value, Map<String, String> dimensions, boolean estimated) {
        return new MetricValue(
                trigger.eventId(), trigger.source().tenantId(), trigger.source().siteId(), name,
                trigger.occurredAt(), WindowSize.ONE_MINUTE, value, name.unit(), dimensions, estimated);
    }

    /** Key/value pairs with null values left out. */
    private static Map<String, String> dimensions(String... keyValues) {
        Map<String, String> dims = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                dims.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return dims;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
