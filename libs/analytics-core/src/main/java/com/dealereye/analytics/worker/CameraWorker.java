package com.dealereye.analytics.worker;

import com.dealereye.analytics.classify.Classifier;
import com.dealereye.analytics.classify.PrimitiveEvent;
import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.scan.DwellProximityScanner;
import com.dealereye.analytics.scan.ScannerSettings;
import com.dealereye.analytics.sink.EventPublisher;
import com.dealereye.analytics.track.TrackStateRegistry;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventFactory;
import com.dealereye.eventmodel.EventSource;
import com.dealereye.eventmodel.ValidationResult;
import com.dealereye.observability.AnalyticsMeters;
import com.dealereye.observability.CameraContext;
import com.dealereye.observability.CameraContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the registry, classifier and scanner of one camera and serializes all work on them
 * through a single thread.
 * <p>
 * Primitives and scan ticks are queued onto that thread, so the registry is never touched
 * concurrently and {@link #submit(PrimitiveEvent)} never blocks the perception pipeline.
 * Shutdown discards queued work; no state is flushed.
 */
public final class CameraWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CameraWorker.class);

    static final String PUBLISH_TARGET = "worker";

    private final CameraContext context;
    private final TrackStateRegistry registry;
    private final Classifier classifier;
    private final DwellProximityScanner scanner;
    private final ScannerSettings settings;
    private final EventPublisher publisher;
    private final AnalyticsMeters meters;
    private final AtomicLong activeTracks;
    private final ScheduledExecutorService executor;

    private CameraLayout layout;

    public CameraWorker(
            EventSource source,
            CameraLayout layout,
            ScannerSettings settings,
            EventPublisher publisher,
            AnalyticsMeters meters,
            Clock clock) {
        if (!source.cameraId().equals(layout.cameraId())) {
            throw new IllegalArgumentException(
                    "Layout for camera " + layout.cameraId() + " given to worker for " + source.cameraId());
        }
        EventFactory events = new EventFactory(source);
        this.context = new CameraContext(source.tenantId(), source.siteId(), source.cameraId());
        this.registry = new TrackStateRegistry(source.cameraId(), clock);
        this.classifier = new Classifier(registry, events, meters);
        this.scanner = new DwellProximityScanner(registry, events, settings, clock);
        this.settings = settings;
        this.publisher = publisher;
        this.meters = meters;
        this.activeTracks = meters.activeTracks(source.cameraId());
        this.layout = layout;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "camera-" + source.cameraId());
            thread.setDaemon(true);
            return thread;
        });
    }

    /** Starts the periodic scan. */
    public void start() {
        long periodMs = settings.scanInterval().toMillis();
        executor.scheduleAtFixedRate(() -> inContext(this::tick), periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Camera worker {} started: {}, scan every {} ms", context.cameraId(), layout, periodMs);
    }

    /**
     * Queues a primitive for processing and returns immediately. Primitives are processed
     * strictly in submission order.
     */
    public void submit(PrimitiveEvent primitive) {
        enqueue(() -> process(primitive));
    }

    /** Replaces the camera's zones and lines. Takes effect after already queued primitives. */
    public void reload(CameraLayout newLayout) {
        if (!context.cameraId().equals(newLayout.cameraId())) {
            throw new IllegalArgumentException(
                    "Layout for camera " + newLayout.cameraId() + " given to worker for " + context.cameraId());
        }
        enqueue(() -> {
            layout = newLayout;
            log.info("Layout reloaded: {}", newLayout);
        });
    }

    /** Applies one primitive on the calling thread. */
    void process(PrimitiveEvent primitive) {
        ValidationResult validation = primitive == null
                ? ValidationResult.fail(List.of("primitive must not be null"))
                : primitive.validate();
        if (!validation.valid()) {
            meters.malformedEvent("primitive");
            log.warn("Dropping malformed primitive: {}", validation.errors());
            return;
        }
        try {
            classifier.classify(primitive, layout).ifPresent(this::emit);
        } catch (RuntimeException e) {
            // queued tasks have no reader for their future; log here or lose it
            log.error("Processing primitive of track {} failed on camera {}",
                    primitive.trackId(), context.cameraId(), e);
        } finally {
            activeTracks.set(registry.size());
        }
    }

    /** Runs one scan tick on the calling thread. */
    void tick() {
        try {
            for (DomainEvent event : scanner.scan(layout)) {
                emit(event);
            }
        } catch (RuntimeException e) {
            // an exception escaping a fixed-rate task cancels all later ticks
            log.error("Scan tick failed on camera {}", context.cameraId(), e);
        } finally {
            activeTracks.set(registry.size());
        }
    }

    /** Hands one event downstream; a failing publisher costs only this event. */
    private void emit(DomainEvent event) {
        meters.eventEmitted(event.eventType().value());
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            meters.publishFailure(PUBLISH_TARGET);
            log.warn("Publishing {} event {} failed on camera {}: {}",
                    event.eventType().value(), event.eventId(), context.cameraId(), e.getMessage(), e);
        }
    }

    private void enqueue(Runnable task) {
        try {
            executor.execute(() -> inContext(task));
        } catch (RejectedExecutionException e) {
            log.debug("Camera worker {} is stopped; task dropped", context.cameraId(), e);
        }
    }

    private void inContext(Runnable task) {
        CameraContextHolder.runWithContext(context, task);
    }

    TrackStateRegistry registry() {
        return registry;
    }

    public String cameraId() {
        return context.cameraId();
    }

    /** Stops ticks and discards queued primitives. */
    @Override
    public void close() {
        executor.shutdownNow();
        log.info("Camera worker {} stopped", context.cameraId());
    }
}
