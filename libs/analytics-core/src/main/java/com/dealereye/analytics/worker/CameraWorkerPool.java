package com.dealereye.analytics.worker;

import com.dealereye.analytics.classify.PrimitiveEvent;
import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.scan.ScannerSettings;
import com.dealereye.analytics.sink.EventPublisher;
import com.dealereye.eventmodel.EventSource;
import com.dealereye.observability.AnalyticsMeters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CameraWorker} per configured camera of a site, with primitives routed by camera id.
 * <p>
 * Cameras share nothing but the downstream publisher, so they run fully in parallel.
 */
public final class CameraWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CameraWorkerPool.class);

    static final String MISS_UNKNOWN_CAMERA = "unknown_camera";

    private final String tenantId;
    private final String siteId;
    private final ScannerSettings settings;
    private final EventPublisher publisher;
    private final AnalyticsMeters meters;
    private final Clock clock;
    private final Map<String, CameraWorker> workers = new ConcurrentHashMap<>();

    public CameraWorkerPool(
            String tenantId,
            String siteId,
            ScannerSettings settings,
            EventPublisher publisher,
            AnalyticsMeters meters,
            Clock clock) {
        this.tenantId = tenantId;
        this.siteId = siteId;
        this.settings = settings;
        this.publisher = publisher;
        this.meters = meters;
        this.clock = clock;
    }

    /**
     * Starts a worker for a camera not seen before, or reloads the layout of a running one.
     */
    public void apply(CameraLayout layout) {
        workers.compute(layout.cameraId(), (cameraId, existing) -> {
            if (existing != null) {
                existing.reload(layout);
                return existing;
            }
            CameraWorker worker = new CameraWorker(
                    new EventSource(tenantId, siteId, cameraId), layout, settings, publisher, meters, clock);
            worker.start();
            return worker;
        });
    }

    /** Stops and forgets the worker of a camera that was removed from configuration. */
    public void remove(String cameraId) {
        CameraWorker worker = workers.remove(cameraId);
        if (worker != null) {
            worker.close();
        }
    }

    /**
     * Routes a primitive to its camera's worker. Primitives for cameras without a worker are
     * counted as configuration misses.
     */
    public void submit(PrimitiveEvent primitive) {
        String cameraId = primitive == null ? null : primitive.cameraId();
        CameraWorker worker = cameraId == null ? null : workers.get(cameraId);
        if (worker == null) {
            meters.classificationMiss(MISS_UNKNOWN_CAMERA);
            log.debug("No worker for camera {}; primitive dropped", cameraId);
            return;
        }
        worker.submit(primitive);
    }

    public Optional<CameraWorker> worker(String cameraId) {
        return Optional.ofNullable(workers.get(cameraId));
    }

    public Collection<String> cameraIds() {
        return Collections.unmodifiableSet(workers.keySet());
    }

    @Override
    public void close() {
        workers.values().forEach(CameraWorker::close);
        workers.clear();
    }
}
