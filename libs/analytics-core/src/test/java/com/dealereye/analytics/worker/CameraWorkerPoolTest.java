package com.dealereye.analytics.worker;

import static com.dealereye.analytics.testing.Layouts.line;
import static org.assertj.core.api.Assertions.assertThat;

import com.dealereye.analytics.classify.PrimitiveEvent;
import com.dealereye.analytics.classify.PrimitiveKind;
import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.layout.LineType;
import com.dealereye.analytics.scan.ScannerSettings;
import com.dealereye.analytics.testing.ManualClock;
import com.dealereye.analytics.testing.RecordingEventPublisher;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.ObjectClass;
import com.dealereye.observability.AnalyticsMeters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@DisplayName("CameraWorkerPool")
class CameraWorkerPoolTest {

    private SimpleMeterRegistry meterRegistry;
    private RecordingEventPublisher publisher;
    private CameraWorkerPool pool;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new RecordingEventPublisher();
        pool = new CameraWorkerPool("acme", "site-1", ScannerSettings.defaults(), publisher,
                new AnalyticsMeters(meterRegistry, "edge-analytics"),
                new ManualClock(Instant.parse("2026-03-02T14:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static PrimitiveEvent crossing(String cameraId, String lineId) {
        return new PrimitiveEvent("v1", PrimitiveKind.LINE_CROSSING, lineId, null, 0.9,
                ObjectClass.VEHICLE, cameraId, "site-1", "acme", null);
    }

    @Test
    @DisplayName("should route primitives to the worker of their camera")
    void routesByCamera() throws InterruptedException {
        pool.apply(new CameraLayout("cam-1", List.of(), List.of(line("entry-1", LineType.ENTRY))));
        pool.apply(new CameraLayout("cam-2", List.of(), List.of(line("exit-1", LineType.EXIT))));

        pool.submit(crossing("cam-1", "entry-1"));
        pool.submit(crossing("cam-2", "exit-1"));

        assertThat(publisher.awaitEvents(2, Duration.ofSeconds(5))).isTrue();
        assertThat(publisher.events()).extracting(event -> event.source().cameraId())
                .containsExactlyInAnyOrder("cam-1", "cam-2");
        assertThat(publisher.eventsOfType(DomainEvent.VehicleExit.class)).singleElement()
                .extracting(event -> event.source().cameraId()).isEqualTo("cam-2");
    }

    @Test
    @DisplayName("should count primitives for unknown cameras as misses")
    void unknownCamera() {
        pool.submit(crossing("cam-404", "entry-1"));

        assertThat(meterRegistry.get(AnalyticsMeters.CLASSIFIER_MISSES)
                .tag("reason", CameraWorkerPool.MISS_UNKNOWN_CAMERA).counter().count()).isEqualTo(1.0);
        assertThat(publisher.events()).isEmpty();
    }

    @Test
    @DisplayName("applying a layout twice should reload instead of starting another worker")
    void reloadsExistingWorker() throws InterruptedException {
        pool.apply(CameraLayout.empty("cam-1"));
        CameraWorker first = pool.worker("cam-1").orElseThrow();

        pool.apply(new CameraLayout("cam-1", List.of(), List.of(line("entry-1", LineType.ENTRY))));
        pool.submit(crossing("cam-1", "entry-1"));

        assertThat(pool.worker("cam-1")).containsSame(first);
        assertThat(publisher.awaitEvents(1, Duration.ofSeconds(5))).isTrue();
        assertThat(publisher.eventsOfType(DomainEvent.VehicleArrival.class)).hasSize(1);
    }

    @Test
    @DisplayName("removed cameras should no longer accept primitives")
    void removeCamera() {
        pool.apply(CameraLayout.empty("cam-1"));
        pool.remove("cam-1");

        assertThat(pool.cameraIds()).isEmpty();
        pool.submit(crossing("cam-1", "entry-1"));
        assertThat(meterRegistry.get(AnalyticsMeters.CLASSIFIER_MISSES)
                .tag("reason", CameraWorkerPool.MISS_UNKNOWN_CAMERA).counter().count()).isEqualTo(1.0);
    }
}
