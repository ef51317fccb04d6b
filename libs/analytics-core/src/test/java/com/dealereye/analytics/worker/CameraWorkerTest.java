package com.dealereye.analytics.worker;

import static com.dealereye.analytics.testing.Layouts.line;
import static com.dealereye.analytics.testing.Layouts.zone;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dealereye.analytics.classify.PrimitiveEvent;
import com.dealereye.analytics.classify.PrimitiveKind;
import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.layout.LineType;
import com.dealereye.analytics.layout.ZoneType;
import com.dealereye.analytics.scan.ScannerSettings;
import com.dealereye.analytics.testing.ManualClock;
import com.dealereye.analytics.testing.RecordingEventPublisher;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventSource;
import com.dealereye.eventmodel.ObjectClass;
import com.dealereye.observability.AnalyticsMeters;
import com.dealereye.observability.CameraContext;
import com.dealereye.observability.CameraContextHolder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@DisplayName("CameraWorker")
class CameraWorkerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T14:00:00Z");
    private static final EventSource SOURCE = new EventSource("acme", "site-1", "cam-1");

    private final CameraLayout layout = new CameraLayout("cam-1",
            List.of(zone("greet-a", ZoneType.GREET_ZONE, 30.0)),
            List.of(line("entry-1", LineType.ENTRY)));

    private ManualClock clock;
    private SimpleMeterRegistry meterRegistry;
    private AnalyticsMeters meters;
    private RecordingEventPublisher publisher;
    private CameraWorker worker;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        meters = new AnalyticsMeters(meterRegistry, "edge-analytics");
        publisher = new RecordingEventPublisher();
        worker = new CameraWorker(SOURCE, layout, new ScannerSettings(
                Duration.ofMillis(20), null, Duration.ofSeconds(2), Duration.ofSeconds(60)),
                publisher, meters, clock);
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    private static PrimitiveEvent primitive(String trackId, PrimitiveKind kind, String referenceId, ObjectClass cls) {
        return new PrimitiveEvent(trackId, kind, referenceId, null, 0.9, cls, "cam-1", "site-1", "acme", null);
    }

    @Nested
    @DisplayName("Processing on the calling thread")
    class Synchronous {

        @Test
        @DisplayName("should publish classified events and track active count")
        void publishesClassifiedEvents() {
            worker.process(primitive("v1", PrimitiveKind.LINE_CROSSING, "entry-1", ObjectClass.VEHICLE));

            assertThat(publisher.eventsOfType(DomainEvent.VehicleArrival.class)).hasSize(1);
            assertThat(meterRegistry.get(AnalyticsMeters.EVENTS_EMITTED).tag("type", "vehicle_arrival")
                    .counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get(AnalyticsMeters.TRACKS_ACTIVE).tag("camera", "cam-1")
                    .gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should drop malformed primitives and count them")
        void dropsMalformed() {
            worker.process(primitive(" ", PrimitiveKind.ZONE_ENTRY, "greet-a", ObjectClass.PERSON));
            worker.process(null);

            assertThat(worker.registry().size()).isZero();
            assertThat(meterRegistry.get(AnalyticsMeters.EVENTS_MALFORMED).tag("stage", "primitive")
                    .counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("tick should emit greets for tracks that met in a greet zone")
        void tickEmitsGreets() {
            worker.process(primitive("v1", PrimitiveKind.ZONE_ENTRY, "greet-a", ObjectClass.VEHICLE));
            worker.process(primitive("p1", PrimitiveKind.ZONE_ENTRY, "greet-a", ObjectClass.PERSON));
            clock.advanceSeconds(3);

            worker.tick();

            assertThat(publisher.eventsOfType(DomainEvent.GreetStarted.class))
                    .singleElement()
                    .satisfies(greet -> assertThat(greet.source()).isEqualTo(SOURCE));
        }

        @Test
        @DisplayName("a failing publish should cost only that event of the tick")
        void tickIsolatesPublisherFailure() {
            List<DomainEvent> delivered = new ArrayList<>();
            AtomicBoolean rejected = new AtomicBoolean();
            CameraWorker flaky = new CameraWorker(SOURCE, layout, ScannerSettings.defaults(), event -> {
                if (rejected.compareAndSet(false, true)) {
                    throw new IllegalStateException("broker unavailable");
                }
                delivered.add(event);
            }, meters, clock);
            flaky.process(primitive("v1", PrimitiveKind.ZONE_ENTRY, "greet-a", ObjectClass.VEHICLE));
            flaky.process(primitive("p1", PrimitiveKind.ZONE_ENTRY, "greet-a", ObjectClass.PERSON));
            flaky.process(primitive("p2", PrimitiveKind.ZONE_ENTRY, "greet-a", ObjectClass.PERSON));
            clock.advanceSeconds(5);

            assertThatCode(flaky::tick).doesNotThrowAnyException();

            assertThat(delivered).singleElement().isInstanceOf(DomainEvent.GreetStarted.class);
            assertThat(meterRegistry.get(AnalyticsMeters.PUBLISH_FAILURES)
                    .tag("target", CameraWorker.PUBLISH_TARGET).counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get(AnalyticsMeters.EVENTS_EMITTED).tag("type", "greet_started")
                    .counter().count()).isEqualTo(2.0);
            flaky.close();
        }

        @Test
        @DisplayName("a failing publish should still refresh the active tracks gauge")
        void processCountsPublisherFailure() {
            CameraWorker failing = new CameraWorker(SOURCE, layout, ScannerSettings.defaults(), event -> {
                throw new IllegalStateException("broker unavailable");
            }, meters, clock);

            assertThatCode(() -> failing.process(
                    primitive("v1", PrimitiveKind.LINE_CROSSING, "entry-1", ObjectClass.VEHICLE)))
                    .doesNotThrowAnyException();

            assertThat(meterRegistry.get(AnalyticsMeters.PUBLISH_FAILURES)
                    .tag("target", CameraWorker.PUBLISH_TARGET).counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get(AnalyticsMeters.TRACKS_ACTIVE).tag("camera", "cam-1")
                    .gauge().value()).isEqualTo(1.0);
            failing.close();
        }
    }

    @Test
    @DisplayName("submitted primitives should survive a throwing publisher")
    void submitSurvivesPublisherFailure() throws InterruptedException {
        CountDownLatch secondDelivered = new CountDownLatch(1);
        CameraWorker async = new CameraWorker(SOURCE, layout, ScannerSettings.defaults(), event -> {
            DomainEvent.VehicleArrival arrival = (DomainEvent.VehicleArrival) event;
            if (arrival.trackId().equals("v1")) {
                throw new IllegalStateException("broker unavailable");
            }
            secondDelivered.countDown();
        }, meters, clock);
        try {
            async.submit(primitive("v1", PrimitiveKind.LINE_CROSSING, "entry-1", ObjectClass.VEHICLE));
            async.submit(primitive("v2", PrimitiveKind.LINE_CROSSING, "entry-1", ObjectClass.VEHICLE));

            // primitives run in order on one thread, so v1 is fully handled once v2 is published
            assertThat(secondDelivered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(meterRegistry.get(AnalyticsMeters.PUBLISH_FAILURES)
                    .tag("target", CameraWorker.PUBLISH_TARGET).counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get(AnalyticsMeters.TRACKS_ACTIVE).tag("camera", "cam-1")
                    .gauge().value()).isGreaterThanOrEqualTo(1.0);
        } finally {
            async.close();
        }
    }

    @Test
    @DisplayName("should reject a layout of another camera")
    void rejectsForeignLayout() {
        assertThatThrownBy(() -> worker.reload(CameraLayout.empty("cam-2")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("submitted primitives should be processed on the worker thread with camera MDC")
    void processesOnWorkerThread() throws InterruptedException {
        CountDownLatch published = new CountDownLatch(1);
        AtomicReference<String> thread = new AtomicReference<>();
        AtomicReference<String> mdcCamera = new AtomicReference<>();
        AtomicReference<CameraContext> context = new AtomicReference<>();
        CameraWorker async = new CameraWorker(SOURCE, layout, ScannerSettings.defaults(), event -> {
            thread.set(Thread.currentThread().getName());
            mdcCamera.set(MDC.get(CameraContext.MDC_CAMERA_ID));
            context.set(CameraContextHolder.get().orElse(null));
            published.countDown();
        }, meters, clock);
        try {
            async.start();
            async.submit(primitive("v1", PrimitiveKind.LINE_CROSSING, "entry-1", ObjectClass.VEHICLE));

            assertThat(published.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(thread.get()).isEqualTo("camera-cam-1");
            assertThat(mdcCamera.get()).isEqualTo("cam-1");
            assertThat(context.get().siteId()).isEqualTo("site-1");
        } finally {
            async.close();
        }
    }
}
