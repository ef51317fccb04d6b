package com.dealereye.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dealereye.eventmodel.metric.MetricName;
import com.dealereye.eventmodel.metric.MetricValue;
import com.dealereye.eventmodel.metric.WindowSize;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private static final EventSource SOURCE = new EventSource("tenant-1", "site-1", "cam-1");
    private static final Instant AT = Instant.parse("2026-03-02T14:00:00Z");

    private final EventFactory factory = new EventFactory(SOURCE);

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("writes the event_type discriminator and snake_case fields")
        void discriminatorAndNaming() {
            var json = EventSerializer.serialize(factory.greetStarted("9", "4", "zone-1", 1.5, AT));

            assertThat(json)
                    .contains("\"event_type\":\"greet_started\"")
                    .contains("\"vehicle_track_id\":\"9\"")
                    .contains("\"person_track_id\":\"4\"")
                    .contains("\"site_id\":\"site-1\"");
        }

        @Test
        @DisplayName("serializes Instant as ISO 8601 string")
        void instantAsIso8601() {
            var json = EventSerializer.serialize(factory.bayEntry("7", "bay-1", 0.9, AT));
            assertThat(json).contains("\"occurred_at\":\"2026-03-02T14:00:00Z\"");
        }

        @Test
        @DisplayName("writes object class by its detector label")
        void objectClassLabel() {
            var json = EventSerializer.serialize(
                    factory.lineCrossing("3", ObjectClass.TRUCK, "line-1", "backward", 0.6, AT));
            assertThat(json).contains("\"object_class\":\"truck\"");
        }

        @Test
        @DisplayName("writes the estimated flag of metrics as is_estimated")
        void metricEstimatedFlag() {
            var metric = new MetricValue("m-1", "tenant-1", "site-1", MetricName.RACK_TIME, AT,
                    WindowSize.ONE_MINUTE, 1800.0, "seconds", Map.of("bay_id", "bay-1"), true);

            assertThat(EventSerializer.serialize(metric))
                    .contains("\"metric_name\":\"rack_time\"")
                    .contains("\"window_size\":\"1m\"")
                    .contains("\"is_estimated\":true");
        }
    }

    @Nested
    @DisplayName("deserialize()")
    class Deserialize {

        @Test
        @DisplayName("restores the concrete record named by event_type")
        void restoresConcreteType() {
            var original = factory.lobbyEnter("12", "door-1", 0.77, AT);

            var restored = EventSerializer.deserialize(EventSerializer.serialize(original));

            assertThat(restored).isInstanceOf(DomainEvent.LobbyEnter.class).isEqualTo(original);
        }

        @Test
        @DisplayName("decodes a hand-written feed message with missing fields as nulls")
        void partialMessage() {
            var restored = EventSerializer.deserialize(
                    "{\"event_type\":\"vehicle_arrival\",\"event_id\":\"e-1\",\"track_id\":\"5\"}");

            assertThat(restored).isInstanceOf(DomainEvent.VehicleArrival.class);
            assertThat(restored.occurredAt()).isNull();
            assertThat(restored.source()).isNull();
        }

        @Test
        @DisplayName("throws on malformed JSON")
        void throwsOnMalformedJson() {
            assertThatThrownBy(() -> EventSerializer.deserialize("not-json{"))
                    .isInstanceOf(EventSerializer.EventSerializationException.class);
        }

        @Test
        @DisplayName("throws on unknown event_type")
        void throwsOnUnknownType() {
            assertThatThrownBy(() -> EventSerializer.deserialize("{\"event_type\":\"system_heartbeat\"}"))
                    .isInstanceOf(EventSerializer.EventSerializationException.class);
        }

        @Test
        @DisplayName("tryDeserialize returns empty instead of throwing")
        void tryDeserializeEmpty() {
            assertThat(EventSerializer.tryDeserialize("{")).isEmpty();
            assertThat(EventSerializer.tryDeserialize(null)).isEmpty();
        }
    }
}
