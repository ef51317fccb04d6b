package com.dealereye.eventmodel;

import com.dealereye.eventmodel.metric.MetricValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON wire form for {@link DomainEvent} and {@link MetricValue}.
 * <p>
 * Field names are snake_case and the concrete event record is selected by the
 * {@code event_type} property. {@code JavaTimeModule} writes {@code Instant} as ISO 8601.
 * Unknown properties are ignored so older consumers accept newer producers.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a domain event to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(DomainEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.eventId(), e);
        }
    }

    /**
     * Serializes a metric value to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(MetricValue metric) {
        try {
            return MAPPER.writeValueAsString(metric);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize metric: " + metric.metricId(), e);
        }
    }

    /**
     * Deserializes a JSON string to the domain event named by its {@code event_type}.
     *
     * @throws EventSerializationException if the JSON is malformed or the type is unknown
     */
    public static DomainEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, DomainEvent.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static Optional<DomainEvent> tryDeserialize(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
