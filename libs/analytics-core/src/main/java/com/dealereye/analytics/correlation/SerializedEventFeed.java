package com.dealereye.analytics.correlation;

import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventSerializer;
import com.dealereye.eventmodel.metric.MetricValue;
import com.dealereye.observability.AnalyticsMeters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Feeds JSON-encoded domain events from a subscribed transport into a
 * {@link MetricsCorrelationEngine}.
 * <p>
 * Messages that cannot be decoded are dropped with a warning and counted as malformed.
 */
public final class SerializedEventFeed {

    private static final Logger log = LoggerFactory.getLogger(SerializedEventFeed.class);

    private final MetricsCorrelationEngine engine;
    private final AnalyticsMeters meters;

    public SerializedEventFeed(MetricsCorrelationEngine engine, AnalyticsMeters meters) {
        this.engine = engine;
        this.meters = meters;
    }

    /**
     * Decodes one message and correlates it.
     *
     * @return metrics computed from the message, empty if it was dropped
     */
    public List<MetricValue> accept(String json) {
        Optional<DomainEvent> event = EventSerializer.tryDeserialize(json);
        if (event.isEmpty()) {
            meters.malformedEvent("feed");
            log.warn("Dropping undecodable event message ({} chars)", json == null ? 0 : json.length());
            return List.of();
        }
        return engine.process(event.get());
    }
}
