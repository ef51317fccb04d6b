package com.dealereye.analytics.sink;

import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.observability.AnalyticsMeters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers each event to several named publishers in registration order, typically the
 * external transport and the local correlation engine.
 * <p>
 * A publisher that throws is logged and counted under its name; the remaining publishers
 * still receive the event and the exception never reaches the caller.
 */
public final class FanOutEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(FanOutEventPublisher.class);

    private final Map<String, EventPublisher> targets;
    private final AnalyticsMeters meters;

    public FanOutEventPublisher(Map<String, EventPublisher> targets, AnalyticsMeters meters) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("targets must not be null or empty");
        }
        this.targets = new LinkedHashMap<>(targets);
        this.meters = meters;
    }

    @Override
    public void publish(DomainEvent event) {
        for (Map.Entry<String, EventPublisher> target : targets.entrySet()) {
            try {
                target.getValue().publish(event);
            } catch (RuntimeException e) {
                meters.publishFailure(target.getKey());
                log.warn("Publisher '{}' rejected {} event {}: {}",
                        target.getKey(), event.eventType().value(), event.eventId(), e.getMessage(), e);
            }
        }
    }
}
