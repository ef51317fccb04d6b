package com.dealereye.edgeanalytics.infrastructure;

import com.dealereye.analytics.sink.EventPublisher;
import com.dealereye.eventmodel.DomainEvent;
import com.dealereye.eventmodel.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default transport: writes each domain event as its JSON wire form to the log. Replaced by a
 * broker-backed publisher bean named {@code transportPublisher} where one is configured.
 */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

    @Override
    public void publish(DomainEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("event {}", EventSerializer.serialize(event));
        }
    }
}
