package com.dealereye.analytics.sink;

import com.dealereye.eventmodel.DomainEvent;

/**
 * Receives domain events as they are emitted.
 * <p>
 * Implementations must not block: camera workers call this on the thread that consumes
 * perception primitives. Delivery guarantees, retries and offline queueing belong to the
 * transport behind the implementation.
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(DomainEvent event);
}
