package com.dealereye.analytics.sink;

import com.dealereye.eventmodel.metric.MetricValue;

/**
 * Receives computed metric values. Same non-blocking contract as {@link EventPublisher}.
 */
@FunctionalInterface
public interface MetricSink {

    void record(MetricValue metric);
}
