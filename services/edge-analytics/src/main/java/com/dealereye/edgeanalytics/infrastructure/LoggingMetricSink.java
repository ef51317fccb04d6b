package com.dealereye.edgeanalytics.infrastructure;

import com.dealereye.analytics.sink.MetricSink;
import com.dealereye.eventmodel.EventSerializer;
import com.dealereye.eventmodel.metric.MetricValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default metric sink: logs each metric value as JSON.
 */
public class LoggingMetricSink implements MetricSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingMetricSink.class);

    @Override
    public void record(MetricValue metric) {
        log.info("metric {}", EventSerializer.serialize(metric));
    }
}
