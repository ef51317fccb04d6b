package com.dealereye.edgeanalytics.infrastructure;

import com.dealereye.analytics.correlation.MetricsCorrelationEngine;
import com.dealereye.edgeanalytics.config.AnalyticsProperties;
import com.dealereye.eventmodel.metric.MetricValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically records the site's drive throughput over the last reporting interval.
 */
public class ThroughputReporter {

    private static final Logger log = LoggerFactory.getLogger(ThroughputReporter.class);

    private final MetricsCorrelationEngine engine;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public ThroughputReporter(MetricsCorrelationEngine engine, AnalyticsProperties properties, Clock clock) {
        this.engine = engine;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${dealereye.analytics.throughput-interval:PT1H}",
            fixedRateString = "${dealereye.analytics.throughput-interval:PT1H}")
    public void report() {
        Instant end = clock.instant();
        Instant start = end.minus(properties.throughputInterval());
        MetricValue metric = engine.sampleThroughput(properties.tenantId(), properties.siteId(), start, end);
        log.debug("Drive throughput {} vehicles between {} and {}", (long) metric.value(), start, end);
    }
}
