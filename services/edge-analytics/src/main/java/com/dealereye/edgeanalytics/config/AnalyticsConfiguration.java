package com.dealereye.edgeanalytics.config;

import com.dealereye.analytics.correlation.MetricsCorrelationEngine;
import com.dealereye.analytics.layout.CameraLayout;
import com.dealereye.analytics.sink.EventPublisher;
import com.dealereye.analytics.sink.FanOutEventPublisher;
import com.dealereye.analytics.sink.MetricSink;
import com.dealereye.analytics.worker.CameraWorkerPool;
import com.dealereye.edgeanalytics.infrastructure.JsonLayoutLoader;
import com.dealereye.edgeanalytics.infrastructure.LoggingEventPublisher;
import com.dealereye.edgeanalytics.infrastructure.LoggingMetricSink;
import com.dealereye.edgeanalytics.infrastructure.ThroughputReporter;
import com.dealereye.observability.AnalyticsMeters;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the analytics core for this site.
 *
 * <p>Domain events from every camera worker go through one fan-out: first to the transport, then
 * to the in-process correlation engine. Transport and metric sink default to logging
 * implementations and can be replaced by defining beans of the same name.
 */
@Configuration
public class AnalyticsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AnalyticsMeters analyticsMeters(MeterRegistry meterRegistry, AnalyticsProperties properties) {
        return new AnalyticsMeters(meterRegistry, properties.serviceName());
    }

    @Bean
    @ConditionalOnMissingBean(name = "transportPublisher")
    public EventPublisher transportPublisher() {
        return new LoggingEventPublisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricSink metricSink() {
        return new LoggingMetricSink();
    }

    @Bean
    public MetricsCorrelationEngine metricsCorrelationEngine(
            AnalyticsProperties properties, MetricSink metricSink, AnalyticsMeters meters) {
        return new MetricsCorrelationEngine(properties.correlationSettings(), metricSink, meters);
    }

    @Bean
    public FanOutEventPublisher eventFanOut(
            @Qualifier("transportPublisher") EventPublisher transportPublisher,
            MetricsCorrelationEngine engine,
            AnalyticsMeters meters) {
        Map<String, EventPublisher> targets = new LinkedHashMap<>();
        targets.put("transport", transportPublisher);
        targets.put("correlation", engine);
        return new FanOutEventPublisher(targets, meters);
    }

    @Bean
    public JsonLayoutLoader jsonLayoutLoader() {
        return new JsonLayoutLoader();
    }

    @Bean(destroyMethod = "close")
    public CameraWorkerPool cameraWorkerPool(
            AnalyticsProperties properties,
            FanOutEventPublisher eventFanOut,
            AnalyticsMeters meters,
            Clock clock,
            JsonLayoutLoader loader) {
        CameraWorkerPool pool = new CameraWorkerPool(
                properties.tenantId(), properties.siteId(), properties.scannerSettings(),
                eventFanOut, meters, clock);
        List<CameraLayout> layouts = properties.layoutFile() == null
                ? List.of()
                : loader.load(properties.layoutFile());
        if (layouts.isEmpty()) {
            log.warn("No camera layouts configured for site {}; every primitive will be a miss",
                    properties.siteId());
        }
        layouts.forEach(pool::apply);
        return pool;
    }

    @Bean
    public ThroughputReporter throughputReporter(
            MetricsCorrelationEngine engine, AnalyticsProperties properties, Clock clock) {
        return new ThroughputReporter(engine, properties, clock);
    }
}
