package com.dealereye.edgeanalytics;

import com.dealereye.edgeanalytics.config.AnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Edge analytics host for one dealership site.
 *
 * <p>Runs a camera worker per configured camera, fans the resulting domain events out to the
 * transport and the local correlation engine, and exposes health and Micrometer meters through
 * actuator.
 */
@SpringBootApplication
@EnableConfigurationProperties(AnalyticsProperties.class)
@EnableScheduling
public class EdgeAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeAnalyticsApplication.class, args);
    }
}
