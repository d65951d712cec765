package com.beacon.statusservice;

import com.beacon.statusservice.config.MonitorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Beacon status service: probes the configured dependency services, derives the application
 * status from them and answers status queries over HTTP.
 *
 * <ul>
 *   <li>{@code POST /add} records an externally reported status
 *   <li>{@code GET /healthcheck} and {@code GET /healthcheck/{name}} return the latest statuses
 *   <li>{@code GET /overview} summarises up and down services
 *   <li>{@code POST /check-cycle} runs a check cycle on demand
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(MonitorProperties.class)
public class StatusServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(StatusServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(StatusServiceApplication.class, args);
        log.info("Beacon status service started");
    }
}
