package com.beacon.statusservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitor configuration bound from {@code beacon.monitor.*}:
 *
 * <pre>
 * beacon:
 *   monitor:
 *     application-name: rbcapp1
 *     dependencies: [httpd, rabbitmq, postgresql]
 *     host-name: app-host-01
 *     probe-timeout: 10s
 *     cycle-timeout: 60s
 *     read-timeout: 5s
 *     schedule-enabled: true
 *     check-interval: PT60S
 *     store:
 *       type: file
 *       directory: /var/lib/beacon/status
 * </pre>
 *
 * @param applicationName name under which the computed application status is recorded. Required.
 * @param dependencies services the application depends on, in probing order. Required.
 * @param hostName host reported on monitor records; resolved from the local machine when blank
 * @param probeTimeout upper bound for one probe (default 10s)
 * @param cycleTimeout upper bound for one check cycle (default 60s)
 * @param readTimeout upper bound for one store read (default 5s)
 * @param scheduleEnabled whether check cycles run on a timer (default false)
 * @param checkInterval delay between scheduled cycles (default 60s)
 * @param initialDelay delay before the first scheduled cycle (default 5s)
 * @param probeThreads size of the probe thread pool (default 4)
 * @param readThreads size of the store read thread pool (default 8)
 * @param store status store selection
 */
@ConfigurationProperties(prefix = "beacon.monitor")
@Validated
public record MonitorProperties(
        @NotBlank String applicationName,
        @NotEmpty List<@NotBlank String> dependencies,
        String hostName,
        Duration probeTimeout,
        Duration cycleTimeout,
        Duration readTimeout,
        boolean scheduleEnabled,
        Duration checkInterval,
        Duration initialDelay,
        int probeThreads,
        int readThreads,
        @Valid Store store) {

    /** Defaults for optional fields. Applied before Bean Validation runs. */
    public MonitorProperties {
        if (probeTimeout == null) {
            probeTimeout = Duration.ofSeconds(10);
        }
        if (cycleTimeout == null) {
            cycleTimeout = Duration.ofSeconds(60);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(5);
        }
        if (checkInterval == null) {
            checkInterval = Duration.ofSeconds(60);
        }
        if (initialDelay == null) {
            initialDelay = Duration.ofSeconds(5);
        }
        if (probeThreads <= 0) {
            probeThreads = 4;
        }
        if (readThreads <= 0) {
            readThreads = 8;
        }
        if (store == null) {
            store = new Store(null, null);
        }
    }

    /** Which adapter backs the status store. */
    public enum StoreType {
        IN_MEMORY,
        FILE
    }

    /**
     * @param type store adapter (default {@link StoreType#IN_MEMORY})
     * @param directory status-file directory for {@link StoreType#FILE} (default "data")
     */
    public record Store(StoreType type, String directory) {

        public Store {
            if (type == null) {
                type = StoreType.IN_MEMORY;
            }
            if (directory == null || directory.isBlank()) {
                directory = "data";
            }
        }
    }
}
