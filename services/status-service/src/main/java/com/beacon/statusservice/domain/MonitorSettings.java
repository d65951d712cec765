package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecordValidator;
import java.time.Duration;

/**
 * Immutable monitoring configuration, built once at startup and passed to every component that
 * needs it.
 *
 * @param applicationName name under which the computed application status is recorded
 * @param dependencies services the application status is derived from
 * @param hostName host reported on records produced by this monitor
 * @param probeTimeout upper bound for a single service probe
 * @param cycleTimeout upper bound for a whole check cycle
 * @param readTimeout upper bound for a single store read
 */
public record MonitorSettings(
        String applicationName,
        DependencySet dependencies,
        String hostName,
        Duration probeTimeout,
        Duration cycleTimeout,
        Duration readTimeout) {

    public MonitorSettings {
        if (!StatusRecordValidator.isValidServiceName(applicationName)) {
            throw new IllegalArgumentException("invalid application name: '" + applicationName + "'");
        }
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies must not be null");
        }
        // The application status is always computed, never probed.
        if (dependencies.contains(applicationName)) {
            throw new IllegalArgumentException(
                    "application '" + applicationName + "' must not be listed as its own dependency");
        }
        if (hostName == null || hostName.isBlank()) {
            throw new IllegalArgumentException("hostName must not be null or blank");
        }
        requirePositive(probeTimeout, "probeTimeout");
        requirePositive(cycleTimeout, "cycleTimeout");
        requirePositive(readTimeout, "readTimeout");
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
