package com.beacon.statusmodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

/**
 * Immutable observation of one service's state at one instant.
 *
 * <p>Records are write-once: once appended to a status store they are only ever read. The compact
 * constructor fills the host-name default, so every record in the system is fully populated and
 * downstream code never re-checks for missing fields.
 *
 * @param serviceName name of the observed service, never blank
 * @param status observed status
 * @param hostName host the service runs on; {@value #UNKNOWN_HOST} when not supplied
 * @param timestamp instant the state was observed
 */
@JsonPropertyOrder({"service_name", "service_status", "host_name", "timestamp"})
public record StatusRecord(
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("service_status") ServiceStatus status,
        @JsonProperty("host_name") String hostName,
        @JsonProperty("timestamp") Instant timestamp) {

    /** Sentinel host name used when the observer did not report one. */
    public static final String UNKNOWN_HOST = "unknown";

    public StatusRecord {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (hostName == null || hostName.isBlank()) {
            hostName = UNKNOWN_HOST;
        }
    }

    /** Creates a record observed at the given instant on an unreported host. */
    public static StatusRecord of(String serviceName, ServiceStatus status, Instant timestamp) {
        return new StatusRecord(serviceName, status, UNKNOWN_HOST, timestamp);
    }

    /** Whether this record reports the service as confirmed up. */
    public boolean isUp() {
        return status == ServiceStatus.UP;
    }
}
