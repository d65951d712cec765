package com.beacon.statusservice.api;

import com.beacon.statusmodel.StatusRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

/** Latest record of one service, with the time it was observed as {@code last_updated}. */
@JsonPropertyOrder({"service_name", "service_status", "host_name", "last_updated", "timestamp"})
public record ServiceStatusResponse(
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("service_status") String serviceStatus,
        @JsonProperty("host_name") String hostName,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("timestamp") Instant timestamp) {

    static ServiceStatusResponse from(StatusRecord record, Instant now) {
        return new ServiceStatusResponse(
                record.serviceName(),
                record.status().value(),
                record.hostName(),
                record.timestamp(),
                now);
    }
}
