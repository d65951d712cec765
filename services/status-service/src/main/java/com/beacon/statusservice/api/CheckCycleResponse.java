package com.beacon.statusservice.api;

import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusservice.domain.CheckCycleResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an on-demand check cycle.
 *
 * @param services status of each dependency followed by the application, in append order
 */
@JsonPropertyOrder({"cycle_id", "application_status", "services", "timestamp"})
public record CheckCycleResponse(
        @JsonProperty("cycle_id") String cycleId,
        @JsonProperty("application_status") String applicationStatus,
        @JsonProperty("services") Map<String, String> services,
        @JsonProperty("timestamp") Instant timestamp) {

    static CheckCycleResponse from(CheckCycleResult result) {
        Map<String, String> services = new LinkedHashMap<>();
        for (StatusRecord record : result.dependencyRecords()) {
            services.put(record.serviceName(), record.status().value());
        }
        StatusRecord application = result.applicationRecord();
        services.put(application.serviceName(), application.status().value());
        return new CheckCycleResponse(
                result.cycleId(), application.status().value(), services, application.timestamp());
    }
}
