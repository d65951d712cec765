package com.beacon.statusservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * Latest status of every known service.
 *
 * @param services service name to status value, in order of first appearance
 * @param timestamp time the response was produced
 */
public record HealthcheckResponse(
        @JsonProperty("services") Map<String, String> services,
        @JsonProperty("timestamp") Instant timestamp) {}
