package com.beacon.statusservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

/** Body of a successful {@code POST /add}. */
@JsonPropertyOrder({"message", "service_name", "record_id", "timestamp"})
public record AddStatusResponse(
        @JsonProperty("message") String message,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("record_id") String recordId,
        @JsonProperty("timestamp") Instant timestamp) {}
