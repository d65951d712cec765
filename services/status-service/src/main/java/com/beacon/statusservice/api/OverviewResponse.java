package com.beacon.statusservice.api;

import com.beacon.statusservice.domain.StatusOverview;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.List;

@JsonPropertyOrder({"total", "up_count", "down_count", "requiring_attention", "timestamp"})
public record OverviewResponse(
        @JsonProperty("total") int total,
        @JsonProperty("up_count") int upCount,
        @JsonProperty("down_count") int downCount,
        @JsonProperty("requiring_attention") List<String> requiringAttention,
        @JsonProperty("timestamp") Instant timestamp) {

    static OverviewResponse from(StatusOverview overview, Instant now) {
        return new OverviewResponse(
                overview.total(),
                overview.upCount(),
                overview.downCount(),
                overview.requiringAttention(),
                now);
    }
}
