package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-time summary of the latest status of every known service.
 *
 * @param total number of distinct services with at least one record
 * @param upCount services whose latest status is UP
 * @param downCount services whose latest status is anything other than UP
 * @param requiringAttention names of the non-UP services, in store order
 */
public record StatusOverview(int total, int upCount, int downCount, List<String> requiringAttention) {

    public StatusOverview {
        requiringAttention = List.copyOf(requiringAttention);
    }

    /** Derives the overview from a latest-per-name snapshot. */
    public static StatusOverview of(Map<String, StatusRecord> latest) {
        int up = 0;
        List<String> attention = new ArrayList<>();
        for (Map.Entry<String, StatusRecord> entry : latest.entrySet()) {
            if (entry.getValue().isUp()) {
                up++;
            } else {
                attention.add(entry.getKey());
            }
        }
        return new StatusOverview(latest.size(), up, attention.size(), attention);
    }
}
