package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecord;
import java.util.List;

/**
 * Outcome of one completed check cycle.
 *
 * @param cycleId identifier of the cycle, also used as its log correlation ID
 * @param dependencyRecords records appended for each dependency, in probing order
 * @param applicationStatus status derived from those records
 * @param applicationRecord application record appended after the dependency records
 */
public record CheckCycleResult(
        String cycleId,
        List<StatusRecord> dependencyRecords,
        ApplicationStatus applicationStatus,
        StatusRecord applicationRecord) {

    public CheckCycleResult {
        dependencyRecords = List.copyOf(dependencyRecords);
    }
}
