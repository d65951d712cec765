package com.beacon.statusservice.domain;

import com.beacon.statusmodel.ServiceStatus;
import com.beacon.statusmodel.StatusRecord;
import java.time.Instant;
import java.util.Map;

/**
 * Derives the application status from the latest status of each configured dependency.
 *
 * <ul>
 *   <li>{@code UP} when every dependency is UP
 *   <li>{@code DOWN} when every dependency is DOWN or UNKNOWN
 *   <li>{@code DEGRADED} otherwise
 * </ul>
 *
 * <p>A dependency with no record counts as UNKNOWN. The aggregator performs no I/O and never reads
 * a clock; timestamps are passed in.
 */
public final class StatusAggregator {

    private final DependencySet dependencies;

    public StatusAggregator(DependencySet dependencies) {
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies must not be null");
        }
        this.dependencies = dependencies;
    }

    /**
     * Aggregates dependency records keyed by service name. Records for names outside the
     * dependency set are ignored.
     */
    public ApplicationStatus aggregate(Map<String, StatusRecord> records) {
        int up = 0;
        int notConfirmed = 0;
        for (String name : dependencies.names()) {
            StatusRecord record = records.get(name);
            ServiceStatus status = record == null ? ServiceStatus.UNKNOWN : record.status();
            if (status == ServiceStatus.UP) {
                up++;
            } else if (status == ServiceStatus.DOWN || status == ServiceStatus.UNKNOWN) {
                notConfirmed++;
            }
        }
        if (up == dependencies.size()) {
            return ApplicationStatus.UP;
        }
        if (notConfirmed == dependencies.size()) {
            return ApplicationStatus.DOWN;
        }
        return ApplicationStatus.DEGRADED;
    }

    /**
     * Builds the application record for the given dependency records.
     *
     * @param applicationName name the application status is recorded under
     * @param records dependency records keyed by service name
     * @param hostName host reported on the application record
     * @param observedAt timestamp of the application record
     */
    public StatusRecord applicationRecord(
            String applicationName,
            Map<String, StatusRecord> records,
            String hostName,
            Instant observedAt) {
        return new StatusRecord(
                applicationName, aggregate(records).toServiceStatus(), hostName, observedAt);
    }

    public DependencySet dependencies() {
        return dependencies;
    }
}
