package com.beacon.statusservice.domain;

import com.beacon.statusmodel.ServiceStatus;

/** Composite status of the monitored application, derived from its dependencies. */
public enum ApplicationStatus {
    UP(2),
    DEGRADED(1),
    DOWN(0);

    private final int level;

    ApplicationStatus(int level) {
        this.level = level;
    }

    /** Numeric level published as a gauge: 0 down, 1 degraded, 2 up. */
    public int level() {
        return level;
    }

    public ServiceStatus toServiceStatus() {
        return ServiceStatus.valueOf(name());
    }
}
