package com.beacon.statusservice.domain;

import com.beacon.statusmodel.ServiceStatus;

/** Raw state of a service as reported by a {@link ServiceStateProvider}. */
public enum ServiceState {
    RUNNING,
    STOPPED,
    UNKNOWN;

    /** Maps the raw state onto the status vocabulary stored in records. */
    public ServiceStatus toStatus() {
        return switch (this) {
            case RUNNING -> ServiceStatus.UP;
            case STOPPED -> ServiceStatus.DOWN;
            case UNKNOWN -> ServiceStatus.UNKNOWN;
        };
    }
}
