package com.beacon.statusmodel;

import java.util.Optional;

/**
 * Status vocabulary carried by every {@link StatusRecord}.
 *
 * <p>{@code UP} and {@code DOWN} are the only values accepted from external submitters. {@code
 * UNKNOWN} is produced when a probe cannot determine a state, and {@code DEGRADED} only appears on
 * the computed application record.
 */
public enum ServiceStatus {
    UP,
    DOWN,
    UNKNOWN,
    DEGRADED;

    /** The canonical string used on the wire (e.g. "UP"). */
    public String value() {
        return name();
    }

    /** Whether a client may submit this status directly. */
    public boolean isSubmittable() {
        return this == UP || this == DOWN;
    }

    /**
     * Looks up a status by its exact wire value. Matching is case-sensitive: "up" is not a status.
     *
     * @param value the string to match (e.g. "DOWN")
     * @return the matching status, or empty if not found
     */
    public static Optional<ServiceStatus> fromString(String value) {
        for (ServiceStatus status : values()) {
            if (status.name().equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
