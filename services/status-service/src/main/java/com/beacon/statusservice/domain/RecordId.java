package com.beacon.statusservice.domain;

/** Opaque identifier a {@link StatusRepository} assigns to an appended record. */
public record RecordId(String value) {

    public RecordId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be null or blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
