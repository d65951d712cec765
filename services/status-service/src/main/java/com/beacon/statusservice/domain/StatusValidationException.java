package com.beacon.statusservice.domain;

import java.util.List;

/** A status submission or query was rejected before touching the store. */
public class StatusValidationException extends RuntimeException {

    private final List<String> errors;

    public StatusValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public StatusValidationException(String error) {
        this(List.of(error));
    }

    public List<String> errors() {
        return errors;
    }
}
