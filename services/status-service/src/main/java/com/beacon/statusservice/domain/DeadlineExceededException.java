package com.beacon.statusservice.domain;

import java.time.Duration;

/**
 * An operation did not finish within its deadline. A check cycle that fails this way has appended
 * only complete dependency records and never the application record.
 */
public class DeadlineExceededException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public DeadlineExceededException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String operation() {
        return operation;
    }

    public Duration timeout() {
        return timeout;
    }
}
