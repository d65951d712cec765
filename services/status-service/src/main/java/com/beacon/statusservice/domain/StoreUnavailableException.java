package com.beacon.statusservice.domain;

/**
 * The status store could not be reached. Surfaced to callers as-is; this service never retries
 * store operations itself.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
