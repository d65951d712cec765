package com.beacon.statusservice.domain;

/**
 * Source of raw service state for one named service on one host.
 *
 * <p>Implementations may block and may throw; {@link ServiceChecker} bounds every call with a
 * timeout and turns any failure into {@link ServiceState#UNKNOWN}. Implementations should respond
 * to thread interruption, which is how a timed-out probe is cancelled.
 */
@FunctionalInterface
public interface ServiceStateProvider {

    /**
     * Queries the current state of a service.
     *
     * @param serviceName service to query (e.g. "httpd")
     * @param hostName host the service runs on
     * @return the observed state; {@link ServiceState#UNKNOWN} when the answer is ambiguous
     * @throws Exception if the state source cannot be queried
     */
    ServiceState stateOf(String serviceName, String hostName) throws Exception;
}
