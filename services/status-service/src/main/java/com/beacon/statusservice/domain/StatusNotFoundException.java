package com.beacon.statusservice.domain;

/** No record was ever appended for the queried service name. */
public class StatusNotFoundException extends RuntimeException {

    private final String serviceName;

    public StatusNotFoundException(String serviceName) {
        super("Service \"" + serviceName + "\" not found");
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
