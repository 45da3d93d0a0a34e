package com.pgskipper.replication.core.error;

import java.time.Duration;

/**
 * A cluster health probe did not finish within its time budget. The probe has
 * been cancelled and its connection released by the time this is observed.
 */
public class HealthCheckTimeoutException extends ReplicationControllerException {

    private final Duration timeout;

    public HealthCheckTimeoutException(Duration timeout) {
        super("PostgreSQL health check did not complete within " + timeout);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
