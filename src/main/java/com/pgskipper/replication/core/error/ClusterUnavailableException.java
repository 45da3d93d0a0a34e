package com.pgskipper.replication.core.error;

/**
 * The cluster failed the startup health check. Thrown out of the startup runner
 * so that Spring Boot aborts context startup and the process exits non-zero.
 */
public class ClusterUnavailableException extends ReplicationControllerException {

    public ClusterUnavailableException(String message) {
        super(message);
    }

    public ClusterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
