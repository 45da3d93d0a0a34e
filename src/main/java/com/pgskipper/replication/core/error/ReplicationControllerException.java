package com.pgskipper.replication.core.error;

/**
 * Root of the typed failures raised by the publication and grant services.
 *
 * The admin API maps each subtype to an HTTP status in
 * {@code AdminExceptionHandler}; nothing in the core retries.
 */
public abstract class ReplicationControllerException extends RuntimeException {

    protected ReplicationControllerException(String message) {
        super(message);
    }

    protected ReplicationControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
