package com.pgskipper.replication.core.error;

/**
 * The request cannot be acted on as sent: a required name is empty, an alter
 * request carries nothing to add or set, or an identifier contains a statement
 * terminator.
 *
 * Raised before any database round trip.
 */
public class InvalidRequestException extends ReplicationControllerException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
