package com.pgskipper.replication.core.error;

/**
 * The database rejected a statement because an object it would create already
 * exists (SQLSTATE {@code 42710}), e.g. adding a table that is already a member
 * of the publication.
 */
public class PublicationConflictException extends ReplicationControllerException {

    public PublicationConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
