package com.pgskipper.replication.core.error;

/**
 * The publication, or the database it should live in, does not exist.
 *
 * {@link #getPublication()} is null when the database itself is missing and
 * the failing operation had no publication in scope (e.g. a role grant).
 */
public class PublicationNotFoundException extends ReplicationControllerException {

    private final String database;
    private final String publication;

    public PublicationNotFoundException(String database, String publication) {
        super(publication == null
                ? "Database " + database + " does not exist"
                : "Publication " + publication + " does not exist in database " + database);
        this.database = database;
        this.publication = publication;
    }

    public String getDatabase() {
        return database;
    }

    public String getPublication() {
        return publication;
    }
}
