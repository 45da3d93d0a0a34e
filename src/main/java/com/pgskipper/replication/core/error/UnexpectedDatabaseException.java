package com.pgskipper.replication.core.error;

/**
 * Any database or connection failure the services have no rule for.
 *
 * Fatal to the request (HTTP 500) but never to the process.
 */
public class UnexpectedDatabaseException extends ReplicationControllerException {

    /** SQLSTATE reported by the server, or null when the failure carried none. */
    private final String sqlState;

    public UnexpectedDatabaseException(String message, String sqlState, Throwable cause) {
        super(sqlState == null ? message : message + " (SQLSTATE " + sqlState + ")", cause);
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
