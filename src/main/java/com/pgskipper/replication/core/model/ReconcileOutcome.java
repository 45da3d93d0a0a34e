package com.pgskipper.replication.core.model;

/**
 * What a mutating operation actually did to the cluster.
 *
 * The HTTP layer answers {@code OK} for every outcome; the distinction exists
 * for logs and for callers embedding the services directly.
 */
public enum ReconcileOutcome {

    /** A CREATE PUBLICATION statement was executed. */
    CREATED,

    /** An ALTER PUBLICATION statement (ADD or SET) was executed. */
    ALTERED,

    /** A DROP PUBLICATION statement was executed. */
    DROPPED,

    /** The REPLICATION attribute was granted to a role. */
    GRANTED,

    /**
     * Nothing was executed: create found the publication already present, or
     * drop found it already absent.
     */
    UNCHANGED
}
