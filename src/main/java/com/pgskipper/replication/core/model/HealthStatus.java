package com.pgskipper.replication.core.model;

/**
 * =====================================================================
 * HealthStatus
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Result of a single liveness probe against the PostgreSQL cluster.
 *
 * A status is computed per check and is never cached: every call to the
 * health endpoint and the startup check runs a fresh probe.
 *
 * STATE MACHINE
 * -------------
 *
 *   probe query succeeded  ──▶  UP
 *   probe query failed     ──▶  OUT_OF_SERVICE
 *
 * A probe that does not finish in time has no status at all; it is reported
 * as a {@code HealthCheckTimeoutException}.
 */
public enum HealthStatus {

    /**
     * The probe connected to the default database and ran its catalog query.
     */
    UP,

    /**
     * The probe could not connect or its query failed.
     *
     * BEHAVIOR
     * --------
     * - Reported as HTTP 503 by the health endpoint
     * - Fails application startup
     */
    OUT_OF_SERVICE
}
