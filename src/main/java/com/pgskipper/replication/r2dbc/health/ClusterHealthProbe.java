package com.pgskipper.replication.r2dbc.health;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.pgskipper.replication.config.PostgresProperties;
import com.pgskipper.replication.core.error.HealthCheckTimeoutException;
import com.pgskipper.replication.core.model.HealthStatus;
import com.pgskipper.replication.r2dbc.connection.ConnectionProvider;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * ClusterHealthProbe
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Bounded-time liveness check of the PostgreSQL cluster: connect to the
 * default database and run a trivial catalog query.
 *
 * RACE
 * ----
 *
 *   probe ──────────────┐
 *                       ├──▶ first to finish wins
 *   timer (timeout) ────┘
 *
 * - Probe first  → UP, or OUT_OF_SERVICE when the query/connection failed
 * - Timer first  → the probe subscription is CANCELLED; cancellation reaches
 *                  the scoped connection, which is closed, and the check fails
 *                  with {@link HealthCheckTimeoutException}
 *
 * The loser never keeps running unobserved.
 *
 * USED BY
 * -------
 * - {@link ClusterStartupCheck} once during startup
 * - the {@code /health} endpoint on every call
 */
@Component
public class ClusterHealthProbe {

    private static final Logger log = LoggerFactory.getLogger(ClusterHealthProbe.class);

    static final String HEALTH_QUERY = "SELECT 1 FROM pg_catalog.pg_tables";

    private final ConnectionProvider connections;
    private final PostgresProperties props;

    public ClusterHealthProbe(ConnectionProvider connections, PostgresProperties props) {
        this.connections = connections;
        this.props = props;
    }

    /**
     * Checks the cluster within the configured health timeout.
     */
    public Mono<HealthStatus> check() {
        return check(props.getHealthTimeout());
    }

    public Mono<HealthStatus> check(Duration timeout) {
        return probe()
                .timeout(timeout, Mono.error(() -> new HealthCheckTimeoutException(timeout)))
                .doOnCancel(() -> log.debug("Health check cancelled"))
                .doOnError(HealthCheckTimeoutException.class,
                        e -> log.error("PostgreSQL connection timeout expired after {}", timeout));
    }

    private Mono<HealthStatus> probe() {
        return connections.withConnection(connections.defaultDatabase(),
                        conn -> Flux.from(conn.createStatement(HEALTH_QUERY).execute())
                                .flatMap(result -> result.map((row, meta) -> 1)))
                .then(Mono.just(HealthStatus.UP))
                .onErrorResume(e -> {
                    log.error("PostgreSQL is unavailable", e);
                    return Mono.just(HealthStatus.OUT_OF_SERVICE);
                });
    }
}
