package com.pgskipper.replication.r2dbc.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.pgskipper.replication.config.PostgresProperties;
import com.pgskipper.replication.core.error.ClusterUnavailableException;
import com.pgskipper.replication.core.error.HealthCheckTimeoutException;
import com.pgskipper.replication.core.model.HealthStatus;

/**
 * =====================================================================
 * ClusterStartupCheck
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Verifies once, during Spring Boot startup, that the cluster answers.
 *
 * ORDERING
 * --------
 * Runs when all singletons are instantiated, which is before the context
 * starts its lifecycle beans. The embedded web server only binds its port in
 * that later phase, so no request is served until the check has passed.
 *
 * FAILURE MODEL
 * -------------
 * - OUT_OF_SERVICE → {@link ClusterUnavailableException}
 * - timeout        → {@link ClusterUnavailableException} (cause: timeout)
 *
 * The exception leaves {@link #afterSingletonsInstantiated}, Spring Boot
 * fails the context and the process exits non-zero. The decision to exit
 * belongs to the hosting layer: nothing here terminates the JVM.
 *
 * Disable with {@code replication.postgres.startup-check=false}.
 */
@Component
@ConditionalOnProperty(
        prefix = "replication.postgres",
        name = "startup-check",
        havingValue = "true",
        matchIfMissing = true
)
public class ClusterStartupCheck implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(ClusterStartupCheck.class);

    private final ClusterHealthProbe probe;
    private final PostgresProperties props;

    public ClusterStartupCheck(ClusterHealthProbe probe, PostgresProperties props) {
        this.probe = probe;
        this.props = props;
    }

    @Override
    public void afterSingletonsInstantiated() {
        log.debug("Checking connection for host={} port={} with database {}",
                props.getHost(), props.getPort(), props.getDefaultDatabase());

        HealthStatus status;
        try {
            status = probe.check().block();
        } catch (HealthCheckTimeoutException e) {
            throw new ClusterUnavailableException("PostgreSQL connection timeout expired", e);
        }

        if (status != HealthStatus.UP) {
            throw new ClusterUnavailableException("PostgreSQL is unavailable (status=" + status + ")");
        }
        log.info("PostgreSQL cluster is reachable, controller initialized");
    }
}
