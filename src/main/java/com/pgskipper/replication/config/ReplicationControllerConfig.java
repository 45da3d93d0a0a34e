package com.pgskipper.replication.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.pgskipper.replication.r2dbc.connection.ConnectionProvider;
import com.pgskipper.replication.r2dbc.connection.PostgresConnectionProvider;

/**
 * Spring configuration that wires up:
 * - Property binding for the cluster settings (API credentials are bound by
 *   the security configuration)
 * - The {@link ConnectionProvider} every database-facing component shares
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>No connection is opened here; the provider only holds the immutable
 *       cluster coordinates and credentials.</li>
 *   <li>Connections are opened per operation and closed when the operation
 *       ends, there is no pool.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(PostgresProperties.class)
public class ReplicationControllerConfig {

    private static final Logger log = LoggerFactory.getLogger(ReplicationControllerConfig.class);

    @Bean
    public ConnectionProvider connectionProvider(PostgresProperties props) {
        log.info("PostgreSQL cluster configured (host={}, port={}, defaultDatabase={}, ssl={}, user={})",
                props.getHost(),
                props.getPort(),
                props.getDefaultDatabase(),
                props.isSsl(),
                mask(props.getAdminUser()));
        return new PostgresConnectionProvider(props);
    }

    /**
     * Masks an identifier for logging.
     *
     * <p>Example: "postgres" -> "p***s"</p>
     */
    private static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
