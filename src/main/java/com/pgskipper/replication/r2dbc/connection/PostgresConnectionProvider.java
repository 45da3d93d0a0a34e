package com.pgskipper.replication.r2dbc.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgskipper.replication.config.PostgresProperties;

import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import io.r2dbc.postgresql.client.SSLMode;
import io.r2dbc.spi.Connection;
import reactor.core.publisher.Mono;

/**
 * {@link ConnectionProvider} backed by the r2dbc-postgresql driver.
 *
 * <h2>Connection strategy</h2>
 * <ul>
 *   <li>A new, unpooled connection factory is built per call: the target
 *       database is part of the connection configuration and requests address
 *       arbitrary databases.</li>
 *   <li>{@code sslmode=require} when {@link PostgresProperties#isSsl()} is set,
 *       {@code sslmode=disable} otherwise.</li>
 *   <li>The connect timeout bounds connection establishment only.</li>
 * </ul>
 *
 * <h2>Security note</h2>
 * Credentials are passed to the driver as-is; nothing here logs them.
 */
public class PostgresConnectionProvider implements ConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionProvider.class);

    private final PostgresProperties props;

    public PostgresConnectionProvider(PostgresProperties props) {
        this.props = props;
    }

    @Override
    public Mono<Connection> connect(String database) {
        return connect(database, props.getAdminUser(), props.getAdminPassword());
    }

    @Override
    public Mono<Connection> connect(String database, String username, String password) {
        String target = resolveDatabase(database);
        PostgresqlConnectionFactory factory = new PostgresqlConnectionFactory(configuration(target, username, password));

        return Mono.defer(factory::create)
                .cast(Connection.class)
                .doOnSubscribe(s -> log.debug("Opening connection to database {} as {}", target, username))
                .doOnError(e -> log.warn("Cannot connect to database {}: {}", target, e.getMessage()));
    }

    @Override
    public String defaultDatabase() {
        return props.getDefaultDatabase();
    }

    PostgresqlConnectionConfiguration configuration(String database, String username, String password) {
        return PostgresqlConnectionConfiguration.builder()
                .host(props.getHost())
                .port(props.getPort())
                .database(database)
                .username(username)
                .password(password == null ? "" : password)
                .connectTimeout(props.getConnectTimeout())
                .sslMode(sslMode())
                .build();
    }

    SSLMode sslMode() {
        return props.isSsl() ? SSLMode.REQUIRE : SSLMode.DISABLE;
    }

    private String resolveDatabase(String database) {
        return (database == null || database.isBlank()) ? props.getDefaultDatabase() : database;
    }
}
