package com.pgskipper.replication.r2dbc.connection;

import java.util.function.Function;

import org.reactivestreams.Publisher;

import io.r2dbc.spi.Connection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * ConnectionProvider
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Opens short-lived connections to a named database of the cluster.
 *
 * CONTRACT
 * --------
 * - Every subscription to {@link #connect} opens exactly ONE new connection
 * - Connections are never pooled or shared between operations
 * - Whoever receives a connection owns it and must close it
 *
 * Prefer {@link #withConnection}, which closes the connection on completion,
 * on error and on cancellation.
 */
public interface ConnectionProvider {

    /**
     * Opens a connection to {@code database} as {@code username}.
     *
     * @param database target database; blank selects {@link #defaultDatabase()}
     */
    Mono<Connection> connect(String database, String username, String password);

    /**
     * Opens a connection to {@code database} with the cluster admin credentials.
     *
     * @param database target database; blank selects {@link #defaultDatabase()}
     */
    Mono<Connection> connect(String database);

    /**
     * Database used when a caller does not name one.
     */
    String defaultDatabase();

    /**
     * Runs {@code work} on a fresh admin connection to {@code database} and
     * closes the connection however the work ends.
     */
    default <T> Flux<T> withConnection(String database,
            Function<? super Connection, ? extends Publisher<? extends T>> work) {
        return Flux.usingWhen(
                connect(database),
                work,
                Connection::close,
                (connection, error) -> connection.close(),
                Connection::close);
    }
}
