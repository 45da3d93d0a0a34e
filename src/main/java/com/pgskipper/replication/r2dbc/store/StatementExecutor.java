package com.pgskipper.replication.r2dbc.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.pgskipper.replication.core.error.PublicationConflictException;
import com.pgskipper.replication.core.error.PublicationNotFoundException;
import com.pgskipper.replication.core.error.UnexpectedDatabaseException;
import com.pgskipper.replication.r2dbc.connection.ConnectionProvider;

import io.r2dbc.spi.Result;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Executes a single DDL statement on its own connection.
 *
 * FAILURE MODEL
 * -------------
 * - SQLSTATE 42710 (duplicate object)  → {@link PublicationConflictException}
 * - SQLSTATE 3D000 (no such database)  → {@link PublicationNotFoundException}
 * - anything else                      → {@link UnexpectedDatabaseException}
 *
 * Nothing is retried.
 */
@Component
public class StatementExecutor {

	private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

	private final ConnectionProvider connections;

	public StatementExecutor(ConnectionProvider connections) {
		this.connections = connections;
	}

	public Mono<Void> execute(String requestId, String database, String statement) {
		return Mono.defer(() -> {
			log.debug("requestId={} database={} executing: {}", requestId, database, statement);
			return connections.withConnection(database, conn -> Flux.from(conn.createStatement(statement).execute())
					.flatMap(Result::getRowsUpdated))
					.then();
		}).onErrorMap(e -> translate(requestId, database, e));
	}

	private Throwable translate(String requestId, String database, Throwable e) {
		if (SqlStates.isDuplicateObject(e)) {
			log.warn("requestId={} database={} statement rejected as duplicate: {}", requestId, database,
					e.getMessage());
			return new PublicationConflictException(e.getMessage(), e);
		}
		if (SqlStates.isDatabaseMissing(e)) {
			return new PublicationNotFoundException(database, null);
		}
		log.error("requestId={} database={} statement failed", requestId, database, e);
		return new UnexpectedDatabaseException("Statement failed on database " + database,
				SqlStates.of(e).orElse(null), e);
	}
}
