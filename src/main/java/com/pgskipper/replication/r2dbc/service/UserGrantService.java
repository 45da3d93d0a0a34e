package com.pgskipper.replication.r2dbc.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.pgskipper.replication.core.model.GrantRequest;
import com.pgskipper.replication.core.model.ReconcileOutcome;
import com.pgskipper.replication.core.sql.Identifiers;
import com.pgskipper.replication.core.sql.RoleStatements;
import com.pgskipper.replication.r2dbc.connection.ConnectionProvider;
import com.pgskipper.replication.r2dbc.store.StatementExecutor;

import reactor.core.publisher.Mono;

/**
 * Grants the REPLICATION attribute to a database role.
 *
 * Runs on the default database and performs no existence pre-check: the grant
 * is idempotent on the server.
 */
@Service
public class UserGrantService {

	private static final Logger log = LoggerFactory.getLogger(UserGrantService.class);

	private final StatementExecutor executor;
	private final ConnectionProvider connections;

	public UserGrantService(StatementExecutor executor, ConnectionProvider connections) {
		this.executor = executor;
		this.connections = connections;
	}

	public Mono<ReconcileOutcome> grant(String requestId, GrantRequest request) {
		return Mono.defer(() -> {
			String username = Identifiers.requireSafe(request.username(), "username");
			return executor.execute(requestId, connections.defaultDatabase(), RoleStatements.grantReplication(username))
					.thenReturn(ReconcileOutcome.GRANTED)
					.doOnSuccess(o -> log.info("requestId={} User {} has been granted for Replication", requestId,
							username));
		}).doOnError(e -> log.error("requestId={} cannot grant user {} for Replication: {}", requestId,
				request.username(), e.getMessage()));
	}
}
