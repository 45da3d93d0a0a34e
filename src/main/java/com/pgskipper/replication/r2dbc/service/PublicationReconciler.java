package com.pgskipper.replication.r2dbc.service;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.pgskipper.replication.core.error.InvalidRequestException;
import com.pgskipper.replication.core.error.PublicationNotFoundException;
import com.pgskipper.replication.core.model.Publication;
import com.pgskipper.replication.core.model.PublicationRequest;
import com.pgskipper.replication.core.model.ReconcileOutcome;
import com.pgskipper.replication.core.sql.Identifiers;
import com.pgskipper.replication.core.sql.PublicationStatements;
import com.pgskipper.replication.r2dbc.store.PublicationRepository;
import com.pgskipper.replication.r2dbc.store.StatementExecutor;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * PublicationReconciler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Applies a desired publication state with idempotent semantics.
 *
 * Existence is always re-read from the catalog before acting; nothing is
 * cached between requests. PostgreSQL's publication DDL has no uniform
 * IF [NOT] EXISTS, so the lookup is what makes create and drop idempotent.
 *
 * DECISION TABLE
 * --------------
 *
 *   operation │ absent            │ present, no members │ present, members
 *   ──────────┼───────────────────┼─────────────────────┼──────────────────
 *   create    │ CREATE → CREATED  │ UNCHANGED           │ UNCHANGED
 *   alterAdd  │ NotFound          │ InvalidRequest      │ ALTER ADD → ALTERED
 *   alterSet  │ NotFound          │ InvalidRequest      │ ALTER SET → ALTERED
 *   drop      │ UNCHANGED         │ DROP → DROPPED      │ DROP → DROPPED
 *   get       │ NotFound          │ publication         │ publication
 *
 * - create does NOT reconcile membership of an existing publication; use
 *   alterSet for that.
 * - An alter request without tables and schemas is rejected before any
 *   database round trip.
 * - A duplicate-object failure of ALTER is returned as a conflict.
 *
 * Every call takes the request correlation id, which is carried into all log
 * lines of the operation.
 */
@Service
public class PublicationReconciler {

	private static final Logger log = LoggerFactory.getLogger(PublicationReconciler.class);

	private final PublicationRepository repository;
	private final StatementExecutor executor;

	public PublicationReconciler(PublicationRepository repository, StatementExecutor executor) {
		this.repository = repository;
		this.executor = executor;
	}

	public Mono<Publication> get(String requestId, String database, String publication, boolean withTables) {
		return Mono.defer(() -> {
			validateNames(publication, database);
			log.info("requestId={} Get publication {} for database {}", requestId, publication, database);
			return repository.lookup(requestId, database, publication, withTables);
		})
				.switchIfEmpty(Mono.error(() -> new PublicationNotFoundException(database, publication)))
				.doOnNext(found -> log.info("requestId={} Publication {} has been get for database {}", requestId,
						publication, database));
	}

	public Mono<ReconcileOutcome> create(String requestId, PublicationRequest request) {
		return Mono.defer(() -> {
			validate(request);
			log.info("requestId={} Publication {} creation started for database {}", requestId,
					request.publicationName(), request.database());

			return exists(requestId, request).flatMap(present -> {
				if (present) {
					log.info("requestId={} Publication {} already exists in database {}", requestId,
							request.publicationName(), request.database());
					return Mono.just(ReconcileOutcome.UNCHANGED);
				}
				String ddl = PublicationStatements.create(request.publicationName(), request.tables(),
						request.schemas());
				return executor.execute(requestId, request.database(), ddl)
						.thenReturn(ReconcileOutcome.CREATED)
						.doOnSuccess(o -> log.info("requestId={} Publication {} has been created for database {}",
								requestId, request.publicationName(), request.database()));
			});
		});
	}

	public Mono<ReconcileOutcome> alterAdd(String requestId, PublicationRequest request) {
		return alter(requestId, request, "add",
				() -> PublicationStatements.alterAdd(request.publicationName(), request.tables(), request.schemas()));
	}

	public Mono<ReconcileOutcome> alterSet(String requestId, PublicationRequest request) {
		return alter(requestId, request, "set",
				() -> PublicationStatements.alterSet(request.publicationName(), request.tables(), request.schemas()));
	}

	public Mono<ReconcileOutcome> drop(String requestId, PublicationRequest request) {
		return Mono.defer(() -> {
			validateNames(request.publicationName(), request.database());
			log.info("requestId={} Publication {} drop started for database {}", requestId,
					request.publicationName(), request.database());

			return exists(requestId, request).flatMap(present -> {
				if (!present) {
					log.info("requestId={} Publication {} doesn't exist in database {}", requestId,
							request.publicationName(), request.database());
					return Mono.just(ReconcileOutcome.UNCHANGED);
				}
				return executor.execute(requestId, request.database(),
								PublicationStatements.drop(request.publicationName()))
						.thenReturn(ReconcileOutcome.DROPPED)
						.doOnSuccess(o -> log.info("requestId={} Publication {} has been dropped for database {}",
								requestId, request.publicationName(), request.database()));
			});
		});
	}

	private Mono<ReconcileOutcome> alter(String requestId, PublicationRequest request, String verb,
			Supplier<String> statement) {
		return Mono.defer(() -> {
			validate(request);
			if (!request.hasMembers()) {
				String message = String.format("Nothing to add to publication %s in database %s",
						request.publicationName(), request.database());
				log.error("requestId={} {}", requestId, message);
				return Mono.error(new InvalidRequestException(message));
			}
			log.info("requestId={} Publication {} alter {} started for database {}", requestId,
					request.publicationName(), verb, request.database());

			return exists(requestId, request).flatMap(present -> {
				if (!present) {
					log.info("requestId={} Publication {} doesn't exist in database {}", requestId,
							request.publicationName(), request.database());
					return Mono.error(new PublicationNotFoundException(request.database(), request.publicationName()));
				}
				return executor.execute(requestId, request.database(), statement.get())
						.thenReturn(ReconcileOutcome.ALTERED)
						.doOnSuccess(o -> log.info("requestId={} Publication {} has been altered for database {}",
								requestId, request.publicationName(), request.database()));
			});
		});
	}

	private Mono<Boolean> exists(String requestId, PublicationRequest request) {
		return repository.lookup(requestId, request.database(), request.publicationName(), false).hasElement();
	}

	private static void validate(PublicationRequest request) {
		validateNames(request.publicationName(), request.database());
		request.tables().forEach(table -> Identifiers.requireSafe(table, "table"));
		request.schemas().forEach(schema -> Identifiers.requireSafe(schema, "schema"));
	}

	private static void validateNames(String publication, String database) {
		if (database == null || database.isEmpty()) {
			throw new InvalidRequestException("database must not be empty");
		}
		if (publication == null || publication.isEmpty()) {
			throw new InvalidRequestException("publicationName must not be empty");
		}
		Identifiers.requireSafe(database, "database");
		Identifiers.requireSafe(publication, "publicationName");
	}
}
