package com.pgskipper.replication.r2dbc.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import com.pgskipper.replication.core.error.ReplicationControllerException;
import com.pgskipper.replication.core.error.UnexpectedDatabaseException;
import com.pgskipper.replication.core.model.Publication;
import com.pgskipper.replication.core.model.PublishedTable;
import com.pgskipper.replication.core.sql.PublicationStatements;
import com.pgskipper.replication.r2dbc.connection.ConnectionProvider;

import io.r2dbc.spi.Connection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Catalog access for publications ({@code pg_publication},
 * {@code pg_publication_tables}).
 *
 * A lookup opens one connection to the publication's database, runs the
 * publication query and, when tables are requested, the member-table query on
 * that same connection, then closes it.
 *
 * NOT FOUND is an empty {@link Mono}: either no row matched, or the database
 * itself does not exist (SQLSTATE {@code 3D000}). Every other failure surfaces
 * as {@link UnexpectedDatabaseException}.
 */
@Repository
public class PublicationRepository {

	private static final Logger log = LoggerFactory.getLogger(PublicationRepository.class);

	private final ConnectionProvider connections;

	public PublicationRepository(ConnectionProvider connections) {
		this.connections = connections;
	}

	public Mono<Publication> lookup(String requestId, String database, String publication, boolean withTables) {
		return connections.withConnection(database, conn -> findPublication(conn, database, publication)
				.flatMap(found -> withTables
						? findTables(conn, publication).map(found::withTables)
						: Mono.just(found)))
				.singleOrEmpty()
				.doOnNext(found -> log.debug("requestId={} found publication {} in database {} (owner={})",
						requestId, publication, database, found.owner()))
				.onErrorResume(SqlStates::isDatabaseMissing, e -> {
					log.info("requestId={} database {} does not exist", requestId, database);
					return Mono.empty();
				})
				.onErrorMap(e -> !(e instanceof ReplicationControllerException),
						e -> new UnexpectedDatabaseException(
								"Cannot get publication " + publication + " for database " + database,
								SqlStates.of(e).orElse(null), e));
	}

	private Mono<Publication> findPublication(Connection conn, String database, String publication) {
		return Flux.from(conn.createStatement(PublicationStatements.SELECT_PUBLICATION)
						.bind(0, publication)
						.execute())
				.flatMap(result -> result.map((row, meta) -> new Publication(
						row.get("pubname", String.class),
						row.get("owner", String.class),
						database,
						null)))
				.singleOrEmpty();
	}

	private Mono<Map<String, List<PublishedTable>>> findTables(Connection conn, String publication) {
		return Flux.from(conn.createStatement(PublicationStatements.SELECT_PUBLICATION_TABLES)
						.bind(0, publication)
						.execute())
				.flatMap(result -> result.map((row, meta) -> new TableRow(
						row.get("schemaname", String.class),
						new PublishedTable(
								row.get("tablename", String.class),
								PublishedTable.parseAttributeArray(row.get("attnames", String.class)),
								row.get("rowfilter", String.class)))))
				.collect(LinkedHashMap::new, (Map<String, List<PublishedTable>> bySchema, TableRow row) -> bySchema
						.computeIfAbsent(row.schema(), schema -> new ArrayList<>())
						.add(row.table()));
	}

	private record TableRow(String schema, PublishedTable table) {
	}
}
