package com.pgskipper.replication.r2dbc.store;

import static com.pgskipper.replication.r2dbc.R2dbcMocks.answer;
import static com.pgskipper.replication.r2dbc.R2dbcMocks.connection;
import static com.pgskipper.replication.r2dbc.R2dbcMocks.fail;
import static com.pgskipper.replication.r2dbc.R2dbcMocks.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pgskipper.replication.core.error.UnexpectedDatabaseException;
import com.pgskipper.replication.core.model.PublishedTable;
import com.pgskipper.replication.core.sql.PublicationStatements;
import com.pgskipper.replication.r2dbc.StubConnectionProvider;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import reactor.test.StepVerifier;

class PublicationRepositoryTest {

	private static final String REQUEST_ID = "req-1";

	private Connection conn;
	private StubConnectionProvider connections;
	private PublicationRepository underTest;

	@BeforeEach
	void setupTest() {
		conn = connection();
		connections = new StubConnectionProvider().with("salesdb", conn);
		underTest = new PublicationRepository(connections);
	}

	@Test
	void shouldReturnPublicationWithoutTables() {
		answer(conn, PublicationStatements.SELECT_PUBLICATION,
				List.of(row("pubname", "sales_pub", "owner", "postgres")));

		StepVerifier.create(underTest.lookup(REQUEST_ID, "salesdb", "sales_pub", false))
				.assertNext(publication -> {
					assertThat(publication.name()).isEqualTo("sales_pub");
					assertThat(publication.owner()).isEqualTo("postgres");
					assertThat(publication.database()).isEqualTo("salesdb");
					assertThat(publication.tables()).isNull();
				})
				.verifyComplete();

		verify(conn, never()).createStatement(PublicationStatements.SELECT_PUBLICATION_TABLES);
		verify(conn).close();
	}

	@Test
	void shouldGroupTablesBySchemaOnTheSameConnection() {
		answer(conn, PublicationStatements.SELECT_PUBLICATION,
				List.of(row("pubname", "sales_pub", "owner", "postgres")));
		answer(conn, PublicationStatements.SELECT_PUBLICATION_TABLES, List.of(
				row("schemaname", "public", "tablename", "items", "attnames", "{}", "rowfilter", ""),
				row("schemaname", "public", "tablename", "orders", "attnames", "{id,total}", "rowfilter",
						"(total > 0)"),
				row("schemaname", "crm", "tablename", "customers", "attnames", "{id}", "rowfilter", "")));

		StepVerifier.create(underTest.lookup(REQUEST_ID, "salesdb", "sales_pub", true))
				.assertNext(publication -> {
					assertThat(publication.tables()).containsOnlyKeys("public", "crm");
					assertThat(publication.tables().get("public")).containsExactly(
							new PublishedTable("items", List.of(), ""),
							new PublishedTable("orders", List.of("id", "total"), "(total > 0)"));
					assertThat(publication.tables().get("crm"))
							.containsExactly(new PublishedTable("customers", List.of("id"), ""));
				})
				.verifyComplete();

		assertThat(connections.opened()).containsExactly("salesdb");
		verify(conn).close();
	}

	@Test
	void shouldBeEmptyWhenNoRowMatches() {
		StepVerifier.create(underTest.lookup(REQUEST_ID, "salesdb", "missing_pub", true))
				.verifyComplete();

		verify(conn, never()).createStatement(PublicationStatements.SELECT_PUBLICATION_TABLES);
		verify(conn).close();
	}

	@Test
	void shouldBeEmptyWhenDatabaseDoesNotExist() {
		connections.failing("nodb", new R2dbcNonTransientResourceException("database \"nodb\" does not exist",
				SqlStates.INVALID_CATALOG_NAME));

		StepVerifier.create(underTest.lookup(REQUEST_ID, "nodb", "sales_pub", false))
				.verifyComplete();
	}

	@Test
	void shouldWrapOtherFailures() {
		fail(conn, PublicationStatements.SELECT_PUBLICATION,
				new R2dbcBadGrammarException("permission denied", "42501"));

		StepVerifier.create(underTest.lookup(REQUEST_ID, "salesdb", "sales_pub", false))
				.expectErrorSatisfies(e -> {
					assertThat(e).isInstanceOf(UnexpectedDatabaseException.class);
					assertThat(((UnexpectedDatabaseException) e).getSqlState()).isEqualTo("42501");
				})
				.verify();

		verify(conn).close();
	}
}
