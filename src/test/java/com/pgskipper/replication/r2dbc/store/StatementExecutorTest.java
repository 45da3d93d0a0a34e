package com.pgskipper.replication.r2dbc.store;

import static com.pgskipper.replication.r2dbc.R2dbcMocks.connection;
import static com.pgskipper.replication.r2dbc.R2dbcMocks.fail;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pgskipper.replication.core.error.PublicationConflictException;
import com.pgskipper.replication.core.error.PublicationNotFoundException;
import com.pgskipper.replication.core.error.UnexpectedDatabaseException;
import com.pgskipper.replication.r2dbc.StubConnectionProvider;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import reactor.test.StepVerifier;

class StatementExecutorTest {

	private static final String DDL = "ALTER PUBLICATION \"sales_pub\" ADD TABLE \"orders\"";

	private Connection conn;
	private StubConnectionProvider connections;
	private StatementExecutor underTest;

	@BeforeEach
	void setupTest() {
		conn = connection();
		connections = new StubConnectionProvider().with("salesdb", conn);
		underTest = new StatementExecutor(connections);
	}

	@Test
	void shouldExecuteOnTargetDatabaseAndClose() {
		StepVerifier.create(underTest.execute("req-1", "salesdb", DDL))
				.verifyComplete();

		verify(conn).createStatement(DDL);
		verify(conn).close();
		assertThat(connections.opened()).containsExactly("salesdb");
	}

	@Test
	void shouldNotConnectBeforeSubscription() {
		underTest.execute("req-1", "salesdb", DDL);

		assertThat(connections.opened()).isEmpty();
	}

	@Test
	void shouldReportDuplicateObjectAsConflict() {
		fail(conn, DDL, new R2dbcDataIntegrityViolationException(
				"relation \"orders\" is already member of publication \"sales_pub\"", SqlStates.DUPLICATE_OBJECT));

		StepVerifier.create(underTest.execute("req-1", "salesdb", DDL))
				.expectErrorSatisfies(e -> assertThat(e)
						.isInstanceOf(PublicationConflictException.class)
						.hasMessageContaining("already member"))
				.verify();

		verify(conn).close();
	}

	@Test
	void shouldReportMissingDatabaseAsNotFound() {
		connections.failing("nodb", new R2dbcNonTransientResourceException("database \"nodb\" does not exist",
				SqlStates.INVALID_CATALOG_NAME));

		StepVerifier.create(underTest.execute("req-1", "nodb", DDL))
				.expectErrorSatisfies(e -> {
					assertThat(e).isInstanceOf(PublicationNotFoundException.class);
					PublicationNotFoundException notFound = (PublicationNotFoundException) e;
					assertThat(notFound.getDatabase()).isEqualTo("nodb");
					assertThat(notFound.getPublication()).isNull();
					assertThat(notFound).hasMessage("Database nodb does not exist");
				})
				.verify();
	}

	@Test
	void shouldWrapAnyOtherFailure() {
		fail(conn, DDL, new R2dbcBadGrammarException("syntax error", "42601"));

		StepVerifier.create(underTest.execute("req-1", "salesdb", DDL))
				.expectError(UnexpectedDatabaseException.class)
				.verify();

		verify(conn).close();
	}
}
