package com.pgskipper.replication.admin;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.pgskipper.replication.core.error.PublicationConflictException;
import com.pgskipper.replication.core.error.PublicationNotFoundException;
import com.pgskipper.replication.core.error.UnexpectedDatabaseException;
import com.pgskipper.replication.core.model.Publication;
import com.pgskipper.replication.core.model.PublicationRequest;
import com.pgskipper.replication.core.model.PublishedTable;
import com.pgskipper.replication.core.model.ReconcileOutcome;
import com.pgskipper.replication.r2dbc.service.PublicationReconciler;

import reactor.core.publisher.Mono;

@WebFluxTest(controllers = PublicationAdminController.class)
@Import({ApiSecurityConfig.class, JacksonConfig.class})
class PublicationAdminControllerTest {

	private static final String USER = "logical-repl-user";
	private static final String PASSWORD = "logical-repl-password";

	@Autowired
	private WebTestClient client;

	@MockBean
	private PublicationReconciler reconciler;

	@Test
	void shouldRequireCredentials() {
		client.post().uri("/publications/create")
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb"))
				.exchange()
				.expectStatus().isUnauthorized();

		verifyNoInteractions(reconciler);
	}

	@Test
	void shouldRejectWrongPassword() {
		client.get().uri("/publications/salesdb/sales_pub")
				.headers(h -> h.setBasicAuth(USER, "wrong"))
				.exchange()
				.expectStatus().isUnauthorized();
	}

	@Test
	void shouldAnswerOkOnCreate() {
		when(reconciler.create(anyString(), any(PublicationRequest.class)))
				.thenReturn(Mono.just(ReconcileOutcome.CREATED));

		client.post().uri("/publications/create")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.header(RequestIdFilter.HEADER, "req-42")
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb",
						"tables", List.of("public.orders", "public.orders")))
				.exchange()
				.expectStatus().isOk()
				.expectHeader().valueEquals(RequestIdFilter.HEADER, "req-42")
				.expectBody(String.class).isEqualTo("OK");

		verify(reconciler).create(eq("req-42"),
				eq(new PublicationRequest("sales_pub", "salesdb", List.of("public.orders"), List.of())));
	}

	@Test
	void shouldAnswerOkWhenCreateFindsExistingPublication() {
		when(reconciler.create(anyString(), any(PublicationRequest.class)))
				.thenReturn(Mono.just(ReconcileOutcome.UNCHANGED));

		client.post().uri("/publications/create")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb"))
				.exchange()
				.expectStatus().isOk()
				.expectHeader().exists(RequestIdFilter.HEADER)
				.expectBody(String.class).isEqualTo("OK");
	}

	@Test
	void shouldRejectBlankPublicationName() {
		client.post().uri("/publications/alter/add")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "", "database", "salesdb", "tables", List.of("orders")))
				.exchange()
				.expectStatus().isBadRequest()
				.expectBody()
				.jsonPath("$.code").isEqualTo("bad_request")
				.jsonPath("$.message").isEqualTo("publicationName must not be empty");

		verifyNoInteractions(reconciler);
	}

	@Test
	void shouldReportAlterOfAbsentPublicationAsBadRequest() {
		when(reconciler.alterAdd(anyString(), any(PublicationRequest.class)))
				.thenReturn(Mono.error(new PublicationNotFoundException("salesdb", "sales_pub")));

		client.post().uri("/publications/alter/add")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb", "tables", List.of("orders")))
				.exchange()
				.expectStatus().isBadRequest()
				.expectBody()
				.jsonPath("$.code").isEqualTo("not_found")
				.jsonPath("$.message").isEqualTo("Publication sales_pub does not exist in database salesdb");
	}

	@Test
	void shouldReportConflictOnAlterSet() {
		when(reconciler.alterSet(anyString(), any(PublicationRequest.class)))
				.thenReturn(Mono.error(new PublicationConflictException("already member", null)));

		client.post().uri("/publications/alter/set")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb", "schemas", List.of("crm")))
				.exchange()
				.expectStatus().isBadRequest()
				.expectBody()
				.jsonPath("$.code").isEqualTo("conflict");
	}

	@Test
	void shouldHideDatabaseFailureDetails() {
		when(reconciler.drop(anyString(), any(PublicationRequest.class)))
				.thenReturn(Mono.error(new UnexpectedDatabaseException("password authentication failed", "28P01", null)));

		client.method(HttpMethod.DELETE).uri("/publications/drop")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb"))
				.exchange()
				.expectStatus().is5xxServerError()
				.expectBody()
				.jsonPath("$.code").isEqualTo("internal_error")
				.jsonPath("$.message").isEqualTo("Request failed");
	}

	@Test
	void shouldAnswerOkOnDrop() {
		when(reconciler.drop(anyString(), any(PublicationRequest.class)))
				.thenReturn(Mono.just(ReconcileOutcome.UNCHANGED));

		client.method(HttpMethod.DELETE).uri("/publications/drop")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(Map.of("publicationName", "sales_pub", "database", "salesdb"))
				.exchange()
				.expectStatus().isOk()
				.expectBody(String.class).isEqualTo("OK");
	}

	@Test
	void shouldRenderPublicationWithTables() {
		Publication publication = new Publication("sales_pub", "postgres", "salesdb", Map.of("public", List.of(
				new PublishedTable("orders", List.of("id", "total"), "(total > 0)"),
				new PublishedTable("items", List.of(), ""))));
		when(reconciler.get(anyString(), eq("salesdb"), eq("sales_pub"), eq(true))).thenReturn(Mono.just(publication));

		client.get().uri("/publications/salesdb/sales_pub?withTables=true")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.exchange()
				.expectStatus().isOk()
				.expectBody()
				.jsonPath("$.name").isEqualTo("sales_pub")
				.jsonPath("$.owner").isEqualTo("postgres")
				.jsonPath("$.database").isEqualTo("salesdb")
				.jsonPath("$.tables.public[0].name").isEqualTo("orders")
				.jsonPath("$.tables.public[0].attrNames[1]").isEqualTo("total")
				.jsonPath("$.tables.public[0].rowfilter").isEqualTo("(total > 0)")
				.jsonPath("$.tables.public[1].rowfilter").doesNotExist();
	}

	@Test
	void shouldOmitTablesUnlessRequested() {
		when(reconciler.get(anyString(), eq("salesdb"), eq("sales_pub"), eq(false)))
				.thenReturn(Mono.just(new Publication("sales_pub", "postgres", "salesdb", null)));

		client.get().uri("/publications/salesdb/sales_pub")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.exchange()
				.expectStatus().isOk()
				.expectBody()
				.jsonPath("$.name").isEqualTo("sales_pub")
				.jsonPath("$.tables").doesNotExist();
	}

	@Test
	void shouldAnswerNotFoundForAbsentPublication() {
		when(reconciler.get(anyString(), anyString(), anyString(), eq(false)))
				.thenReturn(Mono.error(new PublicationNotFoundException("salesdb", "missing")));

		client.get().uri("/publications/salesdb/missing")
				.headers(h -> h.setBasicAuth(USER, PASSWORD))
				.exchange()
				.expectStatus().isNotFound();
	}
}
