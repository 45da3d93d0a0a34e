package com.pgskipper.replication.admin;

import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.pgskipper.replication.core.error.PublicationNotFoundException;
import com.pgskipper.replication.core.model.Publication;
import com.pgskipper.replication.core.model.PublicationRequest;
import com.pgskipper.replication.core.model.ReconcileOutcome;
import com.pgskipper.replication.r2dbc.service.PublicationReconciler;

import reactor.core.publisher.Mono;

/**
 * Administrative endpoints for logical-replication publications.
 *
 * Production posture:
 * - Protected by basic authentication (see {@link ApiSecurityConfig}).
 * - Mutations answer plain-text {@code OK}; whether anything was executed is
 *   logged, not returned.
 * - Failures are mapped centrally by {@link AdminExceptionHandler}. The only
 *   route-specific mapping is GET answering 404 for a missing publication.
 */
@RestController
@RequestMapping(path = "/publications")
@Validated
public class PublicationAdminController {

	private final PublicationReconciler reconciler;

	public PublicationAdminController(PublicationReconciler reconciler) {
		this.reconciler = reconciler;
	}

	@GetMapping(path = "/{database}/{publication}", produces = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<Publication>> get(@PathVariable("database") String database,
			@PathVariable("publication") String publication,
			@RequestParam(name = "withTables", defaultValue = "false") boolean withTables,
			@RequestHeader(name = RequestIdFilter.HEADER, required = false) String requestId) {
		return reconciler.get(requestId, database, publication, withTables)
				.map(ResponseEntity::ok)
				.onErrorResume(PublicationNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().<Publication>build()));
	}

	@PostMapping(path = "/create", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<String>> create(@Valid @RequestBody(required = false) PublicationRequest request,
			@RequestHeader(name = RequestIdFilter.HEADER, required = false) String requestId) {
		return ok(reconciler.create(requestId, orEmpty(request)));
	}

	@PostMapping(path = "/alter/add", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<String>> alterAdd(@Valid @RequestBody(required = false) PublicationRequest request,
			@RequestHeader(name = RequestIdFilter.HEADER, required = false) String requestId) {
		return ok(reconciler.alterAdd(requestId, orEmpty(request)));
	}

	@PostMapping(path = "/alter/set", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<String>> alterSet(@Valid @RequestBody(required = false) PublicationRequest request,
			@RequestHeader(name = RequestIdFilter.HEADER, required = false) String requestId) {
		return ok(reconciler.alterSet(requestId, orEmpty(request)));
	}

	@DeleteMapping(path = "/drop", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<String>> drop(@Valid @RequestBody(required = false) PublicationRequest request,
			@RequestHeader(name = RequestIdFilter.HEADER, required = false) String requestId) {
		return ok(reconciler.drop(requestId, orEmpty(request)));
	}

	/**
	 * A request without a body is handled as an empty request, which the
	 * reconciler then rejects with the first missing field.
	 */
	static PublicationRequest orEmpty(PublicationRequest request) {
		return request != null ? request : PublicationRequest.of(null, null);
	}

	static Mono<ResponseEntity<String>> ok(Mono<ReconcileOutcome> outcome) {
		return outcome.thenReturn(ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("OK"));
	}
}
