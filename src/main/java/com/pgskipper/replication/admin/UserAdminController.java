package com.pgskipper.replication.admin;

import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.pgskipper.replication.core.model.GrantRequest;
import com.pgskipper.replication.r2dbc.service.UserGrantService;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/users")
public class UserAdminController {

	private final UserGrantService grants;

	public UserAdminController(UserGrantService grants) {
		this.grants = grants;
	}

	/**
	 * Grants the REPLICATION attribute to {@code username}.
	 */
	@PostMapping(path = "/grant", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<String>> grant(@Valid @RequestBody(required = false) GrantRequest request,
			@RequestHeader(name = RequestIdFilter.HEADER, required = false) String requestId) {
		return PublicationAdminController.ok(grants.grant(requestId, request != null ? request : new GrantRequest(null)));
	}
}
