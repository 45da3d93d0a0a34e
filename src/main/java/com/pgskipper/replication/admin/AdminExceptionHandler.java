package com.pgskipper.replication.admin;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import com.pgskipper.replication.core.error.InvalidRequestException;
import com.pgskipper.replication.core.error.PublicationConflictException;
import com.pgskipper.replication.core.error.PublicationNotFoundException;
import com.pgskipper.replication.core.error.UnexpectedDatabaseException;

/**
 * Centralized exception mapping for the admin API.
 *
 * Production characteristics:
 * - Request-level failures (validation, missing publication, duplicate
 *   object) are 400 with the reason, so automation can act on it.
 * - Unexpected database failures are 500 with a fixed message; the cause is
 *   logged server-side only. The process keeps running.
 * - One error shape for every failure: {@code {"code":..,"message":..}}.
 */
@RestControllerAdvice
public class AdminExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(AdminExceptionHandler.class);

	@ExceptionHandler(InvalidRequestException.class)
	public ResponseEntity<ApiError> badRequest(InvalidRequestException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	@ExceptionHandler(PublicationNotFoundException.class)
	public ResponseEntity<ApiError> notFound(PublicationNotFoundException e) {
		return ResponseEntity.badRequest().body(new ApiError("not_found", e.getMessage()));
	}

	@ExceptionHandler(PublicationConflictException.class)
	public ResponseEntity<ApiError> conflict(PublicationConflictException e) {
		return ResponseEntity.badRequest().body(new ApiError("conflict", e.getMessage()));
	}

	@ExceptionHandler(WebExchangeBindException.class)
	public ResponseEntity<ApiError> invalidBody(WebExchangeBindException e) {
		FieldError field = e.getFieldError();
		String message = field == null ? "Invalid request" : field.getDefaultMessage();
		return ResponseEntity.badRequest().body(new ApiError("bad_request", message));
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ResponseEntity<ApiError> status(ResponseStatusException e) {
		HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
		String code = status == null ? "error" : status.name().toLowerCase(Locale.ROOT);
		return ResponseEntity.status(e.getStatusCode()).body(new ApiError(code, e.getReason()));
	}

	@ExceptionHandler(UnexpectedDatabaseException.class)
	public ResponseEntity<ApiError> database(UnexpectedDatabaseException e) {
		log.error("Database failure (sqlState={})", e.getSqlState(), e);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
				.body(new ApiError("internal_error", "Request failed"));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ApiError> internal(Exception e) {
		log.error("Admin endpoint failure", e);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
				.body(new ApiError("internal_error", "Request failed"));
	}

	public record ApiError(String code, String message) {
	}
}
