package com.pgskipper.replication.admin;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.pgskipper.replication.core.error.HealthCheckTimeoutException;
import com.pgskipper.replication.core.model.HealthStatus;
import com.pgskipper.replication.r2dbc.health.ClusterHealthProbe;

import reactor.core.publisher.Mono;

/**
 * Liveness endpoint: runs one fresh cluster probe per call.
 *
 * A probe timeout is reported as 503 like any other outage; the process keeps
 * serving and the orchestrator decides what to do with an unhealthy instance.
 */
@RestController
public class HealthController {

	private static final Logger log = LoggerFactory.getLogger(HealthController.class);

	private final ClusterHealthProbe probe;

	public HealthController(ClusterHealthProbe probe) {
		this.probe = probe;
	}

	@GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<HealthResponse>> health() {
		return probe.check()
				.onErrorResume(HealthCheckTimeoutException.class, e -> {
					log.warn("Health check answered OUT_OF_SERVICE after {} timeout", e.getTimeout());
					return Mono.just(HealthStatus.OUT_OF_SERVICE);
				})
				.map(status -> ResponseEntity
						.status(status == HealthStatus.UP ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
						.body(new HealthResponse(status, Instant.now())));
	}

	public record HealthResponse(HealthStatus status, Instant checkedAt) {
	}
}
