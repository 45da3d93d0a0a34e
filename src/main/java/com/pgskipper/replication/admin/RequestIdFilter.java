package com.pgskipper.replication.admin;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

/**
 * Resolves the correlation id of every request.
 *
 * <ul>
 *   <li>An inbound {@value #HEADER} header is kept as-is.</li>
 *   <li>Otherwise a random UUID is generated and added to the request, so
 *       handlers can always read the header.</li>
 *   <li>The id is echoed on the response, including authentication failures
 *       (this filter runs ahead of the security chain).</li>
 * </ul>
 *
 * Handlers pass the id down to the services explicitly; there is no
 * thread-bound logging context in a reactive pipeline.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter implements WebFilter {

    public static final String HEADER = "X-Request-ID";

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String inbound = exchange.getRequest().getHeaders().getFirst(HEADER);
        String requestId = (inbound == null || inbound.isBlank()) ? UUID.randomUUID().toString() : inbound;

        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> headers.set(HEADER, requestId))
                .build();
        exchange.getResponse().getHeaders().set(HEADER, requestId);

        log.debug("{} {} requestId={}", request.getMethod(), request.getPath().value(), requestId);
        return chain.filter(exchange.mutate().request(request).build());
    }
}
