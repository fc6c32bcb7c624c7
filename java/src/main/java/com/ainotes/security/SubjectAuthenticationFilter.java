package com.ainotes.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;

/**
 * Filter that trusts the owner subject forwarded by the identity gateway.
 * The subject becomes the authentication principal.
 */
@Slf4j
public class SubjectAuthenticationFilter implements WebFilter {

    private final String subjectHeader;

    public SubjectAuthenticationFilter(String subjectHeader) {
        this.subjectHeader = subjectHeader;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // Skip authentication for public endpoints
        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String subject = exchange.getRequest().getHeaders().getFirst(subjectHeader);

        if (subject == null || subject.isBlank()) {
            log.warn("Missing {} header on {}", subjectHeader, path);
            exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
            return exchange.getResponse().setComplete();
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(subject.trim(), null, Collections.emptyList());

        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }

    private boolean isPublicEndpoint(String path) {
        return path.equals("/") || path.equals("/v1/health");
    }
}
