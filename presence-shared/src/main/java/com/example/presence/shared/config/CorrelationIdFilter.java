package com.example.presence.shared.config;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags each HTTP request and WebSocket upgrade with a correlation id: the caller's
 * {@code X-Correlation-ID} when it looks sane, a fresh UUID otherwise.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    // Ids end up in logs verbatim
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        String correlationId = incoming != null && ACCEPTED_ID.matcher(incoming).matches()
                ? incoming
                : UUID.randomUUID().toString();

        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return chain.filter(exchange)
                .contextWrite(context -> context.put(CORRELATION_ID_KEY, correlationId))
                .doFinally(signal -> MDC.remove(CORRELATION_ID_KEY));
    }
}
