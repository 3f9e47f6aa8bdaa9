package dev.newsroom.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with an id: taken from {@code X-Request-ID} when the
 * upstream sent a well-formed one, generated otherwise. The id is echoed in
 * the response and stored in the Reactor context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = accept(exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }
        String correlationId = accept(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        if (correlationId == null) {
            correlationId = requestId;
        }
        log.debug("Request {} {} id={}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), requestId);

        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        String id = requestId;
        String correlation = correlationId;
        return chain.filter(exchange)
                .contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, id, "correlationId", correlation));
    }

    static String accept(String value) {
        if (value == null || !VALID_ID.matcher(value).matches()) {
            return null;
        }
        return value;
    }
}
