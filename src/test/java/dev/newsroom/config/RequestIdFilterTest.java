package dev.newsroom.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("a well-formed upstream id is echoed and put in the context")
    void shouldKeepUpstreamId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/articles")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "abc-123"));
        AtomicReference<String> seen = new AtomicReference<>();

        StepVerifier.create(filter.filter(exchange, ex -> Mono.deferContextual(ctx -> {
                    seen.set(ctx.get(RequestIdFilter.REQUEST_ID_CONTEXT_KEY));
                    return Mono.empty();
                })))
                .verifyComplete();

        assertThat(seen.get()).isEqualTo("abc-123");
        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.CORRELATION_ID_HEADER)).isEqualTo("abc-123");
    }

    @Test
    @DisplayName("a malformed id is replaced with a generated one")
    void shouldReplaceMalformedId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/articles")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "<script>alert(1)</script>"));

        StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

        String id = exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(id).matches("^[a-f0-9]{16}$");
    }

    @Test
    @DisplayName("accept() bounds length and charset")
    void shouldValidateIds() {
        assertThat(RequestIdFilter.accept(null)).isNull();
        assertThat(RequestIdFilter.accept("")).isNull();
        assertThat(RequestIdFilter.accept("a".repeat(65))).isNull();
        assertThat(RequestIdFilter.accept("ok_ID-1")).isEqualTo("ok_ID-1");
    }
}
