package dev.newsroom.controller;

import dev.newsroom.entity.User;
import dev.newsroom.exception.GlobalExceptionHandler;
import dev.newsroom.security.JwtAuthenticationFilter;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.server.WebFilter;

/**
 * Binds a controller with the real exception handler and, optionally, an
 * authenticated user placed where the JWT filter would put it.
 */
final class ControllerTestSupport {

    private ControllerTestSupport() {
    }

    static WebTestClient bind(Object controller, User actor) {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        WebFilter authenticated = (exchange, chain) -> {
            if (actor != null) {
                exchange.getAttributes().put(JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR, actor);
            }
            return chain.filter(exchange);
        };
        return WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler(messageSource))
                .webFilter(authenticated)
                .configureClient()
                .build();
    }
}
