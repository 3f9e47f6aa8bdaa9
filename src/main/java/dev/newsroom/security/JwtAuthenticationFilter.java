package dev.newsroom.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;

/**
 * Authenticates bearer tokens and exposes the loaded {@link User} as the
 * {@value #AUTHENTICATED_USER_ATTR} exchange attribute. Controllers pass that
 * user explicitly to services as the acting identity.
 */
@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    public static final String AUTHENTICATED_USER_ATTR = "authenticatedUser";

    private final JwtTokenProvider tokenProvider;
    private final UserRepository userRepository;

    /**
     * Short-lived cache to avoid a DB lookup on every authenticated request.
     * Deactivated users are locked out within the TTL.
     */
    private final Cache<String, User> userCache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofSeconds(60))
            .build();

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, UserRepository userRepository) {
        this.tokenProvider = tokenProvider;
        this.userRepository = userRepository;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            if (isExemptPath(path)) {
                return chain.filter(exchange);
            }
            log.warn("Access denied: {} for path: {}", validation.error(), path);
            return unauthorizedResponse(exchange, validation.error());
        }

        String username = validation.claims().getSubject();
        String role = validation.claims().get("role", String.class);
        return authenticateUser(exchange, chain, username, role);
    }

    private Mono<Void> authenticateUser(ServerWebExchange exchange, WebFilterChain chain, String username, String role) {
        try {
            UserRole.fromValue(role);
        } catch (IllegalArgumentException e) {
            log.warn("Access denied: invalid role '{}' for user: {}", role, username);
            return unauthorizedResponse(exchange, "Invalid role");
        }

        User cached = userCache.getIfPresent(username);
        Mono<User> userMono = cached != null
                ? Mono.just(cached)
                : userRepository.findByUsername(username)
                        .doOnNext(u -> userCache.put(username, u));

        return userMono
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                // Must sit before flatMap: chain.filter() completes empty, which would trip switchIfEmpty.
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Access denied: user not found or inactive: {}", username);
                    return unauthorizedResponse(exchange, "User not found or inactive")
                            .then(Mono.empty());
                }))
                .flatMap(user -> {
                    log.debug("Authentication successful for user: {}", username);
                    exchange.getAttributes().put(AUTHENTICATED_USER_ATTR, user);
                    var auth = new UsernamePasswordAuthenticationToken(
                            username, null,
                            Collections.singleton(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
                });
    }

    private String getJwtFromRequest(ServerWebExchange exchange) {
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    private boolean isExemptPath(String path) {
        return path.startsWith("/api/v1/auth/");
    }

    /** 401 JSON body with the message escaped. */
    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        String body = "{\"error\":\"Unauthorized\",\"code\":\"UNAUTHENTICATED\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
