package dev.newsroom.service;

import dev.newsroom.entity.User;
import dev.newsroom.exception.ActionDeniedException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.security.AccessControlGate;
import dev.newsroom.security.AccessTarget;
import dev.newsroom.security.Action;
import dev.newsroom.security.Decision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Reactive wrapper around {@link AccessControlGate}: a denial becomes an
 * {@link ActionDeniedException} error signal, logged and counted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessService {

    private final AccessControlGate gate;
    private final NewsroomMetrics metrics;

    /**
     * Completes empty when allowed, errors with {@link ActionDeniedException} otherwise.
     */
    public Mono<Void> require(User actor, Action action, AccessTarget target) {
        Decision decision = gate.authorize(actor, action, target);
        if (decision.allowed()) {
            return Mono.empty();
        }
        log.warn("Denied {} for user {}: {}", action, actor != null ? actor.getId() : "anonymous", decision.reason());
        metrics.accessDenied(action, decision.reason());
        return Mono.error(ActionDeniedException.of(action, decision));
    }
}
