package dev.newsroom.service;

import dev.newsroom.entity.User;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ActionDeniedException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.security.AccessControlGate;
import dev.newsroom.security.AccessTarget;
import dev.newsroom.security.Action;
import dev.newsroom.security.DenialReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class AccessServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private AccessService accessService;

    private final User reader = User.builder().id(4L).role(UserRole.READER).build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        NewsroomMetrics metrics = new NewsroomMetrics(meterRegistry);
        metrics.init();
        accessService = new AccessService(new AccessControlGate(), metrics);
    }

    @Test
    @DisplayName("an allowed action completes empty")
    void shouldCompleteWhenAllowed() {
        StepVerifier.create(accessService.require(reader, Action.SUBSCRIBE, AccessTarget.none())).verifyComplete();
    }

    @Test
    @DisplayName("a denial errors with the reason and is counted")
    void shouldErrorWhenDenied() {
        StepVerifier.create(accessService.require(reader, Action.CREATE_NEWSLETTER, AccessTarget.none()))
                .expectErrorSatisfies(e -> {
                    ActionDeniedException denied = (ActionDeniedException) e;
                    assertThat(denied.getAction()).isEqualTo(Action.CREATE_NEWSLETTER);
                    assertThat(denied.getReason()).isEqualTo(DenialReason.NOT_JOURNALIST);
                })
                .verify();

        assertThat(meterRegistry.counter("newsroom.access.denied",
                "action", "create_newsletter", "reason", "not_journalist").count()).isEqualTo(1.0);
    }
}
