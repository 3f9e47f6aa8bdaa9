package dev.newsroom.metrics;

import dev.newsroom.entity.ArticleStatus;
import dev.newsroom.security.Action;
import dev.newsroom.security.DenialReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class NewsroomMetrics {

    private final MeterRegistry meterRegistry;

    private Counter articleCreatedCounter;
    private Counter articleSubmittedCounter;
    private Counter newsletterCreatedCounter;
    private Counter subscriptionNewCounter;
    private Counter subscriptionCancelledCounter;
    private Counter staleDecisionCounter;

    @PostConstruct
    public void init() {
        articleCreatedCounter = meterRegistry.counter("newsroom.articles.created");
        articleSubmittedCounter = meterRegistry.counter("newsroom.articles.submitted");
        newsletterCreatedCounter = meterRegistry.counter("newsroom.newsletters.created");
        subscriptionNewCounter = meterRegistry.counter("newsroom.subscriptions.new");
        subscriptionCancelledCounter = meterRegistry.counter("newsroom.subscriptions.cancelled");
        staleDecisionCounter = meterRegistry.counter("newsroom.articles.decision.conflicts");
    }

    public void articleCreated() {
        articleCreatedCounter.increment();
    }

    public void articleSubmitted() {
        articleSubmittedCounter.increment();
    }

    public void articleDecided(ArticleStatus outcome) {
        meterRegistry.counter("newsroom.articles.decided", "status", outcome.name().toLowerCase(Locale.ROOT))
                .increment();
    }

    /** A moderation decision lost the race against another one. */
    public void decisionConflict() {
        staleDecisionCounter.increment();
    }

    public void newsletterCreated() {
        newsletterCreatedCounter.increment();
    }

    public void subscriptionCreated() {
        subscriptionNewCounter.increment();
    }

    public void subscriptionCancelled() {
        subscriptionCancelledCounter.increment();
    }

    public void accessDenied(Action action, DenialReason reason) {
        meterRegistry.counter("newsroom.access.denied",
                "action", action.name().toLowerCase(Locale.ROOT),
                "reason", reason.name().toLowerCase(Locale.ROOT)).increment();
    }
}
