package dev.newsroom.security;

import dev.newsroom.domain.PublisherTeam;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.Subscription;

/**
 * The entity an action is aimed at, as a snapshot supplied by the caller.
 */
public sealed interface AccessTarget
        permits AccessTarget.None, AccessTarget.ArticleTarget, AccessTarget.TeamTarget, AccessTarget.SubscriptionTarget {

    /** For creation actions that have no existing target. */
    record None() implements AccessTarget {
    }

    /** An article plus the team of its publisher ({@code null} when the article has none). */
    record ArticleTarget(Article article, PublisherTeam team) implements AccessTarget {
    }

    record TeamTarget(PublisherTeam team) implements AccessTarget {
    }

    record SubscriptionTarget(Subscription subscription) implements AccessTarget {
    }

    static AccessTarget none() {
        return new None();
    }

    static AccessTarget article(Article article, PublisherTeam team) {
        return new ArticleTarget(article, team);
    }

    static AccessTarget team(PublisherTeam team) {
        return new TeamTarget(team);
    }

    static AccessTarget subscription(Subscription subscription) {
        return new SubscriptionTarget(subscription);
    }
}
