package dev.newsroom.security;

import dev.newsroom.domain.PublisherTeam;
import dev.newsroom.domain.Roles;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.Subscription;
import dev.newsroom.entity.User;
import org.springframework.stereotype.Component;

import static dev.newsroom.security.Decision.allow;
import static dev.newsroom.security.Decision.deny;

/**
 * Single authorization decision point for every content operation.
 * <p>
 * Pure: evaluates the supplied actor and target snapshot, never mutates, never
 * performs I/O. Callers consult it immediately before a state change and act
 * on the returned {@link Decision}. A {@code null} actor is anonymous and may
 * only view published articles.
 */
@Component
public class AccessControlGate {

    public Decision authorize(User actor, Action action, AccessTarget target) {
        if (actor == null && action != Action.VIEW_ARTICLE) {
            return deny(DenialReason.UNAUTHENTICATED);
        }
        return switch (action) {
            case CREATE_ARTICLE, CREATE_NEWSLETTER ->
                    Roles.isJournalist(actor) ? allow() : deny(DenialReason.NOT_JOURNALIST);
            case EDIT_ARTICLE -> withArticle(target, (article, team) -> canEdit(actor, article, team));
            case SUBMIT_ARTICLE -> withArticle(target, (article, team) ->
                    isAuthor(actor, article) ? allow() : deny(DenialReason.NOT_AUTHOR));
            case APPROVE_ARTICLE, REJECT_ARTICLE -> withArticle(target, (article, team) -> canModerate(actor, article, team));
            case VIEW_ARTICLE -> withArticle(target, (article, team) -> canView(actor, article, team));
            case MANAGE_PUBLISHER_TEAM -> {
                if (!(target instanceof AccessTarget.TeamTarget teamTarget)) {
                    yield deny(DenialReason.UNSUPPORTED_TARGET);
                }
                yield teamTarget.team().isOwner(actor) ? allow() : deny(DenialReason.NOT_PUBLISHER_OWNER);
            }
            case CREATE_PUBLISHER, EDIT_PUBLISHER, LIST_PUBLISHERS ->
                    Roles.isStaff(actor) ? allow() : deny(DenialReason.NOT_STAFF);
            case SUBSCRIBE -> Roles.isReader(actor) ? allow() : deny(DenialReason.NOT_READER);
            case UNSUBSCRIBE -> canUnsubscribe(actor, target);
        };
    }

    private Decision canEdit(User actor, Article article, PublisherTeam team) {
        if (isAuthor(actor, article) || isEditorOf(actor, article, team)) {
            return allow();
        }
        return deny(DenialReason.NOT_AUTHOR_OR_EDITOR);
    }

    private Decision canModerate(User actor, Article article, PublisherTeam team) {
        if (!article.hasPublisher()) {
            return deny(DenialReason.NO_PUBLISHER_SCOPE);
        }
        if (!Roles.isEditor(actor)) {
            return deny(DenialReason.NOT_EDITOR);
        }
        if (!isEditorOf(actor, article, team)) {
            return deny(DenialReason.NOT_PUBLISHER_EDITOR);
        }
        return allow();
    }

    private Decision canView(User actor, Article article, PublisherTeam team) {
        if (article.isPublished()) {
            return allow();
        }
        if (actor == null) {
            return deny(DenialReason.UNAUTHENTICATED);
        }
        if (isAuthor(actor, article) || isEditorOf(actor, article, team) || Roles.isStaff(actor)) {
            return allow();
        }
        return deny(DenialReason.NOT_VISIBLE);
    }

    private Decision canUnsubscribe(User actor, AccessTarget target) {
        if (!Roles.isReader(actor)) {
            return deny(DenialReason.NOT_READER);
        }
        if (!(target instanceof AccessTarget.SubscriptionTarget subscriptionTarget)) {
            return deny(DenialReason.UNSUPPORTED_TARGET);
        }
        Subscription subscription = subscriptionTarget.subscription();
        if (subscription == null || !actor.getId().equals(subscription.getUserId())) {
            return deny(DenialReason.NOT_SUBSCRIPTION_OWNER);
        }
        return allow();
    }

    private Decision withArticle(AccessTarget target, ArticleRule rule) {
        if (!(target instanceof AccessTarget.ArticleTarget articleTarget) || articleTarget.article() == null) {
            return deny(DenialReason.UNSUPPORTED_TARGET);
        }
        return rule.apply(articleTarget.article(), articleTarget.team());
    }

    private static boolean isAuthor(User actor, Article article) {
        return actor != null && actor.getId() != null && actor.getId().equals(article.getAuthorId());
    }

    private static boolean isEditorOf(User actor, Article article, PublisherTeam team) {
        return article.hasPublisher()
                && team != null
                && article.getPublisherId().equals(team.publisherId())
                && team.isEditor(actor);
    }

    @FunctionalInterface
    private interface ArticleRule {
        Decision apply(Article article, PublisherTeam team);
    }
}
