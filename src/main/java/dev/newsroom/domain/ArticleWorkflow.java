package dev.newsroom.domain;

import dev.newsroom.entity.Article;
import dev.newsroom.entity.ArticleStatus;
import dev.newsroom.entity.User;

import java.time.LocalDateTime;

/**
 * State machine over an article's lifecycle:
 * <pre>
 *   DRAFT ──submit──▶ PENDING ──approve──▶ PUBLISHED
 *                            └──reject───▶ REJECTED
 * </pre>
 * Every operation is pure: the input snapshot is never mutated, a copy is
 * returned inside the {@link Outcome}. The persistence layer re-checks
 * {@code status == PENDING} when writing a decision.
 */
public final class ArticleWorkflow {

    private ArticleWorkflow() {
        // utility class
    }

    /**
     * DRAFT → PENDING, by the author only.
     */
    public static Outcome<Article> submit(Article article, User actor, LocalDateTime now) {
        if (!isAuthor(article, actor)) {
            return Outcome.failed(ErrorKind.NOT_OWNER);
        }
        if (article.getStatus() != ArticleStatus.DRAFT) {
            return Outcome.failed(ErrorKind.INVALID_TRANSITION);
        }
        return Outcome.changed(article.toBuilder()
                .status(ArticleStatus.PENDING)
                .updatedAt(now)
                .build());
    }

    /**
     * PENDING → PUBLISHED, by an editor of the article's publisher.
     */
    public static Outcome<Article> approve(Article article, User editor, PublisherTeam team, LocalDateTime now) {
        return decide(article, editor, team, ArticleStatus.PUBLISHED, now);
    }

    /**
     * PENDING → REJECTED, same guards as {@link #approve}.
     */
    public static Outcome<Article> reject(Article article, User editor, PublisherTeam team, LocalDateTime now) {
        return decide(article, editor, team, ArticleStatus.REJECTED, now);
    }

    /**
     * Content-only change in a non-terminal state, by the author or an editor
     * of the article's publisher. Never touches {@code status}.
     */
    public static Outcome<Article> edit(Article article, User actor, PublisherTeam team,
                                        ArticleChanges changes, LocalDateTime now) {
        if (article.getStatus().isTerminal()) {
            return Outcome.failed(ErrorKind.INVALID_TRANSITION);
        }
        if (!isAuthor(article, actor) && !isPublisherEditor(article, actor, team)) {
            return Outcome.failed(ErrorKind.NOT_OWNER);
        }
        Article.ArticleBuilder builder = article.toBuilder().updatedAt(now);
        if (changes.title() != null) {
            builder.title(changes.title());
        }
        if (changes.summary() != null) {
            builder.summary(changes.summary());
        }
        if (changes.content() != null) {
            builder.content(changes.content());
        }
        if (changes.categoryId() != null) {
            builder.categoryId(changes.categoryId());
        }
        return Outcome.changed(builder.build());
    }

    private static Outcome<Article> decide(Article article, User editor, PublisherTeam team,
                                           ArticleStatus target, LocalDateTime now) {
        if (!article.hasPublisher()) {
            return Outcome.failed(ErrorKind.NO_PUBLISHER_SCOPE);
        }
        if (article.getStatus().isTerminal()) {
            return Outcome.failed(ErrorKind.ALREADY_DECIDED);
        }
        if (article.getStatus() != ArticleStatus.PENDING) {
            return Outcome.failed(ErrorKind.INVALID_TRANSITION);
        }
        if (!Roles.isEditor(editor) || !isPublisherEditor(article, editor, team)) {
            return Outcome.failed(ErrorKind.ROLE_MISMATCH);
        }
        return Outcome.changed(article.toBuilder()
                .status(target)
                .approvedBy(editor.getId())
                .approvedAt(now)
                .updatedAt(now)
                .build());
    }

    static boolean isAuthor(Article article, User actor) {
        return actor != null && actor.getId() != null && actor.getId().equals(article.getAuthorId());
    }

    static boolean isPublisherEditor(Article article, User actor, PublisherTeam team) {
        return article.hasPublisher()
                && team != null
                && article.getPublisherId().equals(team.publisherId())
                && team.isEditor(actor);
    }
}
