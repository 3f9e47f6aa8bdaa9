package dev.newsroom.entity;

/**
 * Lifecycle states of an article.
 * PUBLISHED and REJECTED are terminal; "approved" is derived from PUBLISHED.
 */
public enum ArticleStatus {
    DRAFT,
    PENDING,
    PUBLISHED,
    REJECTED;

    public boolean isTerminal() {
        return this == PUBLISHED || this == REJECTED;
    }
}
