package dev.newsroom.domain;

/**
 * Content fields an edit may change. {@code null} leaves a field untouched.
 */
public record ArticleChanges(String title, String summary, String content, Long categoryId) {
}
