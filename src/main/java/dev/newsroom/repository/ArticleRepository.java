package dev.newsroom.repository;

import dev.newsroom.entity.Article;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface ArticleRepository extends ReactiveCrudRepository<Article, Long> {

    @Query("SELECT * FROM articles WHERE status = 'PUBLISHED' ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findPublished(int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE status = 'PUBLISHED'")
    Mono<Long> countPublished();

    @Query("SELECT * FROM articles WHERE author_id = :authorId ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findByAuthorId(Long authorId, int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE author_id = :authorId")
    Mono<Long> countByAuthorId(Long authorId);

    @Query("SELECT * FROM articles WHERE publisher_id IN (:publisherIds) ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findByPublisherIdIn(Collection<Long> publisherIds, int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles WHERE publisher_id IN (:publisherIds)")
    Mono<Long> countByPublisherIdIn(Collection<Long> publisherIds);

    @Query("SELECT * FROM articles ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> findAllPaged(int limit, int offset);

    @Query("SELECT COUNT(*) FROM articles")
    Mono<Long> countAll();

    @Query("SELECT * FROM articles WHERE publisher_id = :publisherId ORDER BY created_at DESC LIMIT :limit")
    Flux<Article> findRecentByPublisherId(Long publisherId, int limit);

    @Query("SELECT COUNT(*) FROM articles WHERE publisher_id = :publisherId")
    Mono<Long> countByPublisherId(Long publisherId);

    /**
     * Published articles filtered by optional text, category name and publisher name.
     * Blank filters match everything.
     */
    @Query("""
            SELECT a.* FROM articles a
            LEFT JOIN categories c ON a.category_id = c.id
            LEFT JOIN publishers p ON a.publisher_id = p.id
            WHERE a.status = 'PUBLISHED'
              AND (:query = '' OR LOWER(a.title) LIKE LOWER(CONCAT('%', :query, '%'))
                   OR LOWER(a.content) LIKE LOWER(CONCAT('%', :query, '%')))
              AND (:category = '' OR c.name = :category)
              AND (:publisher = '' OR p.name = :publisher)
            ORDER BY a.created_at DESC
            LIMIT :limit OFFSET :offset
            """)
    Flux<Article> searchPublished(String query, String category, String publisher, int limit, int offset);

    @Query("""
            SELECT COUNT(*) FROM articles a
            LEFT JOIN categories c ON a.category_id = c.id
            LEFT JOIN publishers p ON a.publisher_id = p.id
            WHERE a.status = 'PUBLISHED'
              AND (:query = '' OR LOWER(a.title) LIKE LOWER(CONCAT('%', :query, '%'))
                   OR LOWER(a.content) LIKE LOWER(CONCAT('%', :query, '%')))
              AND (:category = '' OR c.name = :category)
              AND (:publisher = '' OR p.name = :publisher)
            """)
    Mono<Long> countSearchPublished(String query, String category, String publisher);

    /**
     * Writes a moderation decision only if the article is still PENDING.
     * Returns the number of updated rows: 0 means another decision already landed.
     */
    @Modifying
    @Query("""
            UPDATE articles
               SET status = :status, approved_by = :approvedBy, approved_at = :decidedAt, updated_at = :decidedAt
             WHERE id = :id AND status = 'PENDING'
            """)
    Mono<Integer> decideIfPending(Long id, String status, Long approvedBy, LocalDateTime decidedAt);

    /**
     * Writes content fields only, and only while the article is still open for edits.
     * Returns 0 when a decision landed after the article was loaded.
     */
    @Modifying
    @Query("""
            UPDATE articles
               SET title = :title, summary = :summary, content = :content, category_id = :categoryId,
                   updated_at = :updatedAt
             WHERE id = :id AND status IN ('DRAFT', 'PENDING')
            """)
    Mono<Integer> updateContentIfOpen(Long id, String title, String summary, String content, Long categoryId,
                                      LocalDateTime updatedAt);

    @Modifying
    @Query("UPDATE articles SET status = 'PENDING', updated_at = :updatedAt WHERE id = :id AND status = 'DRAFT'")
    Mono<Integer> submitIfDraft(Long id, LocalDateTime updatedAt);
}
