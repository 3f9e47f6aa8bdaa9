package dev.newsroom.repository;

import dev.newsroom.entity.Newsletter;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;

@Repository
public interface NewsletterRepository extends ReactiveCrudRepository<Newsletter, Long> {

    @Query("SELECT * FROM newsletters WHERE author_id = :authorId ORDER BY created_at DESC")
    Flux<Newsletter> findByAuthorId(Long authorId);

    @Query("SELECT * FROM newsletters ORDER BY created_at DESC LIMIT :limit")
    Flux<Newsletter> findRecent(int limit);

    @Query("SELECT * FROM newsletters WHERE publisher_id = :publisherId ORDER BY created_at DESC LIMIT :limit")
    Flux<Newsletter> findRecentByPublisherId(Long publisherId, int limit);

    /**
     * Candidate newsletters for a subscription feed. Empty id lists must be
     * passed as a single sentinel value because SQL {@code IN ()} is invalid.
     */
    @Query("""
            SELECT * FROM newsletters
             WHERE publisher_id IN (:publisherIds) OR author_id IN (:journalistIds)
             ORDER BY created_at DESC, id DESC
             LIMIT :limit
            """)
    Flux<Newsletter> findFeedCandidates(Collection<Long> publisherIds, Collection<Long> journalistIds, int limit);
}
