package dev.newsroom.repository;

import dev.newsroom.entity.Subscription;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface SubscriptionRepository extends ReactiveCrudRepository<Subscription, Long> {

    @Query("SELECT * FROM subscriptions WHERE user_id = :userId ORDER BY created_at DESC")
    Flux<Subscription> findByUserId(Long userId);

    @Query("SELECT * FROM subscriptions WHERE user_id = :userId AND publisher_id = :publisherId")
    Mono<Subscription> findByUserIdAndPublisherId(Long userId, Long publisherId);

    @Query("SELECT * FROM subscriptions WHERE user_id = :userId AND journalist_id = :journalistId")
    Mono<Subscription> findByUserIdAndJournalistId(Long userId, Long journalistId);

    @Query("SELECT COUNT(*) FROM subscriptions WHERE publisher_id = :publisherId")
    Mono<Long> countByPublisherId(Long publisherId);
}
