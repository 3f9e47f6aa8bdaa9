package dev.newsroom.repository;

import dev.newsroom.entity.Publisher;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PublisherRepository extends ReactiveCrudRepository<Publisher, Long> {

    @Query("SELECT * FROM publishers ORDER BY name")
    Flux<Publisher> findAllOrderByName();

    @Query("SELECT * FROM publishers WHERE LOWER(name) = LOWER(:name)")
    Mono<Publisher> findByNameIgnoreCase(String name);

    @Query("SELECT COUNT(*) > 0 FROM publishers WHERE LOWER(name) = LOWER(:name)")
    Mono<Boolean> existsByNameIgnoreCase(String name);

    @Query("SELECT * FROM publishers WHERE owner_id = :ownerId ORDER BY created_at LIMIT 1")
    Mono<Publisher> findFirstByOwnerId(Long ownerId);
}
