package dev.newsroom.repository;

import dev.newsroom.entity.Category;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CategoryRepository extends ReactiveCrudRepository<Category, Long> {

    @Query("SELECT * FROM categories ORDER BY name")
    Flux<Category> findAllOrderByName();

    @Query("SELECT * FROM categories WHERE LOWER(name) = LOWER(:name)")
    Mono<Category> findByNameIgnoreCase(String name);
}
