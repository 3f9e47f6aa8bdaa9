package dev.newsroom.repository;

import dev.newsroom.entity.PublisherMember;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface PublisherMemberRepository extends ReactiveCrudRepository<PublisherMember, Long> {

    @Query("SELECT * FROM publisher_members WHERE publisher_id = :publisherId")
    Flux<PublisherMember> findByPublisherId(Long publisherId);

    @Query("SELECT * FROM publisher_members WHERE user_id = :userId AND member_role = :memberRole")
    Flux<PublisherMember> findByUserIdAndMemberRole(Long userId, String memberRole);
}
