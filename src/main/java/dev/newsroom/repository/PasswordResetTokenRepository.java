package dev.newsroom.repository;

import dev.newsroom.entity.PasswordResetToken;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface PasswordResetTokenRepository extends ReactiveCrudRepository<PasswordResetToken, Long> {

    Mono<PasswordResetToken> findByToken(String token);

    /**
     * Consumes the token. Returns 0 if it had already been used.
     */
    @Modifying
    @Query("UPDATE password_reset_tokens SET used = true, used_at = :usedAt WHERE id = :id AND used = false")
    Mono<Integer> markAsUsed(Long id, LocalDateTime usedAt);

    @Modifying
    @Query("DELETE FROM password_reset_tokens WHERE created_at < :cutoff")
    Mono<Integer> deleteCreatedBefore(LocalDateTime cutoff);

    @Query("SELECT COUNT(*) FROM password_reset_tokens WHERE user_id = :userId AND created_at > :since")
    Mono<Long> countRecentTokensByUserId(Long userId, LocalDateTime since);
}
