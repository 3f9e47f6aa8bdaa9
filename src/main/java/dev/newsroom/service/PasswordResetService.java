package dev.newsroom.service;

import dev.newsroom.entity.PasswordResetToken;
import dev.newsroom.repository.PasswordResetTokenRepository;
import dev.newsroom.repository.UserRepository;
import dev.newsroom.util.DigestUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Emailed, single-use password reset tokens. Only the SHA-256 hash of a token is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PasswordResetService {

    private static final int TOKEN_BYTES = 32;

    private final PasswordResetTokenRepository tokenRepository;
    private final UserRepository userRepository;
    private final EmailService emailService;
    private final PasswordEncoder passwordEncoder;
    private final IdService idService;

    @Value("${newsroom.password-reset.validity:PT1H}")
    private Duration tokenValidity = Duration.ofHours(1);

    @Value("${newsroom.password-reset.max-per-hour:3}")
    private int maxTokensPerHour = 3;

    /**
     * Starts a reset. Completes the same way whether or not the address is known,
     * the rate limit was hit or the email could be delivered.
     */
    public Mono<Void> requestPasswordReset(String email) {
        String normalized = email.toLowerCase(Locale.ROOT).trim();
        return userRepository.findByEmail(normalized)
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                .flatMap(user -> tokenRepository.countRecentTokensByUserId(user.getId(), LocalDateTime.now().minusHours(1))
                        .flatMap(count -> {
                            if (count >= maxTokensPerHour) {
                                log.warn("Password reset rate limit reached for user {}", user.getId());
                                return Mono.empty();
                            }
                            String plainToken = DigestUtils.randomToken(TOKEN_BYTES);
                            PasswordResetToken token = PasswordResetToken.builder()
                                    .id(idService.nextId())
                                    .userId(user.getId())
                                    .token(DigestUtils.sha256Hex(plainToken))
                                    .used(false)
                                    .createdAt(LocalDateTime.now())
                                    .build();
                            return tokenRepository.save(token)
                                    .then(Mono.defer(() -> emailService.sendPasswordResetEmail(
                                            user.getEmail(), user.getFirstName(), plainToken)))
                                    .doOnSuccess(v -> log.info("Password reset issued for user {}", user.getId()));
                        }))
                .onErrorResume(e -> {
                    log.warn("Password reset request could not be completed: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    public Mono<Boolean> validateToken(String token) {
        if (token == null || token.isBlank()) {
            return Mono.just(false);
        }
        return tokenRepository.findByToken(DigestUtils.sha256Hex(token))
                .map(found -> found.isValid(tokenValidity, LocalDateTime.now()))
                .defaultIfEmpty(false);
    }

    /**
     * Consumes the token, then stores the new password hash. A token can be
     * consumed once: a second use, even a concurrent one, fails.
     */
    @Transactional
    public Mono<Void> resetPassword(String token, String newPassword) {
        return tokenRepository.findByToken(DigestUtils.sha256Hex(token))
                .filter(found -> found.isValid(tokenValidity, LocalDateTime.now()))
                .switchIfEmpty(Mono.error(new SecurityException("error.invalid_reset_token")))
                .flatMap(found -> tokenRepository.markAsUsed(found.getId(), LocalDateTime.now())
                        .flatMap(rows -> rows == 0
                                ? Mono.<PasswordResetToken>error(new SecurityException("error.invalid_reset_token"))
                                : Mono.just(found)))
                .flatMap(found -> userRepository.findById(found.getUserId())
                        .switchIfEmpty(Mono.error(new SecurityException("error.invalid_reset_token"))))
                .flatMap(user -> Mono.fromCallable(() -> passwordEncoder.encode(newPassword))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(hash -> {
                            user.setPasswordHash(hash);
                            user.setUpdatedAt(LocalDateTime.now());
                            return userRepository.save(user);
                        }))
                .doOnNext(user -> log.info("Password reset completed for user {}", user.getId()))
                .flatMap(user -> emailService.sendPasswordChangedNotification(user.getEmail(), user.getFirstName())
                        .onErrorResume(e -> {
                            log.warn("Password changed notification failed for user {}: {}", user.getId(), e.getMessage());
                            return Mono.empty();
                        }));
    }

    @Scheduled(fixedRateString = "${scheduling.password-reset-cleanup-ms:21600000}",
            initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void cleanupExpiredTokens() {
        LocalDateTime cutoff = LocalDateTime.now().minus(tokenValidity).minusDays(1);
        tokenRepository.deleteCreatedBefore(cutoff)
                .subscribe(
                        deleted -> log.info("Removed {} stale password reset tokens", deleted),
                        error -> log.error("Password reset token cleanup failed: {}", error.getMessage()));
    }
}
