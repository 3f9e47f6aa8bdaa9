package dev.newsroom.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class PasswordResetTokenTest {

    private static final Duration VALIDITY = Duration.ofHours(1);
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 4, 2, 12, 0);

    @Test
    @DisplayName("a fresh unused token is valid")
    void shouldBeValid() {
        PasswordResetToken token = PasswordResetToken.builder().createdAt(NOW.minusMinutes(59)).build();

        assertThat(token.isNew()).isTrue();
        assertThat(token.isValid(VALIDITY, NOW)).isTrue();
    }

    @Test
    @DisplayName("a token expires exactly at the end of its validity")
    void shouldExpire() {
        PasswordResetToken token = PasswordResetToken.builder().createdAt(NOW.minusHours(1)).build();

        assertThat(token.isExpired(VALIDITY, NOW)).isTrue();
        assertThat(token.isValid(VALIDITY, NOW)).isFalse();
    }

    @Test
    @DisplayName("a used token is invalid")
    void shouldRejectUsed() {
        PasswordResetToken token = PasswordResetToken.builder().createdAt(NOW).used(true).build();

        assertThat(token.isValid(VALIDITY, NOW)).isFalse();
    }

    @Test
    @DisplayName("a token without a creation time counts as expired")
    void shouldTreatMissingTimestampAsExpired() {
        assertThat(new PasswordResetToken().isExpired(VALIDITY, NOW)).isTrue();
    }
}
