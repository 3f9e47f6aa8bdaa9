package dev.newsroom.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestUtilsTest {

    @Test
    @DisplayName("sha256Hex matches the known digest")
    void shouldHash() {
        assertThat(DigestUtils.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("sha256Hex rejects null")
    void shouldRejectNull() {
        assertThatThrownBy(() -> DigestUtils.sha256Hex(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("random tokens are URL-safe and distinct")
    void shouldGenerateUrlSafeTokens() {
        String first = DigestUtils.randomToken(32);
        String second = DigestUtils.randomToken(32);

        assertThat(first).matches("^[A-Za-z0-9_-]{43}$");
        assertThat(first).isNotEqualTo(second);
    }
}
