package dev.newsroom.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Hashing and random-token helpers for password reset tokens.
 */
public final class DigestUtils {

    private static final SecureRandom RANDOM = new SecureRandom();

    private DigestUtils() {
        // utility class
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of {@code input}.
     */
    public static String sha256Hex(String input) {
        Objects.requireNonNull(input, "input");
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * URL-safe random token carrying {@code bytes} bytes of entropy.
     */
    public static String randomToken(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }
}
