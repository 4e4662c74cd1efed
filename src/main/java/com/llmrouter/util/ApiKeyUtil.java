package com.llmrouter.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Utility class for API key generation, hashing and identifiers.
 */
public final class ApiKeyUtil {

    private static final int SECRET_BYTES = 32;
    private static final int ID_HEX_LENGTH = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ApiKeyUtil() {
    }

    /**
     * Generate a new raw API key secret.
     *
     * @param prefix Recognizable prefix (e.g. {@code llm-router-})
     * @return Generated secret, prefix followed by 43 URL-safe characters
     */
    public static String generateApiKey(String prefix) {
        byte[] randomBytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
        return prefix + encoded;
    }

    /**
     * Hash an API key using SHA-256.
     *
     * @param apiKey The API key to hash
     * @return Lowercase hex SHA-256 digest
     */
    public static String hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    /**
     * Generate an opaque identifier such as {@code ak_1f0c9a2b3d4e5f60}.
     */
    public static String generateId(String prefix) {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return prefix + hex.substring(0, ID_HEX_LENGTH);
    }

    /**
     * Random hex string, used for token identifiers.
     */
    public static String randomHex(int bytes) {
        byte[] randomBytes = new byte[bytes];
        SECURE_RANDOM.nextBytes(randomBytes);
        return HexFormat.of().formatHex(randomBytes);
    }

    /**
     * Mask a secret for logging, keeping only its first characters.
     */
    public static String mask(String secret) {
        if (secret == null) {
            return "null";
        }
        int visible = Math.min(secret.length(), 15);
        return secret.substring(0, visible) + "...";
    }
}
