package tech.foundry.oauth.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Opaque credential primitives: random token generation, storage hashing and
 * constant-time comparison.
 *
 * Opaque credentials (authorization codes, refresh tokens, personal access tokens)
 * are persisted only as {@link #hash(String)}. The raw value leaves the server once.
 */
public final class TokenCodec {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * 32 bytes = 256 bits of entropy, 43 base64url characters.
     */
    public static final int DEFAULT_TOKEN_BYTES = 32;

    /**
     * Generate a token with {@value #DEFAULT_TOKEN_BYTES} random bytes.
     */
    public static String generateToken() {
        return generateToken(DEFAULT_TOKEN_BYTES);
    }

    /**
     * Generate a base64url (unpadded) token from the given number of random bytes.
     */
    public static String generateToken(int byteCount) {
        if (byteCount < DEFAULT_TOKEN_BYTES) {
            throw new IllegalArgumentException("Tokens need at least " + DEFAULT_TOKEN_BYTES + " random bytes");
        }
        byte[] bytes = new byte[byteCount];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * SHA-256 of the token, base64url encoded without padding. This is the lookup key in storage.
     */
    public static String hash(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Token cannot be null");
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(sha256(token.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Constant-time string comparison. Null never equals anything.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private TokenCodec() {
        // Utility class
    }
}
