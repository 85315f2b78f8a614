package com.crossfire.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Cryptographic digests over text.
 */
public final class TextSecurity {
    private static final String ALGORITHM = "SHA-256";

    private TextSecurity() {
    }

    /**
     * Computes the SHA-256 digest of a string's UTF-8 bytes.
     *
     * @param content text to hash
     * @return digest bytes, or null when the content is empty
     */
    public static byte[] computeHash(String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (bytes.length == 0) {
            return null;
        }
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    /**
     * Computes the Base64-encoded SHA-256 digest of a string.
     *
     * @param content non-empty text to hash
     * @return Base64 digest
     */
    public static String computeHashString(String content) {
        byte[] hash = computeHash(content);
        if (hash == null) {
            throw new IllegalArgumentException("Cannot hash empty content");
        }
        return Base64.getEncoder().encodeToString(hash);
    }
}
