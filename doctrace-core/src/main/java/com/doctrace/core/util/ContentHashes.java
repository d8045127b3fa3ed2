package com.doctrace.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hashing.
 */
public final class ContentHashes {

    private static final String ALGORITHM = "SHA-256";

    private ContentHashes() {
        // Utility class
    }

    /**
     * Hashes text content encoded as UTF-8.
     *
     * @param content text content
     * @return lower-case hex digest
     */
    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
