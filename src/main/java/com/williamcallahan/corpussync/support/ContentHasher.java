package com.williamcallahan.corpussync.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers shared by fingerprinting and file naming.
 */
public final class ContentHasher {

    private ContentHasher() {}

    /**
     * Generates the SHA-256 hash of UTF-8 text.
     *
     * @param text text to hash
     * @return 64 character lowercase hex digest
     */
    public static String sha256(String text) {
        return toHex(digest(text), 32);
    }

    /**
     * Returns the first 12 hex characters of the SHA-256 digest, used to disambiguate
     * shortened file names.
     */
    public static String shortSha256(String text) {
        return toHex(digest(text), 6);
    }

    private static byte[] digest(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String toHex(byte[] digest, int byteCount) {
        StringBuilder sb = new StringBuilder(byteCount * 2);
        for (int i = 0; i < byteCount; i++) {
            sb.append(String.format("%02x", digest[i]));
        }
        return sb.toString();
    }
}
