package io.hearthwarrio.stableid.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Short content hashes for identifier components. Same text, same hash, on every JVM.
 */
final class StableHash {

    private StableHash() {
        // utility class
    }

    /**
     * First {@code length} lowercase hex digits of the SHA-256 of {@code text} (UTF-8).
     */
    static String hex(String text, int length) {
        if (length < 1 || length > 64) {
            throw new IllegalArgumentException("length must be between 1 and 64: " + length);
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(64);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.substring(0, length);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed in the JRE.
            throw new IllegalStateException(e);
        }
    }
}
