package com.salary.disclosure.registry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic entity identifiers: the first 32 bits (big-endian) of the MD5 digest
 * of the UTF-8 bytes of the canonical name, read as an unsigned integer. Equal to
 * {@code int(md5(name).hexdigest()[:8], 16)} in any other language.
 *
 * <p>No collision handling: two canonical names sharing a 32-bit prefix share an id.</p>
 */
public final class EntityIds {

    private static final String ALGORITHM = "MD5";

    private EntityIds() {
        // Utility class
    }

    public static long idFor(String canonicalName) {
        byte[] digest = md5().digest(canonicalName.getBytes(StandardCharsets.UTF_8));
        return ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to provide MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
