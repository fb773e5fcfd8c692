package com.lunchmate.backend.common.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic numeric keys: SHA-256 of the input, first 8 bytes as a positive long.
 * Same input always gives the same key, so concurrent creators collide on the primary key.
 */
public final class Sha256Keys {

    private Sha256Keys() {}

    public static long positiveLong(String input) {
        if (input == null) throw new IllegalArgumentException("input is required");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            long v = ByteBuffer.wrap(digest, 0, Long.BYTES).getLong() & Long.MAX_VALUE;
            return v == 0L ? 1L : v;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
