package com.delta.opportunities.pipeline.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        byte[] hash = sha256(value);
        char[] out = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            int b = hash[i] & 0xff;
            out[i * 2] = HEX[b >>> 4];
            out[i * 2 + 1] = HEX[b & 0x0f];
        }
        return new String(out);
    }

    /**
     * First eight bytes of the SHA-256 digest as a signed long. Stable across JVMs, unlike
     * {@link String#hashCode()}.
     */
    public static long sha256Long(String value) {
        byte[] hash = sha256(value);
        long result = 0;
        for (int i = 0; i < 8; i++) {
            result = (result << 8) | (hash[i] & 0xff);
        }
        return result;
    }

    /**
     * Idempotency key for delivering one application to one platform. Retries reuse it.
     */
    public static String idempotencyKey(long applicationId, String platform) {
        return sha256Hex(applicationId + ":" + platform);
    }

    private static byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
