package com.delta.adfeed.monitor.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private HashUtils() {
    }

    /**
     * Ad identity. MD5 keeps ids compatible with ledgers written by earlier versions of the monitor.
     */
    public static String md5Hex(String value) {
        return hex("MD5", value);
    }

    public static String sha256Hex(byte[] value) {
        return toHex(digest("SHA-256", value));
    }

    private static String hex(String algorithm, String value) {
        return toHex(digest(algorithm, value.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] digest(String algorithm, byte[] value) {
        try {
            return MessageDigest.getInstance(algorithm).digest(value);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder out = new StringBuilder();
        for (byte b : hash) {
            out.append(String.format("%02x", b));
        }
        return out.toString();
    }
}
