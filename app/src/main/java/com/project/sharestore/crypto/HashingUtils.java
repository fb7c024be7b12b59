package com.project.sharestore.crypto;

import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * SHA-256 hashing utilities for the share store.
 *
 * Provides:
 * - Hex digests used as blob addresses and content hashes
 * - Edit token hashing (only the digest is ever persisted)
 * - Constant-time comparison of stored and presented digests
 */
public final class HashingUtils {
    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    });

    /** Lowercase hex SHA-256 digest: 64 characters. */
    public static final Pattern SHA256_HEX = Pattern.compile("^[a-f0-9]{64}$");

    private HashingUtils() {
    }

    public static byte[] sha256(byte[] input) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        return digest.digest(input);
    }

    public static String sha256Hex(byte[] input) {
        return Hex.toHexString(sha256(input));
    }

    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hash an edit token the way it is stored in a link record.
     * Surrounding whitespace is not part of the token.
     */
    public static String hashEditToken(String editToken) {
        String trimmed = editToken == null ? "" : editToken.trim();
        return sha256Hex(trimmed);
    }

    /**
     * Compare two hex digests without leaking where they differ.
     *
     * @param expectedHex digest loaded from storage
     * @param suppliedHex digest computed from caller input
     * @return true only if both decode to identical bytes
     */
    public static boolean constantTimeHexEquals(String expectedHex, String suppliedHex) {
        if (expectedHex == null || suppliedHex == null) {
            return false;
        }
        byte[] expected;
        byte[] supplied;
        try {
            expected = Hex.decode(expectedHex);
            supplied = Hex.decode(suppliedHex);
        } catch (DecoderException e) {
            return false;
        }
        return Arrays.constantTimeAreEqual(expected, supplied);
    }

    public static boolean isSha256Hex(String value) {
        return value != null && SHA256_HEX.matcher(value).matches();
    }

    /**
     * Trim and lowercase a hex digest. Does NOT validate.
     */
    public static String normalizeHex(String value) {
        if (value == null) {
            return null;
        }
        return value.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
