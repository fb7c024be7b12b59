package com.project.sharestore.core;

import com.project.sharestore.crypto.HashingUtils;

import java.util.regex.Pattern;

/**
 * Input validation utilities for the share store.
 *
 * Provides validation for:
 * - Share IDs (alphabet, length)
 * - SHA-256 hex digests (content hash, blob hash, edit token hash)
 * - Encrypted envelope fields (version, algorithm, iv, ciphertext)
 * - Edit token entropy floor
 *
 * Every check runs before any filesystem access.
 */
public final class InputValidator {

    // Share ID constraints
    private static final int SHARE_ID_MIN_LENGTH = 16;
    private static final int SHARE_ID_MAX_LENGTH = 64;

    private static final Pattern SHARE_ID_PATTERN = Pattern.compile(
        "^[A-Za-z0-9_-]{" + SHARE_ID_MIN_LENGTH + "," + SHARE_ID_MAX_LENGTH + "}$"
    );

    private static final Pattern BASE64URL_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    public static final int ENVELOPE_VERSION = 1;
    public static final String ENVELOPE_ALG = "A256GCM";

    private static final int IV_MIN_LENGTH = 12;
    private static final int IV_MAX_LENGTH = 40;
    private static final int CIPHERTEXT_MIN_LENGTH = 24;
    private static final int CIPHERTEXT_MAX_LENGTH = 2_000_000;

    /** Shorter tokens are rejected without touching storage. */
    public static final int EDIT_TOKEN_MIN_LENGTH = 16;

    private InputValidator() {}

    /**
     * Validate share ID format.
     *
     * @param shareId The share ID to validate
     * @throws InvalidInputException if validation fails
     */
    public static void validateShareId(String shareId) {
        if (shareId == null) {
            throw new InvalidInputException("Share ID must not be null");
        }
        if (!SHARE_ID_PATTERN.matcher(shareId).matches()) {
            throw new InvalidInputException(
                String.format("Share ID has invalid format: must be %d-%d characters of [A-Za-z0-9_-], got length %d",
                    SHARE_ID_MIN_LENGTH, SHARE_ID_MAX_LENGTH, shareId.length())
            );
        }
    }

    /**
     * Check if share ID is valid without throwing.
     */
    public static boolean isValidShareId(String shareId) {
        return shareId != null && SHARE_ID_PATTERN.matcher(shareId).matches();
    }

    /**
     * Validate and normalize a SHA-256 hex digest.
     *
     * @param hash The digest to validate (case-insensitive, surrounding whitespace ignored)
     * @param fieldName Name of the field for error messages
     * @return the lowercase digest
     * @throws InvalidInputException if validation fails
     */
    public static String requireSha256Hex(String hash, String fieldName) {
        if (hash == null) {
            throw new InvalidInputException(fieldName + " must not be null");
        }
        String normalized = HashingUtils.normalizeHex(hash);
        if (!HashingUtils.isSha256Hex(normalized)) {
            throw new InvalidInputException(
                String.format("%s must be a 64 character hex SHA-256 digest", fieldName)
            );
        }
        return normalized;
    }

    /**
     * Validate the envelope version and algorithm tags.
     */
    public static void validateEnvelopeHeader(int version, String alg) {
        if (version != ENVELOPE_VERSION) {
            throw new InvalidInputException(
                String.format("Unsupported envelope version: expected %d, got %d", ENVELOPE_VERSION, version)
            );
        }
        if (alg == null || !ENVELOPE_ALG.equals(alg.trim())) {
            throw new InvalidInputException(
                String.format("Unsupported envelope algorithm: expected %s, got '%s'", ENVELOPE_ALG, alg)
            );
        }
    }

    public static String requireIv(String iv) {
        return requireBase64UrlField(iv, IV_MIN_LENGTH, IV_MAX_LENGTH, "iv");
    }

    public static String requireCiphertext(String ciphertext) {
        return requireBase64UrlField(ciphertext, CIPHERTEXT_MIN_LENGTH, CIPHERTEXT_MAX_LENGTH, "ciphertext");
    }

    /**
     * Validate a base64url field and return its trimmed value.
     *
     * @throws InvalidInputException if validation fails
     */
    static String requireBase64UrlField(String value, int minLength, int maxLength, String fieldName) {
        if (value == null) {
            throw new InvalidInputException(fieldName + " must not be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidInputException(fieldName + " must not be empty");
        }
        if (trimmed.length() < minLength || trimmed.length() > maxLength) {
            throw new InvalidInputException(
                String.format("%s must be %d-%d characters: got %d", fieldName, minLength, maxLength, trimmed.length())
            );
        }
        if (!BASE64URL_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidInputException(fieldName + " must use the base64url alphabet");
        }
        return trimmed;
    }

    /**
     * Cheap entropy floor for presented edit tokens.
     */
    public static boolean meetsEditTokenFloor(String editToken) {
        return editToken != null && editToken.trim().length() >= EDIT_TOKEN_MIN_LENGTH;
    }

    /**
     * Exception thrown when input validation fails.
     */
    public static class InvalidInputException extends IllegalArgumentException {
        public InvalidInputException(String message) {
            super(message);
        }

        public InvalidInputException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
