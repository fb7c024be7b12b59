package com.project.sharestore.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.sharestore.core.EncryptedEnvelope;
import com.project.sharestore.core.InputValidator;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Deterministic serialization and hashing of encrypted envelopes.
 *
 * The canonical form is compact JSON with a fixed field set in a fixed order:
 * {@code {"version":1,"alg":"A256GCM","iv":"...","ciphertext":"..."}}.
 * Its SHA-256 is the blob address, both when writing and when re-verifying a read.
 */
public final class EnvelopeCanonicalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EnvelopeCanonicalizer() {
    }

    /**
     * Validate, normalize and hash an envelope.
     *
     * @param envelope envelope supplied by the caller or decoded from a blob file
     * @return the normalized envelope, its canonical JSON and its blob hash
     * @throws InputValidator.InvalidInputException if the envelope is malformed
     */
    public static CanonicalEnvelope canonicalize(EncryptedEnvelope envelope) {
        if (envelope == null) {
            throw new InputValidator.InvalidInputException("Encrypted envelope must not be null");
        }
        InputValidator.validateEnvelopeHeader(envelope.version(), envelope.alg());
        String iv = InputValidator.requireIv(envelope.iv());
        String ciphertext = InputValidator.requireCiphertext(envelope.ciphertext());

        EncryptedEnvelope normalized = EncryptedEnvelope.a256gcm(iv, ciphertext);
        String canonicalJson = toCanonicalJson(normalized);
        String blobHash = HashingUtils.sha256Hex(canonicalJson.getBytes(StandardCharsets.UTF_8));
        return new CanonicalEnvelope(normalized, canonicalJson, blobHash);
    }

    /**
     * Blob address of an envelope.
     */
    public static String blobHash(EncryptedEnvelope envelope) {
        return canonicalize(envelope).blobHash();
    }

    private static String toCanonicalJson(EncryptedEnvelope envelope) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("version", envelope.version());
        node.put("alg", envelope.alg());
        node.put("iv", envelope.iv());
        node.put("ciphertext", envelope.ciphertext());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical envelope", e);
        }
    }

    /**
     * Result of canonicalization.
     *
     * @param envelope      normalized envelope (trimmed fields, fixed version and alg)
     * @param canonicalJson exact bytes that were hashed, as a string
     * @param blobHash      lowercase hex SHA-256 of {@code canonicalJson}
     */
    public record CanonicalEnvelope(EncryptedEnvelope envelope, String canonicalJson, String blobHash) {
        public CanonicalEnvelope {
            Objects.requireNonNull(envelope, "envelope must not be null");
            Objects.requireNonNull(canonicalJson, "canonicalJson must not be null");
            Objects.requireNonNull(blobHash, "blobHash must not be null");
        }
    }
}
