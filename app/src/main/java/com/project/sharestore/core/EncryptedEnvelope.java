package com.project.sharestore.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Client-encrypted playlist payload. Opaque to the store: only byte identity matters.
 *
 * @param version    envelope format version (currently 1)
 * @param alg        cipher identifier chosen by the client (currently A256GCM)
 * @param iv         base64url initialization vector
 * @param ciphertext base64url ciphertext
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "alg", "iv", "ciphertext"})
public record EncryptedEnvelope(
        @JsonProperty("version") int version,
        @JsonProperty("alg") String alg,
        @JsonProperty("iv") String iv,
        @JsonProperty("ciphertext") String ciphertext
) {

    public static EncryptedEnvelope a256gcm(String iv, String ciphertext) {
        return new EncryptedEnvelope(InputValidator.ENVELOPE_VERSION, InputValidator.ENVELOPE_ALG, iv, ciphertext);
    }
}
