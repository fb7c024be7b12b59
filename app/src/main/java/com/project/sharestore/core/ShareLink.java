package com.project.sharestore.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;

/**
 * Per-share metadata record mapping a public share id to a blob.
 * On disk, {@code createdAt} always carries milliseconds and an {@code encrypted: true} marker is added.
 *
 * @param version       record format version (always 1)
 * @param shareId       public identifier, written at most once
 * @param contentHash   hash of the logical content, supplied by the caller
 * @param blobHash      address of the encrypted blob; null on legacy records
 * @param createdAt     creation time, immutable
 * @param revoked       one-way flag, never reverts to false
 * @param editTokenHash hash of the caller-held edit token; null when not revocable
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "shareId", "contentHash", "blobHash", "createdAt", "revoked", "encrypted", "editTokenHash"})
public record ShareLink(
        @JsonProperty("version") int version,
        @JsonProperty("shareId") String shareId,
        @JsonProperty("contentHash") String contentHash,
        @JsonProperty("blobHash") String blobHash,
        @JsonProperty("createdAt") @JsonSerialize(using = MillisInstantSerializer.class) Instant createdAt,
        @JsonProperty("revoked") boolean revoked,
        @JsonProperty("editTokenHash") String editTokenHash
) {
    public static final int CURRENT_VERSION = 1;

    public static ShareLink create(String shareId, String contentHash, String blobHash,
                                   Instant createdAt, String editTokenHash) {
        return new ShareLink(CURRENT_VERSION, shareId, contentHash, blobHash, createdAt, false, editTokenHash);
    }

    /**
     * Blob address this link resolves to. Legacy records stored the blob under the content hash.
     */
    @JsonIgnore
    public String effectiveBlobHash() {
        return blobHash != null ? blobHash : contentHash;
    }

    /**
     * Every link this store writes points at an encrypted blob. Older readers refuse links
     * without the marker, so it is always written and ignored on read.
     */
    @JsonProperty(value = "encrypted", access = JsonProperty.Access.READ_ONLY)
    public boolean encrypted() {
        return true;
    }

    @JsonIgnore
    public boolean isRevocable() {
        return editTokenHash != null;
    }

    public ShareLink asRevoked() {
        return new ShareLink(version, shareId, contentHash, blobHash, createdAt, true, editTokenHash);
    }
}
