package com.project.sharestore.core;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of creating a share.
 *
 * @param shareId     newly reserved public id
 * @param contentHash caller-supplied content hash, normalized
 * @param blobHash    address of the stored envelope
 * @param blobCreated false when an identical envelope was already stored
 * @param editToken   plaintext edit token; only present for revocable shares and never stored
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateResult(
        String shareId,
        String contentHash,
        String blobHash,
        boolean blobCreated,
        String editToken
) {
    public boolean revocable() {
        return editToken != null;
    }
}
