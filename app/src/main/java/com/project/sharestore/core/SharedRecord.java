package com.project.sharestore.core;

import java.time.Instant;

/**
 * A readable share as served to collaborators.
 *
 * @param shareId   public id
 * @param createdAt creation time of the link
 * @param envelope  verified encrypted payload
 */
public record SharedRecord(String shareId, Instant createdAt, EncryptedEnvelope envelope) {
}
