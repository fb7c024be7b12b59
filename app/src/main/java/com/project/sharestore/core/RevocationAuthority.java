package com.project.sharestore.core;

import com.project.sharestore.crypto.HashingUtils;
import com.project.sharestore.io.LinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Revokes a share for whoever holds its edit token, then collects the blob if it became
 * unreferenced. Revoked links stay on disk with {@code revoked=true}.
 */
public class RevocationAuthority {

    private static final Logger LOG = LoggerFactory.getLogger(RevocationAuthority.class);

    private final LinkStore linkStore;
    private final GarbageCollector garbageCollector;

    public RevocationAuthority(LinkStore linkStore, GarbageCollector garbageCollector) {
        this.linkStore = Objects.requireNonNull(linkStore, "linkStore must not be null");
        this.garbageCollector = Objects.requireNonNull(garbageCollector, "garbageCollector must not be null");
    }

    /**
     * @param shareId        share to revoke
     * @param presentedToken edit token returned when the share was created
     * @return outcome; only {@link RevokeResult#OK} changes state
     * @throws CorruptRecordException if the link record is malformed
     */
    public RevokeResult revoke(String shareId, String presentedToken) throws IOException {
        String normalizedId = shareId == null ? "" : shareId.trim();
        if (!InputValidator.isValidShareId(normalizedId)) {
            return RevokeResult.NOT_FOUND;
        }
        // Cheap rejection before touching storage.
        if (!InputValidator.meetsEditTokenFloor(presentedToken)) {
            return RevokeResult.FORBIDDEN;
        }

        Optional<ShareLink> found = linkStore.get(normalizedId);
        if (found.isEmpty()) {
            return RevokeResult.NOT_FOUND;
        }
        ShareLink link = found.get();
        if (!link.isRevocable()) {
            return RevokeResult.UNSUPPORTED;
        }
        if (link.revoked()) {
            return RevokeResult.ALREADY_REVOKED;
        }

        String presentedHash = HashingUtils.hashEditToken(presentedToken);
        if (!HashingUtils.constantTimeHexEquals(link.editTokenHash(), presentedHash)) {
            LOG.info("Rejected revoke of {}: edit token mismatch", normalizedId);
            return RevokeResult.FORBIDDEN;
        }

        linkStore.markRevoked(link);
        GarbageCollector.Outcome outcome = garbageCollector.maybeCollect(link.effectiveBlobHash(), normalizedId);
        LOG.info("Revoked share {} (blob {}: {})", normalizedId, link.effectiveBlobHash(), outcome);
        return RevokeResult.OK;
    }
}
