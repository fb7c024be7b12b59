package com.project.sharestore.core;

import com.project.sharestore.crypto.EnvelopeCanonicalizer;
import com.project.sharestore.crypto.EnvelopeCanonicalizer.CanonicalEnvelope;
import com.project.sharestore.crypto.HashingUtils;
import com.project.sharestore.crypto.SecretGenerator;
import com.project.sharestore.io.BlobStore;
import com.project.sharestore.io.LinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for collaborators: create, read and revoke encrypted playlist shares.
 *
 * Create writes the blob first and the link second, so a crash in between leaves an
 * orphan blob rather than a link pointing at nothing.
 */
public class ShareService {

    private static final Logger LOG = LoggerFactory.getLogger(ShareService.class);

    public static final int MAX_SHARE_ID_ATTEMPTS = 5;

    private final LinkStore linkStore;
    private final BlobStore blobStore;
    private final StorageQuota quota;
    private final RevocationAuthority revocationAuthority;
    private final GarbageCollector garbageCollector;
    private final Supplier<String> shareIdGenerator;
    private final Supplier<String> editTokenGenerator;
    private final Clock clock;

    public ShareService(LinkStore linkStore,
                        BlobStore blobStore,
                        StorageQuota quota,
                        Supplier<String> shareIdGenerator,
                        Supplier<String> editTokenGenerator,
                        Clock clock) {
        this.linkStore = Objects.requireNonNull(linkStore, "linkStore must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.quota = Objects.requireNonNull(quota, "quota must not be null");
        this.shareIdGenerator = Objects.requireNonNull(shareIdGenerator, "shareIdGenerator must not be null");
        this.editTokenGenerator = Objects.requireNonNull(editTokenGenerator, "editTokenGenerator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.garbageCollector = new GarbageCollector(linkStore, blobStore, clock);
        this.revocationAuthority = new RevocationAuthority(linkStore, garbageCollector);
    }

    /**
     * Wire a service over the store described by {@code config}.
     */
    public static ShareService open(StoreConfig config) {
        return new ShareService(
            new LinkStore(config.dataDirectory()),
            new BlobStore(config.dataDirectory()),
            DirectorySizeQuota.forConfig(config),
            SecretGenerator::newShareId,
            SecretGenerator::newEditToken,
            Clock.systemUTC());
    }

    /**
     * Store an encrypted playlist under a fresh share id.
     *
     * @param envelope    client-encrypted payload
     * @param contentHash caller's hash of the logical content
     * @param revocable   issue an edit token that can later revoke the share
     * @throws InputValidator.InvalidInputException if the envelope or hash is malformed
     * @throws QuotaExceededException if the store is over its soft limit
     * @throws IllegalStateException if no free share id was found
     */
    public CreateResult createShare(EncryptedEnvelope envelope, String contentHash, boolean revocable)
            throws IOException {
        String normalizedContentHash = InputValidator.requireSha256Hex(contentHash, "contentHash");
        CanonicalEnvelope canonical = EnvelopeCanonicalizer.canonicalize(envelope);
        BlobStore.PreparedBlob blob = blobStore.prepare(canonical);

        String editToken = revocable ? editTokenGenerator.get() : null;
        String editTokenHash = editToken != null ? HashingUtils.hashEditToken(editToken) : null;
        Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        boolean blobWritten = false;
        boolean blobCreated = false;
        for (int attempt = 1; attempt <= MAX_SHARE_ID_ATTEMPTS; attempt++) {
            String shareId = shareIdGenerator.get();
            if (!InputValidator.isValidShareId(shareId)) {
                throw new IllegalStateException("Share id generator produced an invalid id");
            }
            if (linkStore.isTaken(shareId)) {
                LOG.debug("Share id collision on attempt {}", attempt);
                continue;
            }

            ShareLink link = ShareLink.create(shareId, normalizedContentHash, canonical.blobHash(),
                createdAt, editTokenHash);
            byte[] linkBytes = linkStore.encode(link);
            if (!blobWritten) {
                quota.check((long) blob.bytes().length + linkBytes.length);
                blobCreated = blobStore.put(blob);
                blobWritten = true;
                if (blobCreated) {
                    quota.recordWrite(blob.bytes().length);
                }
            }

            if (linkStore.create(link)) {
                quota.recordWrite(linkBytes.length);
                LOG.info("Created share {} (blob {}, {}, {})", shareId, canonical.blobHash(),
                    blobCreated ? "new blob" : "deduplicated", revocable ? "revocable" : "permanent");
                return new CreateResult(shareId, normalizedContentHash, canonical.blobHash(), blobCreated, editToken);
            }
            LOG.debug("Lost race for share id on attempt {}", attempt);
        }
        throw new IllegalStateException("Failed to reserve a share id after " + MAX_SHARE_ID_ATTEMPTS + " attempts");
    }

    /**
     * @return the envelope, or empty if the share does not exist, was revoked, or predates encryption
     * @throws IntegrityException if the stored blob fails verification
     */
    public Optional<EncryptedEnvelope> readShare(String shareId) throws IOException {
        return readShareRecord(shareId).map(SharedRecord::envelope);
    }

    public Optional<SharedRecord> readShareRecord(String shareId) throws IOException {
        String normalizedId = shareId == null ? "" : shareId.trim();
        if (!InputValidator.isValidShareId(normalizedId)) {
            return Optional.empty();
        }
        Optional<ShareLink> found = linkStore.get(normalizedId);
        if (found.isEmpty() || found.get().revoked()) {
            return Optional.empty();
        }
        ShareLink link = found.get();
        String blobHash = link.effectiveBlobHash();

        Optional<BlobPayload> payload = blobStore.get(blobHash);
        if (payload.isEmpty()) {
            throw new IntegrityException(blobHash, "Blob " + blobHash + " missing for active share " + normalizedId);
        }
        if (!(payload.get() instanceof BlobPayload.Encrypted)) {
            LOG.debug("Share {} points at a legacy plaintext blob; not served", normalizedId);
            return Optional.empty();
        }
        BlobPayload.Encrypted encrypted = (BlobPayload.Encrypted) payload.get();
        return Optional.of(new SharedRecord(link.shareId(), link.createdAt(), encrypted.envelope()));
    }

    public RevokeResult revokeShare(String shareId, String editToken) throws IOException {
        return revocationAuthority.revoke(shareId, editToken);
    }

    /**
     * Reuse-by-id: the caller already holds a share and wants to know whether it still serves
     * the same content.
     *
     * @return {@code shareId} if it names an active share with the given content hash
     */
    public Optional<String> findReusableShare(String shareId, String contentHash) throws IOException {
        String normalizedId = shareId == null ? "" : shareId.trim();
        String normalizedHash = HashingUtils.normalizeHex(contentHash);
        if (!InputValidator.isValidShareId(normalizedId) || !HashingUtils.isSha256Hex(normalizedHash)) {
            return Optional.empty();
        }
        return linkStore.get(normalizedId)
            .filter(link -> !link.revoked())
            .filter(link -> link.contentHash().equals(normalizedHash))
            .map(ShareLink::shareId);
    }

    public GarbageCollector garbageCollector() {
        return garbageCollector;
    }
}
