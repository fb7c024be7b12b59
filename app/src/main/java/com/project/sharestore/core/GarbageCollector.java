package com.project.sharestore.core;

import com.project.sharestore.crypto.HashingUtils;
import com.project.sharestore.io.BlobStore;
import com.project.sharestore.io.LinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reference-counted deletion of blobs that no active link points at.
 *
 * Runs inline on the revoke path. Errors while enumerating links abort the collection:
 * a leaked blob is acceptable, deleting a blob a live link still needs is not.
 */
public class GarbageCollector {

    private static final Logger LOG = LoggerFactory.getLogger(GarbageCollector.class);

    public enum Outcome {
        DELETED,
        STILL_REFERENCED,
        ALREADY_ABSENT,
        ABORTED
    }

    /**
     * Result of a full orphan sweep.
     *
     * @param scanned  blobs examined
     * @param deleted  orphan blobs removed
     * @param retained blobs kept (referenced, or too young to judge)
     * @param aborted  true if link enumeration failed and nothing was deleted
     */
    public record SweepResult(int scanned, int deleted, int retained, boolean aborted) {
        static SweepResult abortedSweep() {
            return new SweepResult(0, 0, 0, true);
        }
    }

    private final LinkStore linkStore;
    private final BlobStore blobStore;
    private final Clock clock;

    public GarbageCollector(LinkStore linkStore, BlobStore blobStore) {
        this(linkStore, blobStore, Clock.systemUTC());
    }

    public GarbageCollector(LinkStore linkStore, BlobStore blobStore, Clock clock) {
        this.linkStore = Objects.requireNonNull(linkStore, "linkStore must not be null");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Delete {@code blobHash} unless another non-revoked link still references it.
     *
     * @param blobHash         blob of the link that was just revoked
     * @param excludingShareId the revoked link itself
     * @throws IOException if the blob could not be deleted
     */
    public Outcome maybeCollect(String blobHash, String excludingShareId) throws IOException {
        String hash = HashingUtils.normalizeHex(blobHash);
        if (!HashingUtils.isSha256Hex(hash)) {
            LOG.warn("Skipping collection of malformed blob hash '{}'", blobHash);
            return Outcome.ABORTED;
        }

        Set<Path> seen = new HashSet<>();
        try {
            if (hasOtherActiveReference(hash, excludingShareId, linkStore.list(), seen)) {
                return Outcome.STILL_REFERENCED;
            }
            // Links created while the first pass ran.
            List<Path> fresh = linkStore.list().stream()
                .filter(path -> !seen.contains(path))
                .collect(Collectors.toList());
            if (hasOtherActiveReference(hash, excludingShareId, fresh, seen)) {
                return Outcome.STILL_REFERENCED;
            }
        } catch (IOException | UncheckedIOException | CorruptRecordException e) {
            LOG.warn("Aborting collection of blob {}: link scan failed: {}", hash, e.getMessage());
            return Outcome.ABORTED;
        }

        boolean deleted = blobStore.delete(hash);
        LOG.info("Collected blob {} after revoking {}: {}", hash, excludingShareId,
            deleted ? "deleted" : "already absent");
        return deleted ? Outcome.DELETED : Outcome.ALREADY_ABSENT;
    }

    /**
     * Delete every blob no active link references, skipping blobs modified within {@code minAge}
     * so a create that has written its blob but not yet its link is left alone. Link files that
     * appear while candidates are chosen are read again before anything is deleted.
     */
    public SweepResult sweep(Duration minAge) throws IOException {
        Set<Path> seen = new HashSet<>();
        Set<String> referenced = new HashSet<>();
        try {
            collectActiveBlobHashes(linkStore.list(), seen, referenced);
        } catch (IOException | UncheckedIOException | CorruptRecordException e) {
            LOG.warn("Aborting orphan sweep: link scan failed: {}", e.getMessage());
            return SweepResult.abortedSweep();
        }

        Instant cutoff = clock.instant().minus(minAge);
        List<String> hashes = blobStore.listHashes();
        List<String> candidates = new ArrayList<>();
        for (String hash : hashes) {
            if (!referenced.contains(hash) && isOlderThan(blobStore.pathFor(hash), cutoff)) {
                candidates.add(hash);
            }
        }

        if (!candidates.isEmpty()) {
            try {
                List<Path> fresh = linkStore.list().stream()
                    .filter(path -> !seen.contains(path))
                    .collect(Collectors.toList());
                collectActiveBlobHashes(fresh, seen, referenced);
            } catch (IOException | UncheckedIOException | CorruptRecordException e) {
                LOG.warn("Aborting orphan sweep: link re-check failed: {}", e.getMessage());
                return SweepResult.abortedSweep();
            }
        }

        int deleted = 0;
        for (String hash : candidates) {
            // a dedup hit refreshes the blob's mtime before its link is written
            if (referenced.contains(hash) || !isOlderThan(blobStore.pathFor(hash), cutoff)) {
                continue;
            }
            if (blobStore.delete(hash)) {
                deleted++;
            }
        }
        int retained = hashes.size() - deleted;
        LOG.info("Orphan sweep: scanned {}, deleted {}, retained {}", hashes.size(), deleted, retained);
        return new SweepResult(hashes.size(), deleted, retained, false);
    }

    private boolean hasOtherActiveReference(String hash, String excludingShareId,
                                            List<Path> linkPaths, Set<Path> seen) throws IOException {
        for (Path linkPath : linkPaths) {
            seen.add(linkPath);
            Optional<ShareLink> link = linkStore.read(linkPath);
            if (link.isEmpty()) {
                continue;
            }
            ShareLink candidate = link.get();
            if (candidate.shareId().equals(excludingShareId) || candidate.revoked()) {
                continue;
            }
            if (candidate.effectiveBlobHash().equals(hash)) {
                return true;
            }
        }
        return false;
    }

    private void collectActiveBlobHashes(List<Path> linkPaths, Set<Path> seen, Set<String> hashes)
            throws IOException {
        for (Path linkPath : linkPaths) {
            seen.add(linkPath);
            linkStore.read(linkPath)
                .filter(link -> !link.revoked())
                .ifPresent(link -> hashes.add(link.effectiveBlobHash()));
        }
    }

    private static boolean isOlderThan(Path path, Instant cutoff) throws IOException {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(cutoff);
        } catch (NoSuchFileException e) {
            return false;
        }
    }
}
