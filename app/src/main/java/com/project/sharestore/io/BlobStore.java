package com.project.sharestore.io;

import com.project.sharestore.core.BlobPayload;
import com.project.sharestore.core.EncryptedEnvelope;
import com.project.sharestore.core.InputValidator;
import com.project.sharestore.core.IntegrityException;
import com.project.sharestore.crypto.EnvelopeCanonicalizer;
import com.project.sharestore.crypto.EnvelopeCanonicalizer.CanonicalEnvelope;
import com.project.sharestore.crypto.HashingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Content-addressed, gzip-compressed storage of encrypted envelopes.
 *
 * Layout: {@code <root>/blobs/<h[0..2]>/<h[2..4]>/<hash>.json.gz}. A blob is written once,
 * never modified, and only removed by garbage collection.
 */
public class BlobStore {

    private static final Logger LOG = LoggerFactory.getLogger(BlobStore.class);

    static final String BLOBS_DIR_NAME = "blobs";
    static final String BLOB_SUFFIX = ".json.gz";

    private final Path blobsDirectory;
    private final Clock clock;

    public BlobStore(Path rootDirectory) {
        this(rootDirectory, Clock.systemUTC());
    }

    public BlobStore(Path rootDirectory, Clock clock) {
        this.blobsDirectory = rootDirectory.resolve(BLOBS_DIR_NAME);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Serialize a canonical envelope without touching disk, so its size can be checked first.
     */
    public PreparedBlob prepare(CanonicalEnvelope canonical) {
        byte[] bytes = BlobCodec.encode(canonical.envelope(), canonical.blobHash());
        return new PreparedBlob(canonical.blobHash(), bytes);
    }

    /**
     * Store an envelope under its hash.
     *
     * @param hash     expected address; must equal the canonical hash of {@code envelope}
     * @param envelope payload to store
     * @return true if this call created the blob, false if it already existed
     */
    public boolean put(String hash, EncryptedEnvelope envelope) throws IOException {
        String normalized = InputValidator.requireSha256Hex(hash, "blobHash");
        CanonicalEnvelope canonical = EnvelopeCanonicalizer.canonicalize(envelope);
        if (!canonical.blobHash().equals(normalized)) {
            throw new InputValidator.InvalidInputException(
                    "blobHash " + normalized + " does not address the supplied envelope");
        }
        return put(prepare(canonical));
    }

    /**
     * Store prepared bytes. On a dedup hit the existing file's modification time is refreshed,
     * so the orphan sweep's grace period also covers blobs that a pending link is about to reuse.
     */
    public boolean put(PreparedBlob blob) throws IOException {
        Path path = pathFor(blob.hash());
        for (int attempt = 1; ; attempt++) {
            if (AtomicFiles.createUnique(path, blob.bytes())) {
                LOG.debug("Stored blob {} ({} bytes)", blob.hash(), blob.bytes().length);
                return true;
            }
            try {
                Files.setLastModifiedTime(path, FileTime.from(clock.instant()));
                LOG.debug("Blob {} already present", blob.hash());
                return false;
            } catch (NoSuchFileException e) {
                // collected between the create attempt and the touch
                if (attempt >= 2) {
                    throw e;
                }
                LOG.debug("Blob {} vanished during dedup, rewriting", blob.hash());
            }
        }
    }

    /**
     * Load and verify a blob.
     *
     * @return empty if no blob is stored under {@code hash}
     * @throws IntegrityException if the stored bytes do not match {@code hash} or their checksum
     */
    public Optional<BlobPayload> get(String hash) throws IOException {
        String normalized = InputValidator.requireSha256Hex(hash, "blobHash");
        byte[] compressed;
        try {
            compressed = Files.readAllBytes(pathFor(normalized));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }

        BlobPayload payload = BlobCodec.decode(normalized, compressed);
        if (!(payload instanceof BlobPayload.Encrypted)) {
            return Optional.of(payload);
        }
        BlobPayload.Encrypted encrypted = (BlobPayload.Encrypted) payload;

        CanonicalEnvelope canonical;
        try {
            canonical = EnvelopeCanonicalizer.canonicalize(encrypted.envelope());
        } catch (InputValidator.InvalidInputException e) {
            throw new IntegrityException(normalized, "Blob " + normalized + " holds an invalid envelope", e);
        }
        if (!canonical.blobHash().equals(normalized)) {
            throw new IntegrityException(normalized,
                    "Shared playlist integrity check failed for blob " + normalized);
        }
        String checksum = HashingUtils.normalizeHex(encrypted.checksum());
        if (checksum != null && !checksum.isEmpty() && !checksum.equals(canonical.blobHash())) {
            throw new IntegrityException(normalized, "Shared playlist checksum mismatch for blob " + normalized);
        }
        return Optional.of(new BlobPayload.Encrypted(canonical.envelope(), canonical.blobHash()));
    }

    public boolean exists(String hash) {
        return Files.isRegularFile(pathFor(InputValidator.requireSha256Hex(hash, "blobHash")));
    }

    /**
     * Remove a blob. Already absent counts as success.
     *
     * @return true if a file was removed
     */
    public boolean delete(String hash) throws IOException {
        String normalized = InputValidator.requireSha256Hex(hash, "blobHash");
        Path path = pathFor(normalized);
        boolean deleted = Files.deleteIfExists(path);
        LOG.debug("Delete blob {}: {}", normalized, deleted ? "removed" : "already absent");
        if (deleted) {
            pruneIfEmpty(path.getParent());
            pruneIfEmpty(path.getParent().getParent());
        }
        return deleted;
    }

    /**
     * Hashes of every stored blob. Temp files and stray names are skipped.
     */
    public List<String> listHashes() throws IOException {
        try (Stream<Path> files = Files.find(blobsDirectory, 3,
                (path, attrs) -> attrs.isRegularFile() && path.getFileName().toString().endsWith(BLOB_SUFFIX))) {
            return files
                    .map(BlobStore::hashOf)
                    .filter(HashingUtils::isSha256Hex)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        }
    }

    public Path pathFor(String hash) {
        String lower = HashingUtils.normalizeHex(hash);
        return blobsDirectory
                .resolve(lower.substring(0, 2))
                .resolve(lower.substring(2, 4))
                .resolve(lower + BLOB_SUFFIX);
    }

    public Path directory() {
        return blobsDirectory;
    }

    /**
     * Remove an empty shard directory. Non-empty or already removed directories are left alone.
     */
    private void pruneIfEmpty(Path shard) throws IOException {
        if (shard.equals(blobsDirectory) || !shard.startsWith(blobsDirectory)) {
            return;
        }
        try {
            Files.delete(shard);
            LOG.debug("Pruned empty shard directory {}", shard);
        } catch (DirectoryNotEmptyException | NoSuchFileException e) {
            LOG.trace("Shard directory {} kept: {}", shard, e.getClass().getSimpleName());
        }
    }

    private static String hashOf(Path path) {
        String name = path.getFileName().toString();
        return name.substring(0, name.length() - BLOB_SUFFIX.length());
    }

    /**
     * Encoded blob ready to be written.
     */
    public record PreparedBlob(String hash, byte[] bytes) {
    }
}
