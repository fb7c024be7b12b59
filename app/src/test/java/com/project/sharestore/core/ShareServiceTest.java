package com.project.sharestore.core;

import com.project.sharestore.TestEnvelopes;
import com.project.sharestore.core.InputValidator.InvalidInputException;
import com.project.sharestore.crypto.EnvelopeCanonicalizer;
import com.project.sharestore.crypto.HashingUtils;
import com.project.sharestore.crypto.SecretGenerator;
import com.project.sharestore.io.BlobStore;
import com.project.sharestore.io.LinkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of the share store over a real directory.
 */
@DisplayName("ShareService")
class ShareServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00.123456Z");

    @TempDir
    Path root;

    private LinkStore links;
    private BlobStore blobs;
    private ShareService service;

    @BeforeEach
    void setUp() {
        links = new LinkStore(root);
        blobs = new BlobStore(root);
        service = serviceWith(StorageQuota.unlimited(), SecretGenerator::newShareId);
    }

    private ShareService serviceWith(StorageQuota quota, Supplier<String> shareIds) {
        return new ShareService(links, blobs, quota, shareIds, SecretGenerator::newEditToken,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Supplier<String> sequence(String... ids) {
        Deque<String> queue = new ArrayDeque<>(List.of(ids));
        return queue::removeFirst;
    }

    @Nested
    @DisplayName("Create and read")
    class CreateAndRead {

        @Test
        void roundTrip() throws IOException {
            EncryptedEnvelope envelope = TestEnvelopes.envelope("round-trip");

            CreateResult created = service.createShare(envelope, TestEnvelopes.contentHash("round-trip"), false);

            assertTrue(InputValidator.isValidShareId(created.shareId()));
            assertTrue(created.blobCreated());
            assertNull(created.editToken());
            assertFalse(created.revocable());
            assertEquals(EnvelopeCanonicalizer.blobHash(envelope), created.blobHash());
            assertEquals(envelope, service.readShare(created.shareId()).orElseThrow());

            SharedRecord record = service.readShareRecord(created.shareId()).orElseThrow();
            assertEquals(Instant.parse("2024-06-01T12:00:00.123Z"), record.createdAt());
        }

        @Test
        @DisplayName("Identical envelopes share one blob but get independent links")
        void deduplicates() throws IOException {
            EncryptedEnvelope envelope = TestEnvelopes.envelope("dedup");
            String contentHash = TestEnvelopes.contentHash("dedup");

            CreateResult first = service.createShare(envelope, contentHash, false);
            CreateResult second = service.createShare(envelope, contentHash, false);

            assertNotEquals(first.shareId(), second.shareId());
            assertEquals(first.blobHash(), second.blobHash());
            assertTrue(first.blobCreated());
            assertFalse(second.blobCreated());
            assertEquals(List.of(first.blobHash()), blobs.listHashes());
            assertEquals(2, links.list().size());
        }

        @Test
        void contentHashIsNormalized() throws IOException {
            String contentHash = TestEnvelopes.contentHash("case");
            CreateResult created = service.createShare(TestEnvelopes.envelope("case"),
                " " + contentHash.toUpperCase() + " ", false);

            assertEquals(contentHash, created.contentHash());
            assertEquals(contentHash, links.get(created.shareId()).orElseThrow().contentHash());
        }

        @Test
        @DisplayName("Malformed input is rejected before anything is written")
        void rejectsMalformedInput() throws IOException {
            assertThrows(InvalidInputException.class,
                () -> service.createShare(TestEnvelopes.envelope("x"), "not-a-hash", false));
            assertThrows(InvalidInputException.class,
                () -> service.createShare(EncryptedEnvelope.a256gcm("short", "c".repeat(30)),
                    TestEnvelopes.contentHash("x"), false));
            assertThrows(InvalidInputException.class,
                () -> service.createShare(null, TestEnvelopes.contentHash("x"), false));

            assertTrue(blobs.listHashes().isEmpty());
            assertTrue(links.list().isEmpty());
        }

        @Test
        @DisplayName("Unknown, malformed and revoked shares read as absent")
        void absentShares() throws IOException {
            assertTrue(service.readShare("doesNotExist000000").isEmpty());
            assertTrue(service.readShare("../../etc/passwd").isEmpty());
            assertTrue(service.readShare(null).isEmpty());

            CreateResult created = service.createShare(TestEnvelopes.envelope("gone"),
                TestEnvelopes.contentHash("gone"), true);
            service.revokeShare(created.shareId(), created.editToken());
            assertTrue(service.readShare(created.shareId()).isEmpty());
        }

        @Test
        @DisplayName("Concurrent creates of one envelope write the blob exactly once")
        void concurrentCreates() throws Exception {
            EncryptedEnvelope envelope = TestEnvelopes.envelope("concurrent");
            String contentHash = TestEnvelopes.contentHash("concurrent");
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Callable<CreateResult>> tasks = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    tasks.add(() -> service.createShare(envelope, contentHash, false));
                }
                Set<String> ids = new HashSet<>();
                int blobCreations = 0;
                for (Future<CreateResult> future : pool.invokeAll(tasks)) {
                    CreateResult result = future.get();
                    ids.add(result.shareId());
                    if (result.blobCreated()) {
                        blobCreations++;
                    }
                }
                assertEquals(16, ids.size());
                assertEquals(1, blobCreations);
                for (String id : ids) {
                    assertEquals(envelope, service.readShare(id).orElseThrow());
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Share id allocation")
    class ShareIdAllocation {

        @Test
        @DisplayName("Colliding ids are skipped until the last allowed attempt")
        void retriesOnCollision() throws IOException {
            String taken = "takenShareId000001";
            String free = "freeShareId0000002";
            serviceWith(StorageQuota.unlimited(), sequence(taken))
                .createShare(TestEnvelopes.envelope("first"), TestEnvelopes.contentHash("first"), false);
            Supplier<String> ids = sequence(taken, taken, taken, taken, free);

            CreateResult result = serviceWith(StorageQuota.unlimited(), ids)
                .createShare(TestEnvelopes.envelope("second"), TestEnvelopes.contentHash("second"), false);

            assertEquals(free, result.shareId());
            assertEquals(2, links.list().size());
            assertEquals(TestEnvelopes.envelope("first"), service.readShare(taken).orElseThrow());
        }

        @Test
        @DisplayName("Gives up after five collisions without writing a blob")
        void exhaustsAttempts() throws IOException {
            String taken = "takenShareId000001";
            serviceWith(StorageQuota.unlimited(), sequence(taken))
                .createShare(TestEnvelopes.envelope("first"), TestEnvelopes.contentHash("first"), false);
            int[] calls = {0};
            ShareService stuck = serviceWith(StorageQuota.unlimited(), () -> {
                calls[0]++;
                return taken;
            });
            EncryptedEnvelope envelope = TestEnvelopes.envelope("never-stored");

            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> stuck.createShare(envelope, TestEnvelopes.contentHash("never"), false));

            assertTrue(e.getMessage().contains("5 attempts"), e.getMessage());
            assertEquals(ShareService.MAX_SHARE_ID_ATTEMPTS, calls[0]);
            assertFalse(blobs.exists(EnvelopeCanonicalizer.blobHash(envelope)));
        }

        @Test
        void invalidGeneratedIdFails() {
            ShareService broken = serviceWith(StorageQuota.unlimited(), () -> "bad/id");
            assertThrows(IllegalStateException.class,
                () -> broken.createShare(TestEnvelopes.envelope("x"), TestEnvelopes.contentHash("x"), false));
        }
    }

    @Nested
    @DisplayName("Revocation")
    class Revocation {

        @Test
        @DisplayName("Only the edit token holder can revoke")
        void tokenRequired() throws IOException {
            CreateResult created = service.createShare(TestEnvelopes.envelope("owned"),
                TestEnvelopes.contentHash("owned"), true);
            assertTrue(created.revocable());
            assertTrue(InputValidator.meetsEditTokenFloor(created.editToken()));

            assertEquals(RevokeResult.FORBIDDEN, service.revokeShare(created.shareId(), SecretGenerator.newEditToken()));
            assertTrue(service.readShare(created.shareId()).isPresent());

            assertEquals(RevokeResult.OK, service.revokeShare(created.shareId(), created.editToken()));
            assertEquals(RevokeResult.ALREADY_REVOKED, service.revokeShare(created.shareId(), created.editToken()));
        }

        @Test
        @DisplayName("Only the token hash is persisted")
        void tokenNotStored() throws IOException {
            CreateResult created = service.createShare(TestEnvelopes.envelope("secret"),
                TestEnvelopes.contentHash("secret"), true);
            String json = Files.readString(links.pathFor(created.shareId()));

            assertFalse(json.contains(created.editToken()));
            assertTrue(json.contains(HashingUtils.hashEditToken(created.editToken())));
        }

        @Test
        @DisplayName("Revoking one of two shares of a blob leaves the other intact")
        void fanInIsolation() throws IOException {
            EncryptedEnvelope envelope = TestEnvelopes.envelope("fan-in");
            String contentHash = TestEnvelopes.contentHash("fan-in");
            CreateResult first = service.createShare(envelope, contentHash, true);
            CreateResult second = service.createShare(envelope, contentHash, true);

            assertEquals(RevokeResult.OK, service.revokeShare(first.shareId(), first.editToken()));
            assertTrue(blobs.exists(second.blobHash()));
            assertEquals(envelope, service.readShare(second.shareId()).orElseThrow());

            assertEquals(RevokeResult.OK, service.revokeShare(second.shareId(), second.editToken()));
            assertFalse(blobs.exists(second.blobHash()));
        }

        @Test
        void permanentSharesAreUnsupported() throws IOException {
            CreateResult created = service.createShare(TestEnvelopes.envelope("permanent"),
                TestEnvelopes.contentHash("permanent"), false);
            assertEquals(RevokeResult.UNSUPPORTED, service.revokeShare(created.shareId(), SecretGenerator.newEditToken()));
        }
    }

    @Nested
    @DisplayName("Integrity")
    class Integrity {

        @Test
        void tamperedBlobIsDetected() throws IOException {
            CreateResult created = service.createShare(TestEnvelopes.envelope("tamper"),
                TestEnvelopes.contentHash("tamper"), false);
            Path blobPath = blobs.pathFor(created.blobHash());
            byte[] bytes = Files.readAllBytes(blobPath);
            bytes[bytes.length / 2] ^= 0x01;
            Files.write(blobPath, bytes);

            assertThrows(IntegrityException.class, () -> service.readShare(created.shareId()));
        }

        @Test
        @DisplayName("An active link whose blob vanished is an integrity failure")
        void missingBlob() throws IOException {
            CreateResult created = service.createShare(TestEnvelopes.envelope("vanished"),
                TestEnvelopes.contentHash("vanished"), false);
            blobs.delete(created.blobHash());

            IntegrityException e = assertThrows(IntegrityException.class, () -> service.readShare(created.shareId()));
            assertEquals(created.blobHash(), e.blobHash());
        }

        @Test
        @DisplayName("Legacy plaintext blobs are never served")
        void legacyPlaintextNotServed() throws IOException {
            String shareId = "legacyPlaintext0001";
            String hash = HashingUtils.sha256Hex("legacy-blob");
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
                out.write("{\"version\":1,\"playlist\":{\"tracks\":[]}}".getBytes(StandardCharsets.UTF_8));
            }
            Files.createDirectories(blobs.pathFor(hash).getParent());
            Files.write(blobs.pathFor(hash), buffer.toByteArray());
            links.create(ShareLink.create(shareId, TestEnvelopes.contentHash("legacy"), hash, Instant.EPOCH, null));

            assertTrue(service.readShare(shareId).isEmpty());
        }
    }

    @Nested
    @DisplayName("Quota")
    class Quota {

        @Test
        @DisplayName("Writes past the soft limit are refused and leave no files")
        void rejectsOverLimit() {
            ShareService limited = serviceWith(new DirectorySizeQuota(root, 64), SecretGenerator::newShareId);

            assertThrows(QuotaExceededException.class, () -> limited.createShare(TestEnvelopes.envelope("big"),
                TestEnvelopes.contentHash("big"), false));
            assertFalse(Files.exists(blobs.directory()));
            assertFalse(Files.exists(links.directory()));
        }

        @Test
        void allowsWritesUnderLimit() throws IOException {
            ShareService roomy = serviceWith(new DirectorySizeQuota(root, 1_000_000), SecretGenerator::newShareId);
            CreateResult created = roomy.createShare(TestEnvelopes.envelope("small"),
                TestEnvelopes.contentHash("small"), false);
            assertTrue(roomy.readShare(created.shareId()).isPresent());
        }
    }

    @Test
    @DisplayName("A share is reusable only while active and holding the same content")
    void findReusableShare() throws IOException {
        String contentHash = TestEnvelopes.contentHash("reuse");
        CreateResult created = service.createShare(TestEnvelopes.envelope("reuse"), contentHash, true);

        assertEquals(created.shareId(), service.findReusableShare(created.shareId(), contentHash.toUpperCase()).orElseThrow());
        assertTrue(service.findReusableShare(created.shareId(), TestEnvelopes.contentHash("changed")).isEmpty());
        assertTrue(service.findReusableShare("bad", contentHash).isEmpty());

        service.revokeShare(created.shareId(), created.editToken());
        assertTrue(service.findReusableShare(created.shareId(), contentHash).isEmpty());
    }

    @Test
    void openWiresStoreFromConfig() throws IOException {
        ShareService opened = ShareService.open(StoreConfig.forDirectory(root));
        CreateResult created = opened.createShare(TestEnvelopes.envelope("open"), TestEnvelopes.contentHash("open"), false);

        assertEquals(TestEnvelopes.envelope("open"), service.readShare(created.shareId()).orElseThrow());
    }
}
