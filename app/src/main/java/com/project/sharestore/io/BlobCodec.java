package com.project.sharestore.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.sharestore.core.BlobPayload;
import com.project.sharestore.core.EncryptedEnvelope;
import com.project.sharestore.core.IntegrityException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzipped JSON encoding of blob files.
 *
 * Format (before compression): {@code {"version":2,"encrypted":{...},"checksum":"<hash>"}}.
 * The {@code version} tag selects the payload variant when decoding.
 */
final class BlobCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BlobCodec() {
    }

    static byte[] encode(EncryptedEnvelope envelope, String checksum) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", BlobPayload.Encrypted.VERSION);
        root.set("encrypted", MAPPER.valueToTree(envelope));
        root.put("checksum", checksum);
        try {
            return gzip(MAPPER.writeValueAsBytes(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize blob for " + checksum, e);
        }
    }

    /**
     * Decode a blob file. Does not verify the hash; callers re-derive it from the envelope.
     *
     * @throws IntegrityException if the bytes are not a well-formed blob
     */
    static BlobPayload decode(String blobHash, byte[] compressed) {
        JsonNode root;
        try {
            root = MAPPER.readTree(gunzip(compressed));
        } catch (IOException e) {
            throw new IntegrityException(blobHash, "Blob " + blobHash + " is not readable gzip JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IntegrityException(blobHash, "Blob " + blobHash + " is not a JSON object");
        }

        int version = root.path("version").asInt(-1);
        switch (version) {
            case BlobPayload.Encrypted.VERSION:
                return decodeEncrypted(blobHash, root);
            case BlobPayload.LegacyPlaintext.VERSION:
                return new BlobPayload.LegacyPlaintext();
            default:
                throw new IntegrityException(blobHash, "Blob " + blobHash + " has unknown version " + root.path("version"));
        }
    }

    private static BlobPayload.Encrypted decodeEncrypted(String blobHash, JsonNode root) {
        JsonNode encrypted = root.get("encrypted");
        if (encrypted == null || !encrypted.isObject()) {
            throw new IntegrityException(blobHash, "Blob " + blobHash + " has no encrypted envelope");
        }
        EncryptedEnvelope envelope;
        try {
            envelope = MAPPER.treeToValue(encrypted, EncryptedEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new IntegrityException(blobHash, "Blob " + blobHash + " has a malformed envelope", e);
        }
        JsonNode checksum = root.get("checksum");
        String checksumText = checksum != null && checksum.isTextual() ? checksum.asText() : null;
        return new BlobPayload.Encrypted(envelope, checksumText);
    }

    private static byte[] gzip(byte[] raw) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
        try (GZIPOutputStream out = new GZIPOutputStream(buffer) {
            {
                def.setLevel(Deflater.BEST_COMPRESSION);
            }
        }) {
            out.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory gzip failed", e);
        }
        return buffer.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }
}
