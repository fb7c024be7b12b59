package com.project.sharestore.core;

/**
 * Decoded blob file contents, discriminated by the {@code version} tag at parse time.
 */
public interface BlobPayload {

    int version();

    /**
     * Version 2: client-encrypted envelope plus its own address as checksum.
     */
    record Encrypted(EncryptedEnvelope envelope, String checksum) implements BlobPayload {
        public static final int VERSION = 2;

        @Override
        public int version() {
            return VERSION;
        }
    }

    /**
     * Version 1: plaintext playlist written before encryption was mandatory.
     * Recognized so it can be refused, never served.
     */
    record LegacyPlaintext() implements BlobPayload {
        public static final int VERSION = 1;

        @Override
        public int version() {
            return VERSION;
        }
    }
}
