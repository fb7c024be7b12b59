package com.project.sharestore.core;

/**
 * Stored bytes do not match their address or checksum. Never repaired silently.
 */
public class IntegrityException extends IllegalStateException {

    private final String blobHash;

    public IntegrityException(String blobHash, String message) {
        super(message);
        this.blobHash = blobHash;
    }

    public IntegrityException(String blobHash, String message, Throwable cause) {
        super(message, cause);
        this.blobHash = blobHash;
    }

    public String blobHash() {
        return blobHash;
    }
}
