package com.project.sharestore.core;

/**
 * A write would push the store past its soft storage limit.
 */
public class QuotaExceededException extends IllegalStateException {

    private final long usedBytes;
    private final long requestedBytes;
    private final long limitBytes;

    public QuotaExceededException(long usedBytes, long requestedBytes, long limitBytes) {
        super(String.format("Playlist share storage limit exceeded: used %d + requested %d > limit %d bytes",
                usedBytes, requestedBytes, limitBytes));
        this.usedBytes = usedBytes;
        this.requestedBytes = requestedBytes;
        this.limitBytes = limitBytes;
    }

    public long usedBytes() {
        return usedBytes;
    }

    public long requestedBytes() {
        return requestedBytes;
    }

    public long limitBytes() {
        return limitBytes;
    }
}
