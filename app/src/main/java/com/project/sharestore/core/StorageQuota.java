package com.project.sharestore.core;

import java.io.IOException;

/**
 * Gate consulted before every write. Best-effort: concurrent writers can jointly overshoot.
 */
public interface StorageQuota {

    /**
     * @param estimatedNewBytes bytes the pending write will add
     * @throws QuotaExceededException if the write would exceed the limit
     */
    void check(long estimatedNewBytes) throws IOException;

    /**
     * Notification that {@code bytes} were written after a successful check.
     */
    default void recordWrite(long bytes) {
    }

    static StorageQuota unlimited() {
        return estimatedNewBytes -> { };
    }
}
