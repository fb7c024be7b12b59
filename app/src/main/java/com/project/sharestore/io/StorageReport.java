package com.project.sharestore.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Snapshot of what the store holds on disk.
 *
 * @param dataDirectory store root
 * @param linkCount     link record files
 * @param linkBytes     bytes used by link records
 * @param blobCount     blob files
 * @param blobBytes     bytes used by blobs
 * @param legacyCount   pre-link share records directly under the root
 * @param legacyBytes   bytes used by legacy records
 */
public record StorageReport(
        Path dataDirectory,
        long linkCount,
        long linkBytes,
        long blobCount,
        long blobBytes,
        long legacyCount,
        long legacyBytes
) {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    public long totalBytes() {
        return linkBytes + blobBytes + legacyBytes;
    }

    /**
     * Links per blob; above 1.0 means deduplication is saving space.
     */
    public double dedupRatio() {
        return blobCount > 0 ? (double) linkCount / blobCount : 0.0;
    }

    public String format() {
        return String.join(System.lineSeparator(),
                "Playlist Share Storage Report",
                "=============================",
                "Data dir: " + dataDirectory,
                String.format(Locale.ROOT, "Links: %d (%s)", linkCount, bytesToHuman(linkBytes)),
                String.format(Locale.ROOT, "Blobs: %d (%s)", blobCount, bytesToHuman(blobBytes)),
                String.format(Locale.ROOT, "Legacy files: %d (%s)", legacyCount, bytesToHuman(legacyBytes)),
                "Total size: " + bytesToHuman(totalBytes()),
                String.format(Locale.ROOT, "Dedup ratio (links/blobs): %.2f", dedupRatio()));
    }

    public static String bytesToHuman(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        double value = bytes;
        int unitIndex = 0;
        while (value >= 1024 && unitIndex < UNITS.length - 1) {
            value /= 1024;
            unitIndex++;
        }
        if (unitIndex == 0) {
            return String.format(Locale.ROOT, "%d %s", bytes, UNITS[0]);
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unitIndex]);
    }
}
