package com.project.sharestore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Soft limit on the total bytes under the store root, measured by walking the directory tree.
 *
 * The measurement may be reused for {@code cacheTtl}; the cached value lives in this instance
 * only. A zero TTL re-walks the tree on every check.
 */
public class DirectorySizeQuota implements StorageQuota {

    private static final Logger LOG = LoggerFactory.getLogger(DirectorySizeQuota.class);

    private final Path rootDirectory;
    private final long softLimitBytes;
    private final Duration cacheTtl;
    private final Clock clock;
    private final AtomicReference<Measurement> cached = new AtomicReference<>();

    public DirectorySizeQuota(Path rootDirectory, long softLimitBytes) {
        this(rootDirectory, softLimitBytes, Duration.ZERO, Clock.systemUTC());
    }

    public DirectorySizeQuota(Path rootDirectory, long softLimitBytes, Duration cacheTtl, Clock clock) {
        this.rootDirectory = Objects.requireNonNull(rootDirectory, "rootDirectory must not be null");
        this.softLimitBytes = softLimitBytes;
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static StorageQuota forConfig(StoreConfig config) {
        if (!config.quotaEnabled()) {
            return StorageQuota.unlimited();
        }
        return new DirectorySizeQuota(config.dataDirectory(), config.softLimitBytes(),
            config.quotaCacheTtl(), Clock.systemUTC());
    }

    @Override
    public void check(long estimatedNewBytes) throws IOException {
        if (softLimitBytes <= 0) {
            return;
        }
        long requested = Math.max(0, estimatedNewBytes);
        long used = usedBytes();
        if (used + requested > softLimitBytes) {
            LOG.warn("Rejecting write of {} bytes: {} bytes used of {} allowed", requested, used, softLimitBytes);
            throw new QuotaExceededException(used, requested, softLimitBytes);
        }
    }

    @Override
    public void recordWrite(long bytes) {
        cached.updateAndGet(current -> current == null ? null
            : new Measurement(current.bytes() + Math.max(0, bytes), current.measuredAt()));
    }

    /**
     * Bytes currently used, from cache when still fresh.
     */
    public long usedBytes() throws IOException {
        Instant now = clock.instant();
        Measurement current = cached.get();
        if (current != null && !cacheTtl.isZero() && now.isBefore(current.measuredAt().plus(cacheTtl))) {
            return current.bytes();
        }
        long measured = measureDirectoryBytes(rootDirectory);
        cached.set(new Measurement(measured, now));
        return measured;
    }

    /**
     * Recursive sum of regular file sizes. A missing directory counts as empty.
     */
    public static long measureDirectoryBytes(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0L;
        }
        long[] total = {0L};
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    total[0] += attrs.size();
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }
        });
        return total[0];
    }

    private record Measurement(long bytes, Instant measuredAt) {
    }
}
