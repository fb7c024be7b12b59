package com.project.sharestore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Store settings, read from environment variables:
 * - PLAYLIST_SHARE_DATA_DIR: store root (default ./data/playlist-shares)
 * - PLAYLIST_SHARE_SOFT_LIMIT_BYTES: soft storage limit; absent, invalid or <= 0 disables it
 * - PLAYLIST_SHARE_QUOTA_CACHE_MS: how long a measured store size may be reused (default 0)
 * - PLAYLIST_SHARE_SWEEP_MIN_AGE_MS: orphan sweep skips blobs younger than this (default 1h)
 *
 * @param dataDirectory  absolute store root
 * @param softLimitBytes soft limit in bytes, 0 when disabled
 * @param quotaCacheTtl  quota measurement TTL, zero to measure on every write
 * @param sweepMinAge    grace period protecting blobs of in-flight creates
 */
public record StoreConfig(Path dataDirectory, long softLimitBytes, Duration quotaCacheTtl, Duration sweepMinAge) {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    public static final String DATA_DIR_ENV = "PLAYLIST_SHARE_DATA_DIR";
    public static final String SOFT_LIMIT_ENV = "PLAYLIST_SHARE_SOFT_LIMIT_BYTES";
    public static final String QUOTA_CACHE_ENV = "PLAYLIST_SHARE_QUOTA_CACHE_MS";
    public static final String SWEEP_MIN_AGE_ENV = "PLAYLIST_SHARE_SWEEP_MIN_AGE_MS";

    static final Path DEFAULT_RELATIVE_DATA_DIR = Paths.get("data", "playlist-shares");
    static final Duration DEFAULT_SWEEP_MIN_AGE = Duration.ofHours(1);

    public StoreConfig {
        Objects.requireNonNull(dataDirectory, "dataDirectory must not be null");
        Objects.requireNonNull(quotaCacheTtl, "quotaCacheTtl must not be null");
        Objects.requireNonNull(sweepMinAge, "sweepMinAge must not be null");
        dataDirectory = dataDirectory.toAbsolutePath().normalize();
        softLimitBytes = Math.max(0, softLimitBytes);
        if (quotaCacheTtl.isNegative()) {
            quotaCacheTtl = Duration.ZERO;
        }
        if (sweepMinAge.isNegative()) {
            sweepMinAge = Duration.ZERO;
        }
    }

    public static StoreConfig forDirectory(Path dataDirectory) {
        return new StoreConfig(dataDirectory, 0, Duration.ZERO, DEFAULT_SWEEP_MIN_AGE);
    }

    public static StoreConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static StoreConfig fromEnvironment(Map<String, String> env) {
        String configuredDir = trimmed(env.get(DATA_DIR_ENV));
        Path dataDirectory = configuredDir.isEmpty()
            ? Paths.get("").toAbsolutePath().resolve(DEFAULT_RELATIVE_DATA_DIR)
            : Paths.get(configuredDir);

        long softLimit = parsePositive(SOFT_LIMIT_ENV, env.get(SOFT_LIMIT_ENV));
        long cacheMs = parsePositive(QUOTA_CACHE_ENV, env.get(QUOTA_CACHE_ENV));
        String rawMinAge = trimmed(env.get(SWEEP_MIN_AGE_ENV));
        Duration sweepMinAge = rawMinAge.isEmpty()
            ? DEFAULT_SWEEP_MIN_AGE
            : Duration.ofMillis(parsePositive(SWEEP_MIN_AGE_ENV, rawMinAge));

        return new StoreConfig(dataDirectory, softLimit, Duration.ofMillis(cacheMs), sweepMinAge);
    }

    public boolean quotaEnabled() {
        return softLimitBytes > 0;
    }

    /**
     * Parse a non-negative whole number; fractional values are floored. Anything unusable is 0.
     */
    static long parsePositive(String name, String raw) {
        String value = trimmed(raw);
        if (value.isEmpty()) {
            return 0;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring {}: '{}' is not a number", name, value);
            return 0;
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed) || parsed <= 0) {
            return 0;
        }
        return (long) Math.floor(parsed);
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
