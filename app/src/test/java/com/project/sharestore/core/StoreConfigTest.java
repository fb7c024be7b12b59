package com.project.sharestore.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StoreConfig")
class StoreConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Defaults: working-directory store, no quota, one hour sweep grace")
    void defaults() {
        StoreConfig config = StoreConfig.fromEnvironment(Map.of());

        assertEquals(Paths.get("").toAbsolutePath().resolve("data").resolve("playlist-shares").normalize(),
            config.dataDirectory());
        assertFalse(config.quotaEnabled());
        assertEquals(Duration.ZERO, config.quotaCacheTtl());
        assertEquals(Duration.ofHours(1), config.sweepMinAge());
    }

    @Test
    void readsAllVariables() {
        StoreConfig config = StoreConfig.fromEnvironment(Map.of(
            StoreConfig.DATA_DIR_ENV, "  " + tempDir + "  ",
            StoreConfig.SOFT_LIMIT_ENV, "1048576",
            StoreConfig.QUOTA_CACHE_ENV, "2500",
            StoreConfig.SWEEP_MIN_AGE_ENV, "60000"));

        assertEquals(tempDir.toAbsolutePath().normalize(), config.dataDirectory());
        assertTrue(config.quotaEnabled());
        assertEquals(1_048_576L, config.softLimitBytes());
        assertEquals(Duration.ofMillis(2500), config.quotaCacheTtl());
        assertEquals(Duration.ofMinutes(1), config.sweepMinAge());
    }

    @Test
    @DisplayName("Unusable limits disable the quota instead of failing")
    void unusableLimits() {
        assertFalse(StoreConfig.fromEnvironment(Map.of(StoreConfig.SOFT_LIMIT_ENV, "lots")).quotaEnabled());
        assertFalse(StoreConfig.fromEnvironment(Map.of(StoreConfig.SOFT_LIMIT_ENV, "-5")).quotaEnabled());
        assertFalse(StoreConfig.fromEnvironment(Map.of(StoreConfig.SOFT_LIMIT_ENV, "0")).quotaEnabled());
        assertFalse(StoreConfig.fromEnvironment(Map.of(StoreConfig.SOFT_LIMIT_ENV, "")).quotaEnabled());
    }

    @Test
    void fractionalValuesAreFloored() {
        assertEquals(1024L, StoreConfig.parsePositive(StoreConfig.SOFT_LIMIT_ENV, "1024.9"));
        assertEquals(0L, StoreConfig.parsePositive(StoreConfig.SOFT_LIMIT_ENV, "0.5"));
        assertEquals(0L, StoreConfig.parsePositive(StoreConfig.SOFT_LIMIT_ENV, "NaN"));
        assertEquals(0L, StoreConfig.parsePositive(StoreConfig.SOFT_LIMIT_ENV, null));
    }

    @Test
    void forDirectoryHasNoQuota() {
        StoreConfig config = StoreConfig.forDirectory(tempDir);
        assertFalse(config.quotaEnabled());
        assertEquals(tempDir.toAbsolutePath().normalize(), config.dataDirectory());
    }
}
