package org.carball.motif.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Builder(toBuilder = true)
@Slf4j
public class EngineSettings {

    // Storage
    @Builder.Default
    private String storageDirectory = "solution_storage";

    // Recommendation cache
    @Builder.Default
    private int cacheTtlMinutes = 60;

    @Builder.Default
    private long cacheMaximumSize = 500;

    // Behavior windows
    @Builder.Default
    private int recentActivityDays = 7;

    @Builder.Default
    private int trendingWindowDays = 7;

    // Result sizes
    @Builder.Default
    private int defaultLimit = 10;

    @Builder.Default
    private int similarLimit = 5;

    @Builder.Default
    private boolean autoEvaluate = true;

    /**
     * Creates the built-in settings.
     */
    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    public Path getStoragePath() {
        return Path.of(storageDirectory);
    }

    public Duration getCacheTtl() {
        return Duration.ofMinutes(cacheTtlMinutes);
    }

    /**
     * Logs a warning for each value that will make the engine behave oddly.
     */
    public void validate() {
        if (storageDirectory == null || storageDirectory.isBlank()) {
            log.warn("Storage directory is empty, solutions will be stored in the working directory");
        }

        if (cacheTtlMinutes <= 0) {
            log.warn("Cache TTL ({} min) should be positive, recommendations will not be reused", cacheTtlMinutes);
        }

        if (cacheMaximumSize <= 0) {
            log.warn("Cache maximum size ({}) should be positive", cacheMaximumSize);
        }

        if (recentActivityDays <= 0) {
            log.warn("Recent activity window ({} days) should be positive", recentActivityDays);
        }

        if (trendingWindowDays <= 0) {
            log.warn("Trending window ({} days) should be positive", trendingWindowDays);
        }

        if (defaultLimit <= 0) {
            log.warn("Default limit ({}) should be positive, recommendations will be empty", defaultLimit);
        }

        if (similarLimit <= 0) {
            log.warn("Similar-solution limit ({}) should be positive", similarLimit);
        }
    }

    public String getConfigurationSummary() {
        return String.format(
                "Settings[storage=%s, cacheTtl=%dmin, cacheMax=%d, recentDays=%d, trendingDays=%d, " +
                "limit=%d, similarLimit=%d, autoEvaluate=%s]",
                storageDirectory, cacheTtlMinutes, cacheMaximumSize, recentActivityDays, trendingWindowDays,
                defaultLimit, similarLimit, autoEvaluate);
    }
}
