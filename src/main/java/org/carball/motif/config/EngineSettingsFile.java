package org.carball.motif.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * YAML form of {@link EngineSettings}. Keys left out of the file stay null
 * and do not override anything.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineSettingsFile {

    @JsonProperty("storage_directory")
    private String storageDirectory;

    @JsonProperty("cache_ttl_minutes")
    private Integer cacheTtlMinutes;

    @JsonProperty("cache_maximum_size")
    private Long cacheMaximumSize;

    @JsonProperty("recent_activity_days")
    private Integer recentActivityDays;

    @JsonProperty("trending_window_days")
    private Integer trendingWindowDays;

    @JsonProperty("default_limit")
    private Integer defaultLimit;

    @JsonProperty("similar_limit")
    private Integer similarLimit;

    @JsonProperty("auto_evaluate")
    private Boolean autoEvaluate;

    void applyTo(EngineSettings.EngineSettingsBuilder builder) {
        if (storageDirectory != null) {
            builder.storageDirectory(storageDirectory);
        }
        if (cacheTtlMinutes != null) {
            builder.cacheTtlMinutes(cacheTtlMinutes);
        }
        if (cacheMaximumSize != null) {
            builder.cacheMaximumSize(cacheMaximumSize);
        }
        if (recentActivityDays != null) {
            builder.recentActivityDays(recentActivityDays);
        }
        if (trendingWindowDays != null) {
            builder.trendingWindowDays(trendingWindowDays);
        }
        if (defaultLimit != null) {
            builder.defaultLimit(defaultLimit);
        }
        if (similarLimit != null) {
            builder.similarLimit(similarLimit);
        }
        if (autoEvaluate != null) {
            builder.autoEvaluate(autoEvaluate);
        }
    }
}
