package org.carball.motif.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Setter;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A generated animation artifact: HTML markup, CSS style and JS behavior code
 * plus descriptive metadata, quality metrics and interaction counters.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Solution {

    public static final double MIN_RATING = 0.0;
    public static final double MAX_RATING = 5.0;
    public static final String INITIAL_VERSION = "1.0.0";

    @JsonProperty("solution_id")
    @EqualsAndHashCode.Include
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Builder.Default
    private String name = "Untitled solution";

    @Builder.Default
    private String description = "";

    @Builder.Default
    private SolutionCategory category = SolutionCategory.EFFECT;

    @Builder.Default
    private String htmlCode = "";

    @Builder.Default
    private String cssCode = "";

    @Builder.Default
    private String jsCode = "";

    @Builder.Default
    private TechStack techStack = TechStack.CSS_ANIMATION;

    @Builder.Default
    private SolutionMetrics metrics = SolutionMetrics.empty();

    @Builder.Default
    private QualityTier qualityTier = QualityTier.AVERAGE;

    // counters change only through the rating, usage and favorite operations
    @Setter(AccessLevel.NONE)
    private double userRating;

    @Setter(AccessLevel.NONE)
    private int ratingCount;

    @Setter(AccessLevel.NONE)
    private int favoriteCount;

    @Setter(AccessLevel.NONE)
    private int usageCount;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @Builder.Default
    private LocalDateTime updatedAt = LocalDateTime.now();

    @Builder.Default
    private String author = "AI generated";

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private String version = INITIAL_VERSION;

    private String parentSolutionId;

    @Builder.Default
    private Set<String> childSolutionIds = new LinkedHashSet<>();

    private String thumbnailPath;
    private String previewGifPath;

    public String getHtmlCode() {
        return htmlCode == null ? "" : htmlCode;
    }

    public String getCssCode() {
        return cssCode == null ? "" : cssCode;
    }

    public String getJsCode() {
        return jsCode == null ? "" : jsCode;
    }

    public Set<String> getTags() {
        if (tags == null) {
            tags = new LinkedHashSet<>();
        }
        return tags;
    }

    public Set<String> getChildSolutionIds() {
        if (childSolutionIds == null) {
            childSolutionIds = new LinkedHashSet<>();
        }
        return childSolutionIds;
    }

    public void addUserRating(double rating) {
        addUserRating(rating, LocalDateTime.now());
    }

    /**
     * Folds one rating into the running mean. Ratings outside [0,5] are
     * rejected and leave the aggregate untouched.
     */
    public void addUserRating(double rating, LocalDateTime at) {
        if (Double.isNaN(rating) || rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException(
                    String.format("Rating must be between %.0f and %.0f, got %s", MIN_RATING, MAX_RATING, rating));
        }
        double total = userRating * ratingCount;
        ratingCount++;
        userRating = (total + rating) / ratingCount;
        updatedAt = at;
    }

    public void incrementUsage(LocalDateTime at) {
        usageCount++;
        updatedAt = at;
    }

    public void incrementFavorites(LocalDateTime at) {
        favoriteCount++;
        updatedAt = at;
    }

    public void decrementFavorites(LocalDateTime at) {
        favoriteCount = Math.max(0, favoriteCount - 1);
        updatedAt = at;
    }

    public void applyMetrics(SolutionMetrics newMetrics) {
        this.metrics = newMetrics;
        this.qualityTier = QualityTier.fromScore(newMetrics.getOverallScore());
    }

    public void addTag(String tag) {
        getTags().add(tag);
    }

    @JsonIgnore
    public boolean isRated() {
        return ratingCount > 0;
    }

    @JsonIgnore
    public double getOverallScore() {
        return metrics == null ? 0.0 : metrics.getOverallScore();
    }

    @JsonIgnore
    public int getTotalCodeLength() {
        return getHtmlCode().length() + getCssCode().length() + getJsCode().length();
    }

    /**
     * Deep copy under a new identity with fresh timestamps.
     */
    public Solution branch(LocalDateTime at) {
        return copyWithId(UUID.randomUUID().toString(), at, at);
    }

    /**
     * Deep copy keeping identity and timestamps.
     */
    public Solution duplicate() {
        return copyWithId(id, createdAt, updatedAt);
    }

    private Solution copyWithId(String newId, LocalDateTime created, LocalDateTime updated) {
        return toBuilder()
                .id(newId)
                .createdAt(created)
                .updatedAt(updated)
                .tags(new LinkedHashSet<>(getTags()))
                .childSolutionIds(new LinkedHashSet<>(getChildSolutionIds()))
                .build();
    }
}
