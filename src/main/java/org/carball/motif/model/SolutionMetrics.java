package org.carball.motif.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Five dimension scores in [0,100] plus the weighted overall score.
 * <p>
 * The overall score is always derived from the dimensions; it is computed on
 * construction and ignored when present in persisted records.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(value = "overall_score", allowGetters = true)
public final class SolutionMetrics {

    public static final double QUALITY_WEIGHT = 0.30;
    public static final double PERFORMANCE_WEIGHT = 0.25;
    public static final double CREATIVITY_WEIGHT = 0.20;
    public static final double USABILITY_WEIGHT = 0.15;
    public static final double COMPATIBILITY_WEIGHT = 0.10;

    private static final SolutionMetrics EMPTY = new SolutionMetrics(0, 0, 0, 0, 0);

    @JsonProperty("quality_score")
    private final double qualityScore;

    @JsonProperty("performance_score")
    private final double performanceScore;

    @JsonProperty("creativity_score")
    private final double creativityScore;

    @JsonProperty("usability_score")
    private final double usabilityScore;

    @JsonProperty("compatibility_score")
    private final double compatibilityScore;

    @JsonProperty("overall_score")
    private final double overallScore;

    @JsonCreator
    public SolutionMetrics(@JsonProperty("quality_score") double qualityScore,
                           @JsonProperty("performance_score") double performanceScore,
                           @JsonProperty("creativity_score") double creativityScore,
                           @JsonProperty("usability_score") double usabilityScore,
                           @JsonProperty("compatibility_score") double compatibilityScore) {
        this.qualityScore = qualityScore;
        this.performanceScore = performanceScore;
        this.creativityScore = creativityScore;
        this.usabilityScore = usabilityScore;
        this.compatibilityScore = compatibilityScore;
        this.overallScore = calculateOverallScore(
                qualityScore, performanceScore, creativityScore, usabilityScore, compatibilityScore);
    }

    public static SolutionMetrics empty() {
        return EMPTY;
    }

    public static double calculateOverallScore(double quality, double performance, double creativity,
                                               double usability, double compatibility) {
        return quality * QUALITY_WEIGHT
                + performance * PERFORMANCE_WEIGHT
                + creativity * CREATIVITY_WEIGHT
                + usability * USABILITY_WEIGHT
                + compatibility * COMPATIBILITY_WEIGHT;
    }

    public SolutionMetrics withQualityScore(double score) {
        return new SolutionMetrics(score, performanceScore, creativityScore, usabilityScore, compatibilityScore);
    }

    public SolutionMetrics withPerformanceScore(double score) {
        return new SolutionMetrics(qualityScore, score, creativityScore, usabilityScore, compatibilityScore);
    }

    public SolutionMetrics withCreativityScore(double score) {
        return new SolutionMetrics(qualityScore, performanceScore, score, usabilityScore, compatibilityScore);
    }

    public SolutionMetrics withUsabilityScore(double score) {
        return new SolutionMetrics(qualityScore, performanceScore, creativityScore, score, compatibilityScore);
    }

    public SolutionMetrics withCompatibilityScore(double score) {
        return new SolutionMetrics(qualityScore, performanceScore, creativityScore, usabilityScore, score);
    }

    @JsonIgnore
    public String getSummary() {
        return String.format("overall=%.1f (quality=%.1f, performance=%.1f, creativity=%.1f, usability=%.1f, compatibility=%.1f)",
                overallScore, qualityScore, performanceScore, creativityScore, usabilityScore, compatibilityScore);
    }
}
