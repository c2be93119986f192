package org.carball.motif.preference;

import lombok.Builder;
import lombok.Value;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.util.Map;

/**
 * Snapshot of what a user tends to favor. Weights are normalized per group;
 * keys without any recorded interaction weigh 0.
 */
@Value
@Builder
public class PreferenceVector {

    public static final double DEFAULT_QUALITY_THRESHOLD = 0.6;
    public static final double APPLIED_QUALITY_THRESHOLD = 0.7;
    public static final double HIGH_NOVELTY_APPETITE = 0.8;
    public static final double LOW_NOVELTY_APPETITE = 0.4;

    Map<SolutionCategory, Double> categoryWeights;
    Map<TechStack, Double> techStackWeights;
    double qualityThreshold;
    double complexityAppetite;
    double noveltyAppetite;

    public double categoryWeight(SolutionCategory category) {
        return categoryWeights.getOrDefault(category, 0.0);
    }

    public double techStackWeight(TechStack techStack) {
        return techStackWeights.getOrDefault(techStack, 0.0);
    }
}
