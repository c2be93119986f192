package org.carball.motif.evaluation;

import lombok.extern.slf4j.Slf4j;
import org.carball.motif.model.QualityTier;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionMetrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scores a solution's code along five quality dimensions. Evaluation has no
 * side effects on the solution and never throws for malformed code.
 */
@Slf4j
public class SolutionEvaluator {

    private final Map<QualityDimension, DimensionScorer> scorers = new EnumMap<>(QualityDimension.class);

    public SolutionEvaluator() {
        register(new DimensionScorer(QualityDimension.QUALITY)
                .with("code_structure", 0.3, CodeHeuristics::codeStructure)
                .with("animation_smoothness", 0.3, CodeHeuristics::animationSmoothness)
                .with("visual_appeal", 0.4, CodeHeuristics::visualAppeal));

        register(new DimensionScorer(QualityDimension.PERFORMANCE)
                .with("code_efficiency", 0.4, CodeHeuristics::codeEfficiency)
                .with("resource_usage", 0.3, CodeHeuristics::resourceUsage)
                .with("browser_support", 0.3, CodeHeuristics::browserSupport));

        register(new DimensionScorer(QualityDimension.CREATIVITY)
                .with("uniqueness", 0.5, CodeHeuristics::uniqueness)
                .with("innovation", 0.3, CodeHeuristics::innovation)
                .with("artistic_value", 0.2, CodeHeuristics::artisticValue));

        register(new DimensionScorer(QualityDimension.USABILITY)
                .with("readability", 0.3, CodeHeuristics::readability)
                .with("length_band", 0.4, CodeHeuristics::lengthBand)
                .with("stack_simplicity", 0.3, CodeHeuristics::stackSimplicity));

        register(new DimensionScorer(QualityDimension.COMPATIBILITY)
                .with("modern_features", 0.4, CodeHeuristics::modernFeatures)
                .with("vendor_prefixes", 0.3, CodeHeuristics::vendorPrefixes)
                .with("script_apis", 0.3, CodeHeuristics::scriptApis));
    }

    private void register(DimensionScorer scorer) {
        scorers.put(scorer.getDimension(), scorer);
    }

    public Map<QualityDimension, DimensionScorer> getScorers() {
        return Collections.unmodifiableMap(scorers);
    }

    public SolutionMetrics evaluate(Solution solution) {
        SolutionMetrics metrics = new SolutionMetrics(
                scoreDimension(QualityDimension.QUALITY, solution),
                scoreDimension(QualityDimension.PERFORMANCE, solution),
                scoreDimension(QualityDimension.CREATIVITY, solution),
                scoreDimension(QualityDimension.USABILITY, solution),
                scoreDimension(QualityDimension.COMPATIBILITY, solution));

        log.debug("Evaluated solution {}: {}", solution.getId(), metrics.getSummary());
        return metrics;
    }

    /**
     * Evaluates the solution and stores the metrics and derived quality tier on it.
     */
    public SolutionMetrics evaluateAndApply(Solution solution) {
        SolutionMetrics metrics = evaluate(solution);
        solution.applyMetrics(metrics);
        return metrics;
    }

    public QualityTier determineQualityTier(double overallScore) {
        return QualityTier.fromScore(overallScore);
    }

    public double scoreDimension(QualityDimension dimension, Solution solution) {
        return scorers.get(dimension).score(solution);
    }
}
