package org.carball.motif.recommendation;

/**
 * Scored candidate. Sub-scores are in [0,1]; the explanation is display text
 * only and plays no part in ranking.
 */
public record RecommendationResult(
        String solutionId,
        String solutionName,
        double totalScore,
        double qualityScore,
        double preferenceScore,
        double popularityScore,
        double noveltyScore,
        double contextScore,
        String explanation
) {
}
