package org.carball.motif.evaluation;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.motif.model.Solution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scores one quality dimension as the weighted sum of its heuristics, clamped
 * to [0,100]. A heuristic that fails contributes 0 and is logged.
 */
@Slf4j
public class DimensionScorer {

    @Getter
    private final QualityDimension dimension;
    private final List<WeightedHeuristic> heuristics = new ArrayList<>();

    public DimensionScorer(QualityDimension dimension) {
        this.dimension = dimension;
    }

    public DimensionScorer with(String name, double weight, Heuristic heuristic) {
        heuristics.add(new WeightedHeuristic(name, weight, heuristic));
        return this;
    }

    public List<WeightedHeuristic> getHeuristics() {
        return Collections.unmodifiableList(heuristics);
    }

    public double score(Solution solution) {
        double score = 0.0;

        for (WeightedHeuristic weighted : heuristics) {
            HeuristicResult result = run(weighted, solution);
            if (result.isOk()) {
                score += result.score() * weighted.weight();
            } else {
                log.warn("{} heuristic '{}' failed for solution {}: {}",
                        dimension, weighted.name(), solution.getId(), result.failureReason());
            }
        }

        return Math.min(100.0, Math.max(0.0, score));
    }

    private HeuristicResult run(WeightedHeuristic weighted, Solution solution) {
        try {
            return weighted.heuristic().analyze(solution);
        } catch (RuntimeException e) {
            return HeuristicResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
