package org.carball.motif.recommendation;

import org.carball.motif.model.Solution;

public record SimilarSolution(Solution solution, double similarity) {
}
