package org.carball.motif.evaluation;

public record WeightedHeuristic(String name, double weight, Heuristic heuristic) {
}
