package org.carball.motif.evaluation;

import org.carball.motif.model.Solution;

@FunctionalInterface
public interface Heuristic {

    HeuristicResult analyze(Solution solution);
}
