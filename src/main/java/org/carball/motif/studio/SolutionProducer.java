package org.carball.motif.studio;

import org.carball.motif.model.Solution;

import java.util.Map;

/**
 * Upstream generator of solutions. The engine only checks the structural
 * shape of what it produces, never the correctness of the code.
 */
@FunctionalInterface
public interface SolutionProducer {

    Solution produce(String description, Map<String, String> constraints);
}
