package org.carball.motif.evaluation;

/**
 * Outcome of a single code heuristic: either a score in [0,100] or the reason
 * the analysis could not be completed.
 */
public record HeuristicResult(double score, String failureReason) {

    public static HeuristicResult ok(double score) {
        return new HeuristicResult(Math.min(100.0, Math.max(0.0, score)), null);
    }

    public static HeuristicResult failed(String reason) {
        return new HeuristicResult(0.0, reason);
    }

    public boolean isOk() {
        return failureReason == null;
    }
}
