package org.carball.motif.evaluation;

public enum QualityDimension {
    QUALITY,
    PERFORMANCE,
    CREATIVITY,
    USABILITY,
    COMPATIBILITY
}
