package org.carball.motif.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum QualityTier {
    EXCELLENT("excellent", 85),
    GOOD("good", 70),
    AVERAGE("average", 50),
    POOR("poor", 0);

    private final String value;
    private final double minScore;

    QualityTier(String value, double minScore) {
        this.value = value;
        this.minScore = minScore;
    }

    public static QualityTier fromScore(double overallScore) {
        if (overallScore >= EXCELLENT.minScore) {
            return EXCELLENT;
        } else if (overallScore >= GOOD.minScore) {
            return GOOD;
        } else if (overallScore >= AVERAGE.minScore) {
            return AVERAGE;
        } else {
            return POOR;
        }
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getMinScore() {
        return minScore;
    }

    @JsonCreator
    public static QualityTier fromValue(String value) {
        for (QualityTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value) || tier.name().equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown quality tier: " + value);
    }
}
