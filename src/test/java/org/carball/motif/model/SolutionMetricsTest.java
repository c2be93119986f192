package org.carball.motif.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.motif.persistence.SolutionJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SolutionMetricsTest {

    @Test
    void shouldComputeOverallScoreFromFixedWeights() {
        // When
        SolutionMetrics metrics = new SolutionMetrics(80, 60, 40, 100, 20);

        // Then
        double expected = 0.30 * 80 + 0.25 * 60 + 0.20 * 40 + 0.15 * 100 + 0.10 * 20;
        assertThat(metrics.getOverallScore()).isCloseTo(expected, within(1e-9));
    }

    @Test
    void shouldRecomputeOverallWhenDimensionChanges() {
        // Given
        SolutionMetrics metrics = new SolutionMetrics(50, 50, 50, 50, 50);

        // When
        SolutionMetrics improved = metrics.withQualityScore(100);

        // Then
        assertThat(metrics.getOverallScore()).isCloseTo(50.0, within(1e-9));
        assertThat(improved.getOverallScore()).isCloseTo(65.0, within(1e-9));
        assertThat(improved.getPerformanceScore()).isEqualTo(50.0);
    }

    @Test
    void shouldIgnorePersistedOverallScore() throws Exception {
        // Given
        ObjectMapper mapper = SolutionJson.createMapper();
        String json = """
                {"quality_score": 100, "performance_score": 100, "creativity_score": 100,
                 "usability_score": 100, "compatibility_score": 100, "overall_score": 3}
                """;

        // When
        SolutionMetrics metrics = mapper.readValue(json, SolutionMetrics.class);

        // Then
        assertThat(metrics.getOverallScore()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void shouldWriteOverallScore() throws Exception {
        // When
        String json = SolutionJson.createMapper().writeValueAsString(new SolutionMetrics(50, 50, 50, 50, 50));

        // Then
        assertThat(json).contains("\"overall_score\"").contains("\"quality_score\"");
        assertThat(json).doesNotContain("summary");
    }

    @Test
    void shouldMapScoresToTiers() {
        assertThat(QualityTier.fromScore(85)).isEqualTo(QualityTier.EXCELLENT);
        assertThat(QualityTier.fromScore(84.9)).isEqualTo(QualityTier.GOOD);
        assertThat(QualityTier.fromScore(70)).isEqualTo(QualityTier.GOOD);
        assertThat(QualityTier.fromScore(50)).isEqualTo(QualityTier.AVERAGE);
        assertThat(QualityTier.fromScore(49.99)).isEqualTo(QualityTier.POOR);
    }
}
