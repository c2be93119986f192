package org.carball.motif.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.motif.MutableClock;
import org.carball.motif.TestSolutions;
import org.carball.motif.evaluation.SolutionEvaluator;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;
import org.carball.motif.persistence.InMemorySolutionStore;
import org.carball.motif.recommendation.RecommendationResult;
import org.carball.motif.repository.SolutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionReportTest {

    private SolutionRepository repository;
    private Solution glow;
    private RecommendationResult recommendation;

    @BeforeEach
    void setUp() {
        repository = new SolutionRepository(new InMemorySolutionStore(), new SolutionEvaluator(),
                MutableClock.at(TestSolutions.NOW));
        glow = TestSolutions.scored("Glow | Pulse", 80, SolutionCategory.EFFECT, TechStack.SVG_ANIMATION);
        repository.add(glow, false);
        repository.add(TestSolutions.scored("Drop", 40), false);
        repository.addToFavorites(glow.getId());
        recommendation = new RecommendationResult(glow.getId(), glow.getName(), 0.72,
                0.85, 0.4, 0.15, 1.0, 0.5, "high-quality solution, fresh idea");
    }

    @Test
    void shouldRenderJsonWithSnakeCaseKeys() throws Exception {
        // Given
        SolutionReport report = new SolutionReport("Motif Report", repository.statistics(),
                List.of(glow), List.of(recommendation), TestSolutions.NOW);

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.get("title").asText()).isEqualTo("Motif Report");
        assertThat(json.get("generated_at").asText()).isEqualTo("2024-03-01T12:00");
        JsonNode statistics = json.get("statistics");
        assertThat(statistics.get("total_solutions").asInt()).isEqualTo(2);
        assertThat(statistics.get("total_favorites").asInt()).isEqualTo(1);
        assertThat(statistics.get("top_solution_id").asText()).isEqualTo(glow.getId());
        assertThat(statistics.get("category_distribution").get("effect").asInt()).isEqualTo(1);
        assertThat(statistics.get("tech_stack_distribution").get("svg_animation").asInt()).isEqualTo(1);
        assertThat(json.get("solutions").get(0).get("quality_tier").asText()).isEqualTo("good");
        assertThat(json.get("recommendations").get(0).get("total_score").asDouble()).isEqualTo(0.72);
        assertThat(json.get("recommendations").get(0).get("solution_id").asText()).isEqualTo(glow.getId());
    }

    @Test
    void shouldRenderMarkdownSections() {
        // Given
        SolutionReport report = new SolutionReport("Motif Report", repository.statistics(),
                List.of(glow), List.of(recommendation), TestSolutions.NOW);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown)
                .startsWith("# Motif Report\n\n")
                .contains("**Generated:** 2024-03-01T12:00:00")
                .contains("## Repository Overview")
                .contains("| Solutions | 2 |")
                .contains("| Favorites | 1 |")
                .contains("- effect: 1")
                .contains("## Solutions")
                .contains("| 1 | Glow \\| Pulse | effect | svg_animation |")
                .contains("## Recommendations")
                .contains("### 1. Glow \\| Pulse")
                .contains("- **Why:** high-quality solution, fresh idea")
                .doesNotContain("No solutions matched");
    }

    @Test
    void shouldSayWhenNothingMatched() {
        // Given
        SolutionReport report = new SolutionReport("Search: spin", null, List.of(), null, TestSolutions.NOW);

        // Then
        assertThat(report.toMarkdown()).contains("**No solutions matched.**");
        assertThat(report.toJson()).contains("\"solutions\" : [ ]");
    }
}
