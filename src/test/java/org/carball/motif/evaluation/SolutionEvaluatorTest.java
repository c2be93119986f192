package org.carball.motif.evaluation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.motif.TestSolutions;
import org.carball.motif.model.QualityTier;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionMetrics;
import org.carball.motif.model.TechStack;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SolutionEvaluatorTest {

    private SolutionEvaluator evaluator;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        evaluator = new SolutionEvaluator();

        logger = (Logger) LoggerFactory.getLogger(DimensionScorer.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldScoreMarkupOnlySolutionDeterministically() {
        // Given
        Solution solution = Solution.builder()
                .htmlCode("<div class=\"box\" id=\"hero\">Hello</div>")
                .techStack(TechStack.CSS_ANIMATION)
                .build();

        // When
        SolutionMetrics first = evaluator.evaluate(solution);
        SolutionMetrics second = evaluator.evaluate(solution);

        // Then
        assertThat(first.getQualityScore()).isCloseTo(57.5, within(1e-9));
        assertThat(first.getPerformanceScore()).isCloseTo(77.5, within(1e-9));
        assertThat(first.getCreativityScore()).isCloseTo(51.5, within(1e-9));
        assertThat(first.getUsabilityScore()).isCloseTo(80.0, within(1e-9));
        assertThat(first.getCompatibilityScore()).isCloseTo(80.0, within(1e-9));
        assertThat(first.getOverallScore()).isCloseTo(66.925, within(1e-9));
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldKeepEveryDimensionWithinBounds() {
        // Given
        Solution solution = TestSolutions.solution("Busy")
                .cssCode(TestSolutions.FADE_CSS + " .x { -webkit-transform: scale(2); -moz-transform: none;"
                        + " -ms-filter: blur(2px); -o-transition: all; clip-path: circle(); mask: none;"
                        + " backdrop-filter: blur(1px); display: grid; display: flex; width: calc(100%);"
                        + " will-change: transform; box-shadow: 0 0 1px; background: linear-gradient(red, blue);"
                        + " border-radius: 4px; color: red; }")
                .jsCode("// start\nconst el = document.querySelector('.x'); requestAnimationFrame(() => {});")
                .techStack(TechStack.THREE_JS)
                .build();

        // When
        SolutionMetrics metrics = evaluator.evaluate(solution);

        // Then
        for (double score : new double[]{metrics.getQualityScore(), metrics.getPerformanceScore(),
                metrics.getCreativityScore(), metrics.getUsabilityScore(), metrics.getCompatibilityScore()}) {
            assertThat(score).isBetween(0.0, 100.0);
        }
    }

    @Test
    void shouldUseWeightsSummingToOnePerDimension() {
        for (DimensionScorer scorer : evaluator.getScorers().values()) {
            double total = scorer.getHeuristics().stream().mapToDouble(WeightedHeuristic::weight).sum();
            assertThat(total).as(scorer.getDimension().name()).isCloseTo(1.0, within(1e-9));
            assertThat(scorer.getHeuristics()).hasSize(3);
        }
    }

    @Test
    void shouldScoreFailedHeuristicAsZeroAndLogWarning() {
        // Given - unbalanced braces fail the code structure heuristic
        Solution solution = TestSolutions.solution("Broken")
                .cssCode(".box { opacity: 0;")
                .build();

        // When
        double quality = evaluator.scoreDimension(QualityDimension.QUALITY, solution);

        // Then
        double smoothness = CodeHeuristics.animationSmoothness(solution).score();
        double appeal = CodeHeuristics.visualAppeal(solution).score();
        assertThat(quality).isCloseTo(smoothness * 0.3 + appeal * 0.4, within(1e-9));
        assertThat(logAppender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage())
                            .contains("code_structure")
                            .contains("unbalanced braces");
                });
    }

    @Test
    void shouldContinueWhenHeuristicThrows() {
        // Given
        DimensionScorer scorer = new DimensionScorer(QualityDimension.CREATIVITY)
                .with("explodes", 0.5, s -> {
                    throw new IllegalStateException("boom");
                })
                .with("steady", 0.5, s -> HeuristicResult.ok(80));

        // When
        double score = scorer.score(TestSolutions.solution("Any").build());

        // Then
        assertThat(score).isCloseTo(40.0, within(1e-9));
        assertThat(logAppender.list)
                .anySatisfy(event -> assertThat(event.getFormattedMessage())
                        .contains("explodes")
                        .contains("IllegalStateException: boom"));
    }

    @Test
    void shouldApplyMetricsAndTierToSolution() {
        // Given
        Solution solution = TestSolutions.solution("Fade In").build();

        // When
        SolutionMetrics metrics = evaluator.evaluateAndApply(solution);

        // Then
        assertThat(solution.getMetrics()).isEqualTo(metrics);
        assertThat(solution.getQualityTier()).isEqualTo(QualityTier.fromScore(metrics.getOverallScore()));
    }
}
