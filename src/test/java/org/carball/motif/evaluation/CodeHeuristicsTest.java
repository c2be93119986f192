package org.carball.motif.evaluation;

import org.carball.motif.TestSolutions;
import org.carball.motif.model.Solution;
import org.carball.motif.model.TechStack;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CodeHeuristicsTest {

    @Test
    void shouldRewardKeyframesAndTransitions() {
        // Given
        Solution solution = TestSolutions.solution("Fade").build();

        // When
        HeuristicResult result = CodeHeuristics.codeStructure(solution);

        // Then - base 50, div+class 10, id 5, keyframes 15, braces 5
        assertThat(result.isOk()).isTrue();
        assertThat(result.score()).isEqualTo(85.0);
    }

    @Test
    void shouldFailOnMalformedCubicBezier() {
        // Given
        Solution solution = TestSolutions.solution("Bouncy")
                .cssCode(".a { transition: transform 1s cubic-bezier(0.1, 0.7, 1.0); }")
                .build();

        // When
        HeuristicResult result = CodeHeuristics.animationSmoothness(solution);

        // Then
        assertThat(result.isOk()).isFalse();
        assertThat(result.failureReason()).contains("cubic-bezier");
    }

    @Test
    void shouldAcceptWellFormedCubicBezier() {
        // Given
        Solution solution = TestSolutions.solution("Bouncy")
                .cssCode(".a { transition: transform 1s cubic-bezier(0.1, 0.7, 1.0, 0.1); }")
                .build();

        // When
        HeuristicResult result = CodeHeuristics.animationSmoothness(solution);

        // Then - base 60, easing 8, transform 15
        assertThat(result.score()).isEqualTo(83.0);
    }

    @Test
    void shouldBandTotalCodeLength() {
        assertThat(CodeHeuristics.lengthBand(withLength(100)).score()).isEqualTo(80.0);
        assertThat(CodeHeuristics.lengthBand(withLength(500)).score()).isEqualTo(100.0);
        assertThat(CodeHeuristics.lengthBand(withLength(2500)).score()).isEqualTo(70.0);
        assertThat(CodeHeuristics.lengthBand(withLength(4000)).score()).isEqualTo(50.0);
    }

    @Test
    void shouldPreferSimplerStacks() {
        Solution css = Solution.builder().techStack(TechStack.CSS_ANIMATION).build();
        Solution three = Solution.builder().techStack(TechStack.THREE_JS).build();

        assertThat(CodeHeuristics.stackSimplicity(css).score()).isCloseTo(100.0, within(1e-9));
        assertThat(CodeHeuristics.stackSimplicity(three).score()).isCloseTo(55.0, within(1e-9));
    }

    @Test
    void shouldPenalizeLegacyScriptApis() {
        Solution modern = Solution.builder().jsCode("const el = document.querySelector('#a');").build();
        Solution legacy = Solution.builder().jsCode("document.write('<p>');").build();
        Solution none = Solution.builder().build();

        assertThat(CodeHeuristics.scriptApis(modern).score()).isEqualTo(90.0);
        assertThat(CodeHeuristics.scriptApis(legacy).score()).isEqualTo(70.0);
        assertThat(CodeHeuristics.scriptApis(none).score()).isEqualTo(90.0);
    }

    @Test
    void shouldClampHeuristicResults() {
        assertThat(HeuristicResult.ok(140).score()).isEqualTo(100.0);
        assertThat(HeuristicResult.ok(-3).score()).isEqualTo(0.0);
    }

    private static Solution withLength(int length) {
        return Solution.builder().htmlCode("x".repeat(length)).build();
    }
}
