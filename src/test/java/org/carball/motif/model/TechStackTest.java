package org.carball.motif.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TechStackTest {

    @Test
    void shouldResolveLowercaseValuesAndConstantNames() {
        assertThat(TechStack.fromValue("three_js")).isEqualTo(TechStack.THREE_JS);
        assertThat(TechStack.fromValue("GSAP")).isEqualTo(TechStack.GSAP);
        assertThat(SolutionCategory.fromValue("entrance")).isEqualTo(SolutionCategory.ENTRANCE);
    }

    @Test
    void shouldRejectUnknownValue() {
        assertThatThrownBy(() -> TechStack.fromValue("flash"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOrderComplexityFromCssToThreeJs() {
        assertThat(TechStack.CSS_ANIMATION.getComplexity()).isEqualTo(0.3);
        assertThat(TechStack.THREE_JS.getComplexity()).isEqualTo(0.9);
        assertThat(TechStack.SVG_ANIMATION.getComplexity()).isEqualTo(0.6);
    }
}
