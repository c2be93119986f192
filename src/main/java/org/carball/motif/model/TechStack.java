package org.carball.motif.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TechStack {
    CSS_ANIMATION("css_animation", 0.3, "pure CSS, simple to adopt"),
    JAVASCRIPT("javascript", 0.5, "JavaScript enhanced, feature rich"),
    GSAP("gsap", 0.7, "GSAP timeline, professional motion"),
    THREE_JS("three_js", 0.9, "three.js 3D scene, striking visuals"),
    SVG_ANIMATION("svg_animation", 0.6, "vector animation, scales losslessly");

    private final String value;
    private final double complexity;
    private final String blurb;

    TechStack(String value, double complexity, String blurb) {
        this.value = value;
        this.complexity = complexity;
        this.blurb = blurb;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Relative implementation complexity in [0,1], used to infer how much
     * complexity a user is comfortable with.
     */
    public double getComplexity() {
        return complexity;
    }

    public String getBlurb() {
        return blurb;
    }

    @JsonCreator
    public static TechStack fromValue(String value) {
        for (TechStack stack : values()) {
            if (stack.value.equalsIgnoreCase(value) || stack.name().equalsIgnoreCase(value)) {
                return stack;
            }
        }
        throw new IllegalArgumentException("Unknown tech stack: " + value);
    }
}
