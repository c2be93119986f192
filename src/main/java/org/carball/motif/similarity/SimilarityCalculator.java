package org.carball.motif.similarity;

import org.carball.motif.model.Solution;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Symmetric similarity in [0,1] between two solutions, built from category,
 * tech stack, overall score, CSS style tokens and animation duration.
 */
public class SimilarityCalculator {

    static final double CATEGORY_WEIGHT = 0.30;
    static final double TECH_STACK_WEIGHT = 0.25;
    static final double SCORE_WEIGHT = 0.20;
    static final double STYLE_WEIGHT = 0.15;
    static final double DURATION_WEIGHT = 0.10;

    private static final double PARTIAL_TECH_STACK_CREDIT = 0.3;
    private static final double NEUTRAL_DURATION_SIMILARITY = 0.5;

    private static final List<String> ANIMATION_PROPERTIES =
            List.of("transform", "opacity", "scale", "rotate", "translate");
    private static final List<String> VISUAL_EFFECTS =
            List.of("shadow", "gradient", "blur", "brightness");

    private static final List<Pattern> DURATION_PATTERNS = List.of(
            Pattern.compile("animation-duration\\s*:\\s*(\\d+(?:\\.\\d+)?)(ms|s)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("transition-duration\\s*:\\s*(\\d+(?:\\.\\d+)?)(ms|s)\\b", Pattern.CASE_INSENSITIVE));

    public double similarity(Solution a, Solution b) {
        double category = a.getCategory() == b.getCategory() ? 1.0 : 0.0;
        double techStack = a.getTechStack() == b.getTechStack() ? 1.0 : PARTIAL_TECH_STACK_CREDIT;
        double score = 1.0 - Math.abs(a.getOverallScore() - b.getOverallScore()) / 100.0;
        double style = styleSimilarity(a.getCssCode(), b.getCssCode());
        double duration = durationSimilarity(a.getCssCode(), b.getCssCode());

        double total = category * CATEGORY_WEIGHT
                + techStack * TECH_STACK_WEIGHT
                + score * SCORE_WEIGHT
                + style * STYLE_WEIGHT
                + duration * DURATION_WEIGHT;
        return Math.max(0.0, Math.min(1.0, total));
    }

    /**
     * Jaccard overlap of the two style token sets; 0 when both are empty.
     */
    double styleSimilarity(String cssA, String cssB) {
        Set<String> featuresA = styleFeatures(cssA);
        Set<String> featuresB = styleFeatures(cssB);

        Set<String> union = new HashSet<>(featuresA);
        union.addAll(featuresB);
        if (union.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(featuresA);
        intersection.retainAll(featuresB);
        return (double) intersection.size() / union.size();
    }

    double durationSimilarity(String cssA, String cssB) {
        OptionalDouble durationA = animationDuration(cssA);
        OptionalDouble durationB = animationDuration(cssB);
        if (durationA.isEmpty() || durationB.isEmpty()) {
            return NEUTRAL_DURATION_SIMILARITY;
        }

        double max = Math.max(durationA.getAsDouble(), durationB.getAsDouble());
        if (max == 0.0) {
            return 1.0;
        }
        double difference = Math.abs(durationA.getAsDouble() - durationB.getAsDouble());
        return Math.max(0.0, 1.0 - difference / max);
    }

    public static Set<String> styleFeatures(String css) {
        Set<String> features = new TreeSet<>();
        if (css == null || css.isBlank()) {
            return features;
        }

        String lower = css.toLowerCase(Locale.ROOT);
        for (String property : ANIMATION_PROPERTIES) {
            if (lower.contains(property)) {
                features.add("uses_" + property);
            }
        }
        for (String effect : VISUAL_EFFECTS) {
            if (lower.contains(effect)) {
                features.add("has_" + effect);
            }
        }

        // ease-in-out contains ease-in, so it is tested first
        if (lower.contains("ease-in-out")) {
            features.add("easing_ease_in_out");
        } else if (lower.contains("ease-in")) {
            features.add("easing_ease_in");
        } else if (lower.contains("ease-out")) {
            features.add("easing_ease_out");
        }
        return features;
    }

    /**
     * First {@code animation-duration}, else first {@code transition-duration},
     * in seconds.
     */
    public static OptionalDouble animationDuration(String css) {
        if (css == null || css.isBlank()) {
            return OptionalDouble.empty();
        }
        for (Pattern pattern : DURATION_PATTERNS) {
            Matcher matcher = pattern.matcher(css);
            if (matcher.find()) {
                double value = Double.parseDouble(matcher.group(1));
                return OptionalDouble.of("ms".equalsIgnoreCase(matcher.group(2)) ? value / 1000.0 : value);
            }
        }
        return OptionalDouble.empty();
    }
}
