package org.carball.motif.evaluation;

import org.carball.motif.model.Solution;
import org.carball.motif.model.TechStack;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural signals read from a solution's HTML, CSS and JS. Every method
 * starts from a base score and adds or subtracts fixed bonuses for tokens it
 * finds, so the same code always produces the same value.
 */
public final class CodeHeuristics {

    private static final List<String> EASING_FUNCTIONS =
            List.of("ease", "ease-in", "ease-out", "ease-in-out", "cubic-bezier");
    private static final List<String> COLOR_KEYWORDS = List.of("color", "background", "gradient", "shadow");
    private static final List<String> VISUAL_EFFECTS = List.of("shadow", "gradient", "opacity", "blur", "scale");
    private static final List<String> GPU_FRIENDLY_PROPERTIES = List.of("transform", "opacity", "filter");
    private static final List<String> ADVANCED_FEATURES = List.of("clip-path", "mask", "filter", "backdrop-filter");
    private static final List<String> ARTISTIC_ELEMENTS = List.of("gradient", "shadow", "border-radius", "opacity");
    private static final List<String> LAYOUT_FEATURES = List.of("grid", "flex", "calc(");
    private static final List<String> MODERN_FEATURES = List.of("grid", "flex", "transform", "transition", "animation");
    private static final List<String> VENDOR_PREFIXES = List.of("-webkit-", "-moz-", "-ms-", "-o-");

    private static final Pattern LAYOUT_THRASHING_PATTERN =
            Pattern.compile("(?<![\\w-])(left|top|width|height)\\s*:");
    private static final Pattern CUBIC_BEZIER_PATTERN =
            Pattern.compile("cubic-bezier\\s*\\(([^)]*)\\)");
    private static final Pattern EXTERNAL_RESOURCE_PATTERN =
            Pattern.compile("(?:src|href)\\s*=\\s*[\"']?https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern MODERN_DECLARATION_PATTERN =
            Pattern.compile("\\b(const|let)\\s+\\w+");
    private static final Pattern LEGACY_API_PATTERN =
            Pattern.compile("document\\.all|attachEvent\\s*\\(|document\\.write\\s*\\(");

    private CodeHeuristics() {
    }

    // Quality

    public static HeuristicResult codeStructure(Solution solution) {
        String html = solution.getHtmlCode();
        String css = solution.getCssCode();
        double score = 50.0;

        if (!html.isEmpty()) {
            if (html.contains("<div") && html.contains("class=")) {
                score += 10;
            }
            if (html.contains("id=")) {
                score += 5;
            }
        }

        if (!css.isEmpty()) {
            int depth = braceDepth(css);
            if (depth != 0) {
                return HeuristicResult.failed("unbalanced braces in style code (depth " + depth + ")");
            }
            if (css.contains("@keyframes")) {
                score += 15;
            }
            if (css.contains("transition")) {
                score += 10;
            }
            if (css.contains("{")) {
                score += 5;
            }
        }

        return HeuristicResult.ok(score);
    }

    public static HeuristicResult animationSmoothness(Solution solution) {
        String css = lower(solution.getCssCode());
        double score = 60.0;

        Matcher bezier = CUBIC_BEZIER_PATTERN.matcher(css);
        while (bezier.find()) {
            if (!isValidBezier(bezier.group(1))) {
                return HeuristicResult.failed("malformed cubic-bezier(" + bezier.group(1).trim() + ")");
            }
        }

        for (String easing : EASING_FUNCTIONS) {
            if (css.contains(easing)) {
                score += 8;
                break;
            }
        }
        if (css.contains("transform")) {
            score += 15;
        }
        if (css.contains("will-change")) {
            score += 10;
        }
        if (solution.getJsCode().contains("requestAnimationFrame")) {
            score += 5;
        }

        return HeuristicResult.ok(score);
    }

    public static HeuristicResult visualAppeal(Solution solution) {
        String css = lower(solution.getCssCode());
        double score = 50.0;

        score += 5 * countPresent(css, COLOR_KEYWORDS);
        score += 6 * countPresent(css, VISUAL_EFFECTS);

        return HeuristicResult.ok(score);
    }

    // Performance

    public static HeuristicResult codeEfficiency(Solution solution) {
        String css = lower(solution.getCssCode());
        String js = solution.getJsCode();
        double score = 70.0;

        if (!css.isEmpty()) {
            score += 5 * countPresent(css, GPU_FRIENDLY_PROPERTIES);

            Matcher thrashing = LAYOUT_THRASHING_PATTERN.matcher(css);
            while (thrashing.find()) {
                score -= 3;
            }
        }

        if (js.contains("requestAnimationFrame")) {
            score += 5;
        }
        if (js.contains("setInterval")) {
            score -= 5;
        }

        return HeuristicResult.ok(score);
    }

    public static HeuristicResult resourceUsage(Solution solution) {
        String html = solution.getHtmlCode();
        int totalSize = html.length() + solution.getCssCode().length();
        double score = 80.0;

        if (totalSize < 1000) {
            score += 10;
        } else if (totalSize > 5000) {
            score -= 10;
        }

        if (EXTERNAL_RESOURCE_PATTERN.matcher(html).find()) {
            score -= 5;
        }

        return HeuristicResult.ok(score);
    }

    public static HeuristicResult browserSupport(Solution solution) {
        String css = solution.getCssCode();
        double score = 75.0;

        if (!css.isEmpty()) {
            score += 3 * countPresent(lower(css), LAYOUT_FEATURES);
            if (css.contains("-webkit-") || css.contains("-moz-")) {
                score += 5;
            }
        }

        return HeuristicResult.ok(score);
    }

    // Creativity

    public static HeuristicResult uniqueness(Solution solution) {
        return HeuristicResult.ok(50.0 + 10 * countPresent(lower(solution.getCssCode()), ADVANCED_FEATURES));
    }

    public static HeuristicResult innovation(Solution solution) {
        double score = 50.0;

        switch (solution.getTechStack()) {
            case THREE_JS:
                score += 20;
                break;
            case GSAP:
                score += 15;
                break;
            case SVG_ANIMATION:
                score += 10;
                break;
            case CSS_ANIMATION:
                score += 5;
                break;
            default:
                break;
        }

        return HeuristicResult.ok(score);
    }

    public static HeuristicResult artisticValue(Solution solution) {
        return HeuristicResult.ok(50.0 + 5 * countPresent(lower(solution.getCssCode()), ARTISTIC_ELEMENTS));
    }

    // Usability

    public static HeuristicResult readability(Solution solution) {
        double score = 60.0;

        if (solution.getHtmlCode().contains("<!--")) {
            score += 20;
        }
        if (solution.getCssCode().contains("/*")) {
            score += 10;
        }
        String js = solution.getJsCode();
        if (js.contains("//") || js.contains("/*")) {
            score += 10;
        }

        return HeuristicResult.ok(score);
    }

    public static HeuristicResult lengthBand(Solution solution) {
        int totalLength = solution.getTotalCodeLength();

        if (totalLength >= 500 && totalLength <= 2000) {
            return HeuristicResult.ok(100.0);
        } else if (totalLength < 500) {
            return HeuristicResult.ok(80.0);
        } else if (totalLength <= 3000) {
            return HeuristicResult.ok(70.0);
        }
        return HeuristicResult.ok(50.0);
    }

    public static HeuristicResult stackSimplicity(Solution solution) {
        TechStack stack = solution.getTechStack();
        return HeuristicResult.ok(100.0 - (stack.getComplexity() - 0.3) * 75.0);
    }

    // Compatibility

    public static HeuristicResult modernFeatures(Solution solution) {
        return HeuristicResult.ok(80.0 + 2 * countPresent(lower(solution.getCssCode()), MODERN_FEATURES));
    }

    public static HeuristicResult vendorPrefixes(Solution solution) {
        return HeuristicResult.ok(70.0 + 7.5 * countPresent(lower(solution.getCssCode()), VENDOR_PREFIXES));
    }

    public static HeuristicResult scriptApis(Solution solution) {
        String js = solution.getJsCode();
        if (js.isBlank()) {
            return HeuristicResult.ok(90.0);
        }

        double score = 80.0;
        if (MODERN_DECLARATION_PATTERN.matcher(js).find()) {
            score += 5;
        }
        if (js.contains("querySelector")) {
            score += 5;
        }
        if (LEGACY_API_PATTERN.matcher(js).find()) {
            score -= 10;
        }

        return HeuristicResult.ok(score);
    }

    private static int countPresent(String code, List<String> tokens) {
        int count = 0;
        for (String token : tokens) {
            if (code.contains(token)) {
                count++;
            }
        }
        return count;
    }

    private static int braceDepth(String code) {
        int depth = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth;
    }

    private static boolean isValidBezier(String arguments) {
        String[] parts = arguments.split(",");
        if (parts.length != 4) {
            return false;
        }
        for (String part : parts) {
            try {
                Double.parseDouble(part.trim());
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    private static String lower(String code) {
        return code.toLowerCase(Locale.ROOT);
    }
}
