package org.carball.motif.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.motif.model.QualityTier;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;
import org.carball.motif.persistence.SolutionJson;
import org.carball.motif.recommendation.RecommendationResult;
import org.carball.motif.repository.RepositoryStatistics;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders repository statistics, a solution listing and a recommendation list
 * as JSON or Markdown. Each part is optional.
 */
@Slf4j
public class SolutionReport {

    private final String title;
    private final RepositoryStatistics statistics;
    private final List<Solution> solutions;
    private final List<RecommendationResult> recommendations;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public SolutionReport(String title,
                          RepositoryStatistics statistics,
                          List<Solution> solutions,
                          List<RecommendationResult> recommendations,
                          LocalDateTime timestamp) {
        this.title = title;
        this.statistics = statistics;
        this.solutions = solutions == null ? Collections.emptyList() : solutions;
        this.recommendations = recommendations == null ? Collections.emptyList() : recommendations;
        this.timestamp = timestamp;
        this.objectMapper = SolutionJson.createMapper();
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# ").append(title).append("\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        if (statistics != null) {
            appendStatistics(md);
        }

        if (!solutions.isEmpty()) {
            md.append("## Solutions\n\n");
            md.append("| # | Name | Category | Tech Stack | Score | Tier | Rating | Usage |\n");
            md.append("|---|------|----------|------------|-------|------|--------|-------|\n");
            int row = 1;
            for (Solution solution : solutions) {
                md.append("| ").append(row++)
                        .append(" | ").append(escape(solution.getName()))
                        .append(" | ").append(solution.getCategory().getValue())
                        .append(" | ").append(solution.getTechStack().getValue())
                        .append(" | ").append(String.format("%.1f", solution.getOverallScore()))
                        .append(" | ").append(solution.getQualityTier().getValue())
                        .append(" | ").append(String.format("%.1f (%d)", solution.getUserRating(), solution.getRatingCount()))
                        .append(" | ").append(solution.getUsageCount())
                        .append(" |\n");
            }
            md.append("\n");
        }

        if (!recommendations.isEmpty()) {
            md.append("## Recommendations\n\n");
            int rank = 1;
            for (RecommendationResult result : recommendations) {
                md.append("### ").append(rank++).append(". ").append(escape(result.solutionName())).append("\n\n");
                md.append("- **Score:** ").append(String.format("%.3f", result.totalScore())).append("\n");
                md.append("- **Why:** ").append(result.explanation()).append("\n");
                md.append(String.format("- **Breakdown:** quality %.2f, preference %.2f, popularity %.2f, novelty %.2f, context %.2f%n",
                        result.qualityScore(), result.preferenceScore(), result.popularityScore(),
                        result.noveltyScore(), result.contextScore()));
                md.append("- **Id:** `").append(result.solutionId()).append("`\n\n");
            }
        }

        if (statistics == null && solutions.isEmpty() && recommendations.isEmpty()) {
            md.append("**No solutions matched.**\n");
        }

        return md.toString();
    }

    private void appendStatistics(StringBuilder md) {
        md.append("## Repository Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Solutions | ").append(statistics.getTotalSolutions()).append(" |\n");
        md.append("| Favorites | ").append(statistics.getTotalFavorites()).append(" |\n");
        md.append("| Total Usage | ").append(statistics.getTotalUsage()).append(" |\n");
        md.append("| Average Score | ").append(String.format("%.1f", statistics.getAverageOverallScore())).append(" |\n");
        md.append("| Average Rating | ").append(String.format("%.2f", statistics.getAverageRating())).append(" |\n");
        statistics.getBestSolution().ifPresent(top -> md.append("| Top Solution | ")
                .append(escape(top.getName()))
                .append(String.format(" (%.1f)", top.getOverallScore()))
                .append(" |\n"));
        md.append("\n");

        md.append("### Quality Tiers\n\n");
        statistics.getQualityDistribution().forEach((tier, count) ->
                md.append("- ").append(tier.getValue()).append(": ").append(count).append("\n"));
        md.append("\n### Categories\n\n");
        statistics.getCategoryDistribution().forEach((category, count) ->
                md.append("- ").append(category.getValue()).append(": ").append(count).append("\n"));
        md.append("\n### Tech Stacks\n\n");
        statistics.getTechStackDistribution().forEach((stack, count) ->
                md.append("- ").append(stack.getValue()).append(": ").append(count).append("\n"));
        md.append("\n");
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("|", "\\|");
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setTitle(title);
        report.setGeneratedAt(timestamp);

        if (statistics != null) {
            StatisticsData data = new StatisticsData();
            data.setTotalSolutions(statistics.getTotalSolutions());
            data.setTotalFavorites(statistics.getTotalFavorites());
            data.setTotalUsage(statistics.getTotalUsage());
            data.setAverageOverallScore(statistics.getAverageOverallScore());
            data.setAverageRating(statistics.getAverageRating());
            data.setTopSolutionId(statistics.getTopSolutionId());
            data.setQualityDistribution(byValue(statistics.getQualityDistribution()));
            data.setCategoryDistribution(byValue(statistics.getCategoryDistribution()));
            data.setTechStackDistribution(byValue(statistics.getTechStackDistribution()));
            report.setStatistics(data);
        }

        List<SolutionSummary> summaries = new ArrayList<>();
        for (Solution solution : solutions) {
            SolutionSummary summary = new SolutionSummary();
            summary.setSolutionId(solution.getId());
            summary.setName(solution.getName());
            summary.setCategory(solution.getCategory());
            summary.setTechStack(solution.getTechStack());
            summary.setOverallScore(solution.getOverallScore());
            summary.setQualityTier(solution.getQualityTier());
            summary.setUserRating(solution.getUserRating());
            summary.setUsageCount(solution.getUsageCount());
            summary.setVersion(solution.getVersion());
            summaries.add(summary);
        }
        report.setSolutions(summaries);
        report.setRecommendations(recommendations);
        return report;
    }

    private static Map<String, Integer> byValue(Map<?, Integer> distribution) {
        Map<String, Integer> result = new LinkedHashMap<>();
        distribution.forEach((key, count) -> result.put(enumValue(key), count));
        return result;
    }

    private static String enumValue(Object key) {
        if (key instanceof QualityTier tier) {
            return tier.getValue();
        }
        if (key instanceof SolutionCategory category) {
            return category.getValue();
        }
        if (key instanceof TechStack stack) {
            return stack.getValue();
        }
        return String.valueOf(key);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private String title;
        private LocalDateTime generatedAt;
        private StatisticsData statistics;
        private List<SolutionSummary> solutions;
        private List<RecommendationResult> recommendations;
    }

    @lombok.Data
    private static class StatisticsData {
        private int totalSolutions;
        private int totalFavorites;
        private long totalUsage;
        private double averageOverallScore;
        private double averageRating;
        private String topSolutionId;
        private Map<String, Integer> qualityDistribution;
        private Map<String, Integer> categoryDistribution;
        private Map<String, Integer> techStackDistribution;
    }

    @lombok.Data
    private static class SolutionSummary {
        private String solutionId;
        private String name;
        private SolutionCategory category;
        private TechStack techStack;
        private double overallScore;
        private QualityTier qualityTier;
        private double userRating;
        private int usageCount;
        private String version;
    }
}
