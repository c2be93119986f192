package org.carball.motif.repository;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.carball.motif.model.QualityTier;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.util.Map;
import java.util.Optional;

@Value
@Builder
public class RepositoryStatistics {

    int totalSolutions;
    int totalFavorites;
    long totalUsage;
    Map<QualityTier, Integer> qualityDistribution;
    Map<SolutionCategory, Integer> categoryDistribution;
    Map<TechStack, Integer> techStackDistribution;
    double averageOverallScore;
    double averageRating;

    @JsonIgnore
    Solution topSolution;

    @JsonIgnore
    public Optional<Solution> getBestSolution() {
        return Optional.ofNullable(topSolution);
    }

    public String getTopSolutionId() {
        return topSolution == null ? null : topSolution.getId();
    }

    public String getTopSolutionName() {
        return topSolution == null ? null : topSolution.getName();
    }
}
