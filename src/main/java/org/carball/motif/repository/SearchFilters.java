package org.carball.motif.repository;

import lombok.Builder;
import lombok.Value;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

/**
 * AND-combined search restrictions. Unset fields do not restrict.
 */
@Value
@Builder
public class SearchFilters {

    SolutionCategory category;
    TechStack techStack;
    Double minQuality;
    Double minRating;

    public static SearchFilters none() {
        return SearchFilters.builder().build();
    }

    public boolean matches(Solution solution) {
        if (category != null && solution.getCategory() != category) {
            return false;
        }
        if (techStack != null && solution.getTechStack() != techStack) {
            return false;
        }
        if (minQuality != null && solution.getOverallScore() < minQuality) {
            return false;
        }
        return minRating == null || solution.getUserRating() >= minRating;
    }
}
