package org.carball.motif.recommendation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.util.List;

/**
 * What the user is currently working on. Every field is optional; an empty
 * context scores every candidate with the neutral baseline.
 */
@Value
@Builder
public class RecommendationContext {

    SolutionCategory targetCategory;
    TechStack preferredTech;
    @Singular
    List<String> keywords;

    public static RecommendationContext empty() {
        return RecommendationContext.builder().build();
    }

    public boolean isEmpty() {
        return targetCategory == null && preferredTech == null && keywords.isEmpty();
    }
}
