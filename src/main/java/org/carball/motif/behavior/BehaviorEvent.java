package org.carball.motif.behavior;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.time.LocalDateTime;

/**
 * One logged interaction. Category and tech stack are captured at the time of
 * the event so later edits to the solution do not rewrite history.
 */
public record BehaviorEvent(
        @JsonProperty("action") BehaviorAction action,
        @JsonProperty("solution_id") String solutionId,
        @JsonProperty("category") SolutionCategory category,
        @JsonProperty("tech_stack") TechStack techStack,
        @JsonProperty("rating") Double rating,
        @JsonProperty("timestamp") LocalDateTime timestamp
) {

    public int weight() {
        return action.weight(rating);
    }
}
