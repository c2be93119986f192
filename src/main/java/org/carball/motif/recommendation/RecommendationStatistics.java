package org.carball.motif.recommendation;

import lombok.Builder;
import lombok.Value;
import org.carball.motif.behavior.BehaviorAction;
import org.carball.motif.preference.PreferenceVector;

import java.util.Map;

@Value
@Builder
public class RecommendationStatistics {

    int totalEvents;
    Map<BehaviorAction, Long> eventsByAction;
    PreferenceVector preferences;
    long cachedRecommendations;
}
