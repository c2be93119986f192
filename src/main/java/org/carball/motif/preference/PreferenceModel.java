package org.carball.motif.preference;

import lombok.extern.slf4j.Slf4j;
import org.carball.motif.behavior.BehaviorAction;
import org.carball.motif.behavior.BehaviorEvent;
import org.carball.motif.behavior.BehaviorTracker;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link PreferenceVector} from the behavior log. Nothing is cached;
 * each call reflects the log as it is now.
 */
@Slf4j
public class PreferenceModel {

    public static final int DEFAULT_RECENT_ACTIVITY_DAYS = 7;
    private static final double RECENT_SHARE_FOR_NOVELTY = 0.7;

    private final BehaviorTracker tracker;
    private final int recentActivityDays;

    public PreferenceModel(BehaviorTracker tracker) {
        this(tracker, DEFAULT_RECENT_ACTIVITY_DAYS);
    }

    public PreferenceModel(BehaviorTracker tracker, int recentActivityDays) {
        this.tracker = tracker;
        this.recentActivityDays = recentActivityDays;
    }

    public PreferenceVector derive() {
        Map<SolutionCategory, Integer> categoryCounters = tracker.categoryCounters();
        Map<TechStack, Integer> techStackCounters = tracker.techStackCounters();

        PreferenceVector vector = PreferenceVector.builder()
                .categoryWeights(normalize(categoryCounters, SolutionCategory.class))
                .techStackWeights(normalize(techStackCounters, TechStack.class))
                .qualityThreshold(tracker.hasAction(BehaviorAction.APPLY)
                        ? PreferenceVector.APPLIED_QUALITY_THRESHOLD
                        : PreferenceVector.DEFAULT_QUALITY_THRESHOLD)
                .complexityAppetite(complexityAppetite(techStackCounters))
                .noveltyAppetite(noveltyAppetite(tracker.getEvents()))
                .build();

        log.debug("Derived preferences from {} events: {}", tracker.size(), vector);
        return vector;
    }

    private static <K extends Enum<K>> Map<K, Double> normalize(Map<K, Integer> counters, Class<K> keyType) {
        int total = counters.values().stream().mapToInt(Integer::intValue).sum();
        double denominator = Math.max(1, total);
        Map<K, Double> weights = new EnumMap<>(keyType);
        counters.forEach((key, count) -> weights.put(key, count / denominator));
        return Collections.unmodifiableMap(weights);
    }

    private static double complexityAppetite(Map<TechStack, Integer> techStackCounters) {
        double weighted = 0.0;
        int total = 0;
        for (Map.Entry<TechStack, Integer> entry : techStackCounters.entrySet()) {
            if (entry.getValue() > 0) {
                weighted += entry.getKey().getComplexity() * entry.getValue();
                total += entry.getValue();
            }
        }
        return weighted / Math.max(1, total);
    }

    private double noveltyAppetite(List<BehaviorEvent> events) {
        LocalDateTime now = LocalDateTime.now(tracker.getClock());
        long recent = events.stream()
                .filter(e -> e.timestamp() != null)
                .filter(e -> ChronoUnit.DAYS.between(e.timestamp(), now) <= recentActivityDays)
                .count();
        return recent > events.size() * RECENT_SHARE_FOR_NOVELTY
                ? PreferenceVector.HIGH_NOVELTY_APPETITE
                : PreferenceVector.LOW_NOVELTY_APPETITE;
    }
}
