package org.carball.motif.behavior;

import lombok.extern.slf4j.Slf4j;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only log of user interactions. The weighted per-category and
 * per-tech-stack counters are recomputed from the log on every call.
 */
@Slf4j
public class BehaviorTracker {

    private final List<BehaviorEvent> events = new ArrayList<>();
    private final Clock clock;

    public BehaviorTracker(Clock clock) {
        this.clock = clock;
    }

    public BehaviorEvent trackView(Solution solution) {
        return track(BehaviorAction.VIEW, solution, null);
    }

    public BehaviorEvent trackApply(Solution solution) {
        return track(BehaviorAction.APPLY, solution, null);
    }

    public BehaviorEvent trackFavorite(Solution solution) {
        return track(BehaviorAction.FAVORITE, solution, null);
    }

    public BehaviorEvent trackRating(Solution solution, double rating) {
        return track(BehaviorAction.RATE, solution, rating);
    }

    /**
     * @throws IllegalArgumentException for a RATE action without a rating in [0,5]
     */
    public BehaviorEvent track(BehaviorAction action, Solution solution, Double rating) {
        if (action == BehaviorAction.RATE) {
            if (rating == null || rating.isNaN() || rating < Solution.MIN_RATING || rating > Solution.MAX_RATING) {
                throw new IllegalArgumentException("Rating must be between 0 and 5, got " + rating);
            }
        }

        BehaviorEvent event = new BehaviorEvent(
                action,
                solution.getId(),
                solution.getCategory(),
                solution.getTechStack(),
                action == BehaviorAction.RATE ? rating : null,
                LocalDateTime.now(clock));
        events.add(event);
        log.debug("Tracked {} on solution {}", action.getValue(), solution.getId());
        return event;
    }

    public void importEvents(Collection<BehaviorEvent> imported) {
        events.addAll(imported);
        log.info("Imported {} behavior events", imported.size());
    }

    public List<BehaviorEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public List<BehaviorEvent> getInteractions(String solutionId) {
        return events.stream()
                .filter(e -> e.solutionId().equals(solutionId))
                .collect(Collectors.toList());
    }

    public boolean hasAction(BehaviorAction action) {
        return events.stream().anyMatch(e -> e.action() == action);
    }

    public int size() {
        return events.size();
    }

    public Map<SolutionCategory, Integer> categoryCounters() {
        Map<SolutionCategory, Integer> counters = new EnumMap<>(SolutionCategory.class);
        for (BehaviorEvent event : events) {
            if (event.category() != null) {
                counters.merge(event.category(), event.weight(), Integer::sum);
            }
        }
        return counters;
    }

    public Map<TechStack, Integer> techStackCounters() {
        Map<TechStack, Integer> counters = new EnumMap<>(TechStack.class);
        for (BehaviorEvent event : events) {
            if (event.techStack() != null) {
                counters.merge(event.techStack(), event.weight(), Integer::sum);
            }
        }
        return counters;
    }

    public Clock getClock() {
        return clock;
    }
}
