package org.carball.motif.repository;

import lombok.extern.slf4j.Slf4j;
import org.carball.motif.evaluation.SolutionEvaluator;
import org.carball.motif.model.QualityTier;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;
import org.carball.motif.persistence.SolutionStore;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Authoritative id to solution map backed by a {@link SolutionStore}. Every
 * mutation is written through to the store before it becomes visible here.
 */
@Slf4j
public class SolutionRepository {

    private static final double NAME_MATCH_WEIGHT = 10.0;
    private static final double DESCRIPTION_MATCH_WEIGHT = 5.0;
    private static final double TAG_MATCH_WEIGHT = 3.0;

    private final Map<String, Solution> solutions = new LinkedHashMap<>();
    private final Set<String> favorites = new LinkedHashSet<>();
    private final SolutionStore store;
    private final SolutionEvaluator evaluator;
    private final Clock clock;

    public SolutionRepository(SolutionStore store, SolutionEvaluator evaluator, Clock clock) {
        this.store = store;
        this.evaluator = evaluator;
        this.clock = clock;
        load();
    }

    private void load() {
        try {
            for (Solution solution : store.loadAll()) {
                solutions.put(solution.getId(), solution);
            }
            for (String favoriteId : store.loadFavorites()) {
                if (solutions.containsKey(favoriteId)) {
                    favorites.add(favoriteId);
                } else {
                    log.warn("Ignoring favorite for unknown solution {}", favoriteId);
                }
            }
        } catch (IOException e) {
            log.error("Failed to load solutions: {}", e.getMessage());
            throw new SolutionStorageException("Failed to load solutions", e);
        }
        log.info("Repository ready with {} solutions and {} favorites", solutions.size(), favorites.size());
    }

    /**
     * Stores the solution under its own id, optionally scoring it first.
     *
     * @return the solution id
     * @throws SolutionStorageException if the store rejects the write; the
     *         repository is left unchanged in that case
     */
    public String add(Solution solution, boolean autoEvaluate) {
        if (autoEvaluate) {
            evaluator.evaluateAndApply(solution);
        }
        persist(solution);
        solutions.put(solution.getId(), solution);
        log.debug("Added solution {} ({})", solution.getId(), solution.getName());
        return solution.getId();
    }

    public boolean update(Solution solution) {
        if (!solutions.containsKey(solution.getId())) {
            return false;
        }
        solution.setUpdatedAt(now());
        persist(solution);
        solutions.put(solution.getId(), solution);
        return true;
    }

    public boolean remove(String solutionId) {
        if (!solutions.containsKey(solutionId)) {
            return false;
        }
        try {
            store.delete(solutionId);
            if (favorites.contains(solutionId)) {
                List<String> remaining = new ArrayList<>(favorites);
                remaining.remove(solutionId);
                store.saveFavorites(remaining);
            }
        } catch (IOException e) {
            log.error("Failed to delete solution {}: {}", solutionId, e.getMessage());
            throw new SolutionStorageException("Failed to delete solution " + solutionId, e);
        }
        favorites.remove(solutionId);
        solutions.remove(solutionId);
        log.info("Removed solution {}", solutionId);
        return true;
    }

    public Optional<Solution> get(String solutionId) {
        return Optional.ofNullable(solutions.get(solutionId));
    }

    public List<Solution> findAll() {
        return new ArrayList<>(solutions.values());
    }

    public int size() {
        return solutions.size();
    }

    /**
     * Case-insensitive substring search over name, description and tags.
     * Filters are applied first; matches are ranked by relevance, ties keep
     * insertion order. A blank query returns every filtered solution.
     */
    public List<Solution> search(String query, SearchFilters filters) {
        SearchFilters effectiveFilters = filters == null ? SearchFilters.none() : filters;
        List<Solution> filtered = solutions.values().stream()
                .filter(effectiveFilters::matches)
                .collect(Collectors.toList());

        if (query == null || query.isBlank()) {
            return filtered;
        }

        String needle = query.toLowerCase(Locale.ROOT);
        Map<Solution, Double> relevance = new LinkedHashMap<>();
        for (Solution solution : filtered) {
            double score = relevanceOf(solution, needle);
            if (score > 0) {
                relevance.put(solution, score);
            }
        }

        List<Solution> ranked = new ArrayList<>(relevance.keySet());
        ranked.sort(Comparator.comparingDouble((Solution s) -> relevance.get(s)).reversed());
        log.debug("Search '{}' matched {} of {} solutions", query, ranked.size(), solutions.size());
        return ranked;
    }

    double relevanceOf(Solution solution, String lowerCaseQuery) {
        double base = 0.0;
        if (contains(solution.getName(), lowerCaseQuery)) {
            base += NAME_MATCH_WEIGHT;
        }
        if (contains(solution.getDescription(), lowerCaseQuery)) {
            base += DESCRIPTION_MATCH_WEIGHT;
        }
        for (String tag : solution.getTags()) {
            if (contains(tag, lowerCaseQuery)) {
                base += TAG_MATCH_WEIGHT;
            }
        }
        return base * (1.0 + solution.getOverallScore() / 100.0);
    }

    private static boolean contains(String text, String lowerCaseQuery) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerCaseQuery);
    }

    public List<Solution> getByCategory(SolutionCategory category) {
        return solutions.values().stream()
                .filter(s -> s.getCategory() == category)
                .collect(Collectors.toList());
    }

    public List<Solution> getByQualityTier(QualityTier tier) {
        return solutions.values().stream()
                .filter(s -> s.getQualityTier() == tier)
                .collect(Collectors.toList());
    }

    public List<Solution> topRated(int limit) {
        return sortedBy(Comparator.comparingDouble(Solution::getUserRating), limit);
    }

    public List<Solution> mostUsed(int limit) {
        return sortedBy(Comparator.comparingInt(Solution::getUsageCount), limit);
    }

    private List<Solution> sortedBy(Comparator<Solution> ascending, int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        return solutions.values().stream()
                .sorted(ascending.reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * @return false if the solution is unknown
     * @throws IllegalArgumentException if the rating is outside [0,5]
     */
    public boolean rate(String solutionId, double rating) {
        Solution solution = solutions.get(solutionId);
        if (solution == null) {
            return false;
        }
        LocalDateTime at = now();
        persistChange(solution, s -> s.addUserRating(rating, at));
        return true;
    }

    public boolean recordUsage(String solutionId) {
        Solution solution = solutions.get(solutionId);
        if (solution == null) {
            return false;
        }
        LocalDateTime at = now();
        persistChange(solution, s -> s.incrementUsage(at));
        return true;
    }

    /**
     * Marks a solution as favorite. Repeated calls are no-ops.
     *
     * @return true only when the favorites set changed
     */
    public boolean addToFavorites(String solutionId) {
        Solution solution = solutions.get(solutionId);
        if (solution == null || favorites.contains(solutionId)) {
            return false;
        }
        Set<String> updated = new LinkedHashSet<>(favorites);
        updated.add(solutionId);

        LocalDateTime at = now();
        persistChange(solution, s -> s.incrementFavorites(at), updated);
        favorites.add(solutionId);
        return true;
    }

    public boolean removeFromFavorites(String solutionId) {
        if (!favorites.contains(solutionId)) {
            return false;
        }
        Set<String> updated = new LinkedHashSet<>(favorites);
        updated.remove(solutionId);

        Solution solution = solutions.get(solutionId);
        if (solution == null) {
            persistFavorites(updated);
        } else {
            LocalDateTime at = now();
            persistChange(solution, s -> s.decrementFavorites(at), updated);
        }
        favorites.remove(solutionId);
        return true;
    }

    public boolean isFavorite(String solutionId) {
        return favorites.contains(solutionId);
    }

    public List<String> getFavoriteIds() {
        return new ArrayList<>(favorites);
    }

    public List<Solution> getFavoriteSolutions() {
        return favorites.stream()
                .map(solutions::get)
                .filter(s -> s != null)
                .collect(Collectors.toList());
    }

    public RepositoryStatistics statistics() {
        Map<QualityTier, Integer> tiers = new EnumMap<>(QualityTier.class);
        for (QualityTier tier : QualityTier.values()) {
            tiers.put(tier, 0);
        }
        Map<SolutionCategory, Integer> categories = new EnumMap<>(SolutionCategory.class);
        for (SolutionCategory category : SolutionCategory.values()) {
            categories.put(category, 0);
        }
        Map<TechStack, Integer> stacks = new EnumMap<>(TechStack.class);
        for (TechStack stack : TechStack.values()) {
            stacks.put(stack, 0);
        }

        long totalUsage = 0;
        double scoreSum = 0.0;
        double ratingSum = 0.0;
        int ratedCount = 0;
        Solution top = null;

        for (Solution solution : solutions.values()) {
            tiers.merge(solution.getQualityTier(), 1, Integer::sum);
            categories.merge(solution.getCategory(), 1, Integer::sum);
            stacks.merge(solution.getTechStack(), 1, Integer::sum);
            totalUsage += solution.getUsageCount();
            scoreSum += solution.getOverallScore();
            if (solution.isRated()) {
                ratingSum += solution.getUserRating();
                ratedCount++;
            }
            if (top == null || solution.getOverallScore() > top.getOverallScore()) {
                top = solution;
            }
        }

        return RepositoryStatistics.builder()
                .totalSolutions(solutions.size())
                .totalFavorites(favorites.size())
                .totalUsage(totalUsage)
                .qualityDistribution(tiers)
                .categoryDistribution(categories)
                .techStackDistribution(stacks)
                .averageOverallScore(solutions.isEmpty() ? 0.0 : scoreSum / solutions.size())
                .averageRating(ratedCount == 0 ? 0.0 : ratingSum / ratedCount)
                .topSolution(top)
                .build();
    }

    private void persist(Solution solution) {
        try {
            store.save(solution);
        } catch (IOException e) {
            log.error("Failed to save solution {}: {}", solution.getId(), e.getMessage());
            throw new SolutionStorageException("Failed to save solution " + solution.getId(), e);
        }
    }

    private void persistFavorites(Set<String> favoriteIds) {
        try {
            store.saveFavorites(new ArrayList<>(favoriteIds));
        } catch (IOException e) {
            log.error("Failed to save favorites: {}", e.getMessage());
            throw new SolutionStorageException("Failed to save favorites", e);
        }
    }

    /**
     * Writes a changed copy first and applies the change to the live solution
     * only once the store accepted it.
     */
    private void persistChange(Solution solution, Consumer<Solution> change) {
        Solution changed = solution.duplicate();
        change.accept(changed);
        persist(changed);
        change.accept(solution);
    }

    private void persistChange(Solution solution, Consumer<Solution> change, Set<String> favoriteIds) {
        Solution changed = solution.duplicate();
        change.accept(changed);
        persist(changed);
        try {
            persistFavorites(favoriteIds);
        } catch (SolutionStorageException e) {
            restore(solution);
            throw e;
        }
        change.accept(solution);
    }

    private void restore(Solution solution) {
        try {
            store.save(solution);
        } catch (IOException e) {
            log.error("Failed to restore solution {} after a favorites write failure: {}",
                    solution.getId(), e.getMessage());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
