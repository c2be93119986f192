package org.carball.motif.recommendation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.carball.motif.behavior.BehaviorAction;
import org.carball.motif.behavior.BehaviorEvent;
import org.carball.motif.behavior.BehaviorTracker;
import org.carball.motif.model.Solution;
import org.carball.motif.preference.PreferenceModel;
import org.carball.motif.preference.PreferenceVector;
import org.carball.motif.similarity.SimilarityCalculator;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Ranks candidate solutions for the current user by blending quality,
 * preference match, popularity, novelty and context fit.
 *
 * <p>Ranked lists are cached for a fixed time. A cache hit returns the very
 * list computed earlier, even if the candidates have been mutated since;
 * recording an interaction through this engine clears the cache.
 */
@Slf4j
public class RecommendationEngine {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);
    public static final long DEFAULT_CACHE_MAXIMUM_SIZE = 500;

    static final double QUALITY_WEIGHT = 0.30;
    static final double PREFERENCE_WEIGHT = 0.25;
    static final double POPULARITY_WEIGHT = 0.20;
    static final double NOVELTY_WEIGHT = 0.15;
    static final double CONTEXT_WEIGHT = 0.10;

    private static final double PERSONALIZED_CATEGORY_MINIMUM = 0.3;
    private static final double NEUTRAL = 0.5;

    private final BehaviorTracker tracker;
    private final PreferenceModel preferenceModel;
    private final SimilarityCalculator similarityCalculator;
    private final Clock clock;
    private final Cache<CacheKey, List<RecommendationResult>> cache;

    private record CacheKey(List<String> sortedIds, RecommendationContext context, int limit) {
    }

    public RecommendationEngine(BehaviorTracker tracker,
                                PreferenceModel preferenceModel,
                                SimilarityCalculator similarityCalculator,
                                Clock clock) {
        this(tracker, preferenceModel, similarityCalculator, clock, DEFAULT_CACHE_TTL, DEFAULT_CACHE_MAXIMUM_SIZE);
    }

    public RecommendationEngine(BehaviorTracker tracker,
                                PreferenceModel preferenceModel,
                                SimilarityCalculator similarityCalculator,
                                Clock clock,
                                Duration cacheTtl,
                                long cacheMaximumSize) {
        this.tracker = tracker;
        this.preferenceModel = preferenceModel;
        this.similarityCalculator = similarityCalculator;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheMaximumSize)
                .expireAfterWrite(cacheTtl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        log.info("Recommendation engine ready: cache TTL {} min, max {} entries",
                cacheTtl.toMinutes(), cacheMaximumSize);
    }

    /**
     * Scores every candidate and returns the best {@code limit}, highest first.
     * Ties keep candidate order. Empty input or a non-positive limit yields an
     * empty list.
     */
    public List<RecommendationResult> recommend(List<Solution> candidates, RecommendationContext context, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return Collections.emptyList();
        }

        RecommendationContext effectiveContext = context == null ? RecommendationContext.empty() : context;
        List<String> sortedIds = candidates.stream()
                .map(Solution::getId)
                .sorted()
                .collect(Collectors.toList());
        CacheKey key = new CacheKey(sortedIds, effectiveContext, limit);

        return cache.get(key, k -> computeRecommendations(candidates, effectiveContext, limit));
    }

    private List<RecommendationResult> computeRecommendations(List<Solution> candidates,
                                                              RecommendationContext context,
                                                              int limit) {
        PreferenceVector preferences = preferenceModel.derive();
        PopularityBaseline baseline = PopularityBaseline.of(candidates);

        List<RecommendationResult> scored = new ArrayList<>(candidates.size());
        for (Solution candidate : candidates) {
            scored.add(score(candidate, preferences, baseline, context));
        }
        scored.sort(Comparator.comparingDouble(RecommendationResult::totalScore).reversed());

        List<RecommendationResult> top = List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
        log.info("Generated {} recommendations from {} candidates", top.size(), candidates.size());
        return top;
    }

    RecommendationResult score(Solution solution,
                               PreferenceVector preferences,
                               PopularityBaseline baseline,
                               RecommendationContext context) {
        double quality = solution.getOverallScore() / 100.0;
        double preference = preferenceScore(solution, preferences);
        double popularity = baseline.popularity(solution);
        double novelty = noveltyScore(solution);
        double contextFit = contextScore(solution, context);

        double total = quality * QUALITY_WEIGHT
                + preference * PREFERENCE_WEIGHT
                + popularity * POPULARITY_WEIGHT
                + novelty * NOVELTY_WEIGHT
                + contextFit * CONTEXT_WEIGHT;

        return new RecommendationResult(
                solution.getId(),
                solution.getName(),
                total,
                quality,
                preference,
                popularity,
                novelty,
                contextFit,
                explain(solution, quality, preference, popularity, novelty));
    }

    double preferenceScore(Solution solution, PreferenceVector preferences) {
        double category = preferences.categoryWeight(solution.getCategory());
        double techStack = preferences.techStackWeight(solution.getTechStack());
        double qualityMet = solution.getOverallScore() >= preferences.getQualityThreshold() * 100.0 ? 1.0 : 0.5;
        double complexity = 1.0 - Math.abs(solution.getOverallScore() / 100.0 - preferences.getComplexityAppetite());

        return category * 0.4 + techStack * 0.3 + qualityMet * 0.2 + complexity * 0.1;
    }

    double noveltyScore(Solution solution) {
        LocalDateTime now = LocalDateTime.now(clock);
        long ageDays = solution.getCreatedAt() == null ? 0 : ChronoUnit.DAYS.between(solution.getCreatedAt(), now);

        double timeNovelty;
        if (ageDays <= 7) {
            timeNovelty = 1.0;
        } else if (ageDays <= 30) {
            timeNovelty = 0.8;
        } else if (ageDays <= 90) {
            timeNovelty = 0.5;
        } else {
            timeNovelty = 0.2;
        }

        double usageNovelty = 1.0 / (1.0 + Math.log(solution.getUsageCount() + 1.0));
        return timeNovelty * 0.7 + usageNovelty * 0.3;
    }

    double contextScore(Solution solution, RecommendationContext context) {
        if (context == null || context.isEmpty()) {
            return NEUTRAL;
        }

        double score = NEUTRAL;
        if (context.getTargetCategory() != null && context.getTargetCategory() == solution.getCategory()) {
            score += 0.3;
        }
        if (context.getPreferredTech() != null && context.getPreferredTech() == solution.getTechStack()) {
            score += 0.2;
        }
        List<String> keywords = context.getKeywords();
        if (!keywords.isEmpty()) {
            String description = solution.getDescription() == null
                    ? ""
                    : solution.getDescription().toLowerCase(Locale.ROOT);
            long matching = keywords.stream()
                    .filter(keyword -> description.contains(keyword.toLowerCase(Locale.ROOT)))
                    .count();
            score += (double) matching / Math.max(1, keywords.size()) * 0.3;
        }
        return Math.min(1.0, score);
    }

    String explain(Solution solution, double quality, double preference, double popularity, double novelty) {
        List<String> reasons = new ArrayList<>();

        if (quality > 0.8) {
            reasons.add("high-quality solution");
        } else if (quality > 0.6) {
            reasons.add("good quality");
        }

        if (preference > 0.7) {
            reasons.add("matches your preferences");
        }

        if (popularity > 0.7) {
            reasons.add("popular choice");
        } else if (solution.getUsageCount() > 10) {
            reasons.add("proven in use");
        }

        if (novelty > 0.8) {
            reasons.add("fresh idea");
        }

        reasons.add(solution.getTechStack().getBlurb());
        return String.join(", ", reasons);
    }

    /**
     * Prefers candidates that clear the user's quality threshold in a category
     * they engage with, widening to all candidates when too few qualify.
     */
    public List<RecommendationResult> getPersonalizedRecommendations(List<Solution> candidates, int limit) {
        if (candidates == null || candidates.isEmpty()) {
            return Collections.emptyList();
        }

        PreferenceVector preferences = preferenceModel.derive();
        List<Solution> preferred = candidates.stream()
                .filter(s -> s.getOverallScore() >= preferences.getQualityThreshold() * 100.0)
                .filter(s -> preferences.categoryWeight(s.getCategory()) > PERSONALIZED_CATEGORY_MINIMUM)
                .collect(Collectors.toList());

        List<Solution> pool = preferred.size() < limit ? candidates : preferred;
        log.debug("Personalized pool: {} of {} candidates", pool.size(), candidates.size());
        return recommend(pool, RecommendationContext.empty(), limit);
    }

    /**
     * Most similar candidates to {@code target}, excluding the target itself.
     */
    public List<SimilarSolution> getSimilarSolutions(Solution target, List<Solution> candidates, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return candidates.stream()
                .filter(candidate -> !candidate.getId().equals(target.getId()))
                .map(candidate -> new SimilarSolution(candidate, similarityCalculator.similarity(target, candidate)))
                .sorted(Comparator.comparingDouble(SimilarSolution::similarity).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Ranks by {@code recentUsage * 0.5 + rating * ratingCount * 0.3 + favorites * 0.2};
     * usage only counts for solutions touched within the window.
     */
    public List<Solution> getTrendingSolutions(List<Solution> candidates, int windowDays, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(windowDays);

        List<Solution> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingDouble((Solution s) -> trendScore(s, cutoff)).reversed());
        return new ArrayList<>(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    static double trendScore(Solution solution, LocalDateTime cutoff) {
        boolean recent = solution.getUpdatedAt() != null && !solution.getUpdatedAt().isBefore(cutoff);
        double recentUsage = recent ? solution.getUsageCount() : 0;
        return recentUsage * 0.5
                + solution.getUserRating() * solution.getRatingCount() * 0.3
                + solution.getFavoriteCount() * 0.2;
    }

    /**
     * Logs the interaction and drops cached rankings, which no longer reflect
     * the user's preferences.
     */
    public BehaviorEvent recordInteraction(BehaviorAction action, Solution solution, Double rating) {
        BehaviorEvent event = tracker.track(action, solution, rating);
        invalidateCache();
        return event;
    }

    public void invalidateCache() {
        cache.invalidateAll();
    }

    public long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public RecommendationStatistics getStatistics() {
        Map<BehaviorAction, Long> byAction = new EnumMap<>(BehaviorAction.class);
        for (BehaviorEvent event : tracker.getEvents()) {
            byAction.merge(event.action(), 1L, Long::sum);
        }
        return RecommendationStatistics.builder()
                .totalEvents(tracker.size())
                .eventsByAction(byAction)
                .preferences(preferenceModel.derive())
                .cachedRecommendations(cacheSize())
                .build();
    }

    /**
     * Per-candidate-set maxima used to normalize popularity signals.
     */
    record PopularityBaseline(int maxUsage, double maxRating, int maxFavorites) {

        static PopularityBaseline of(List<Solution> candidates) {
            int maxUsage = candidates.stream().mapToInt(Solution::getUsageCount).max().orElse(0);
            double maxRating = candidates.stream()
                    .filter(Solution::isRated)
                    .mapToDouble(Solution::getUserRating)
                    .max()
                    .orElse(Solution.MAX_RATING);
            int maxFavorites = candidates.stream().mapToInt(Solution::getFavoriteCount).max().orElse(0);
            return new PopularityBaseline(maxUsage, maxRating, maxFavorites);
        }

        double popularity(Solution solution) {
            double usage = (double) solution.getUsageCount() / Math.max(1, maxUsage);
            double rating;
            if (!solution.isRated()) {
                rating = NEUTRAL;
            } else if (maxRating <= 0) {
                rating = 0.0;
            } else {
                rating = solution.getUserRating() / maxRating;
            }
            double favorites = (double) solution.getFavoriteCount() / Math.max(1, maxFavorites);
            return usage * 0.5 + rating * 0.3 + favorites * 0.2;
        }
    }
}
