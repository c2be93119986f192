package org.carball.motif.studio;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.motif.behavior.BehaviorAction;
import org.carball.motif.behavior.BehaviorTracker;
import org.carball.motif.config.EngineSettings;
import org.carball.motif.evaluation.SolutionEvaluator;
import org.carball.motif.model.Solution;
import org.carball.motif.persistence.BehaviorLogFile;
import org.carball.motif.persistence.JsonFileSolutionStore;
import org.carball.motif.persistence.SolutionStore;
import org.carball.motif.preference.PreferenceModel;
import org.carball.motif.recommendation.RecommendationContext;
import org.carball.motif.recommendation.RecommendationEngine;
import org.carball.motif.recommendation.RecommendationResult;
import org.carball.motif.recommendation.SimilarSolution;
import org.carball.motif.repository.SolutionRepository;
import org.carball.motif.similarity.SimilarityCalculator;
import org.carball.motif.versioning.SolutionVersionManager;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One authoring session: wires the repository, evaluator, version manager,
 * behavior tracker and recommendation engine together and keeps the
 * repository counters and the behavior log in step.
 */
@Slf4j
@Getter
public class SolutionStudio {

    private final EngineSettings settings;
    private final SolutionEvaluator evaluator;
    private final SolutionRepository repository;
    private final SolutionVersionManager versionManager;
    private final BehaviorTracker tracker;
    private final PreferenceModel preferenceModel;
    private final SimilarityCalculator similarityCalculator;
    private final RecommendationEngine recommendationEngine;
    private final SolutionProducer producer;

    public SolutionStudio(EngineSettings settings, SolutionStore store, SolutionProducer producer, Clock clock) {
        this.settings = settings;
        this.producer = producer;
        this.evaluator = new SolutionEvaluator();
        this.repository = new SolutionRepository(store, evaluator, clock);
        this.versionManager = new SolutionVersionManager(clock);
        this.tracker = new BehaviorTracker(clock);
        this.preferenceModel = new PreferenceModel(tracker, settings.getRecentActivityDays());
        this.similarityCalculator = new SimilarityCalculator();
        this.recommendationEngine = new RecommendationEngine(
                tracker,
                preferenceModel,
                similarityCalculator,
                clock,
                settings.getCacheTtl(),
                settings.getCacheMaximumSize());
    }

    /**
     * Opens a studio over the JSON store in the configured storage directory.
     */
    public static SolutionStudio open(EngineSettings settings, SolutionProducer producer) throws IOException {
        SolutionStore store = new JsonFileSolutionStore(settings.getStoragePath());
        return new SolutionStudio(settings, store, producer, Clock.systemDefaultZone());
    }

    /**
     * Asks the producer for a new solution and stores it, scoring it when
     * auto-evaluation is on.
     */
    public Solution generate(String description, Map<String, String> constraints) {
        if (producer == null) {
            throw new IllegalStateException("No solution producer configured");
        }
        Solution solution = producer.produce(description,
                constraints == null ? Collections.emptyMap() : constraints);
        if (solution == null) {
            throw new IllegalStateException("Producer returned no solution for: " + description);
        }
        repository.add(solution, settings.isAutoEvaluate());
        log.info("Generated solution {} '{}' ({})", solution.getId(), solution.getName(),
                solution.getQualityTier().getValue());
        return solution;
    }

    public Optional<Solution> view(String solutionId) {
        Optional<Solution> solution = repository.get(solutionId);
        solution.ifPresent(s -> recommendationEngine.recordInteraction(BehaviorAction.VIEW, s, null));
        return solution;
    }

    public boolean apply(String solutionId) {
        Optional<Solution> solution = repository.get(solutionId);
        if (solution.isEmpty()) {
            return false;
        }
        repository.recordUsage(solutionId);
        recommendationEngine.recordInteraction(BehaviorAction.APPLY, solution.get(), null);
        return true;
    }

    public boolean favorite(String solutionId) {
        if (!repository.addToFavorites(solutionId)) {
            return false;
        }
        repository.get(solutionId)
                .ifPresent(s -> recommendationEngine.recordInteraction(BehaviorAction.FAVORITE, s, null));
        return true;
    }

    public boolean unfavorite(String solutionId) {
        return repository.removeFromFavorites(solutionId);
    }

    /**
     * @throws IllegalArgumentException if the rating is outside [0,5]
     */
    public boolean rate(String solutionId, double rating) {
        if (!repository.rate(solutionId, rating)) {
            return false;
        }
        repository.get(solutionId)
                .ifPresent(s -> recommendationEngine.recordInteraction(BehaviorAction.RATE, s, rating));
        return true;
    }

    /**
     * Records the current state of a stored solution as a new version.
     */
    public Optional<String> createVersion(String solutionId, String changesDescription) {
        Optional<Solution> solution = repository.get(solutionId);
        if (solution.isEmpty()) {
            return Optional.empty();
        }
        String version = versionManager.createVersion(solution.get(), changesDescription);
        repository.update(solution.get());
        return Optional.of(version);
    }

    public Optional<Solution> rollback(String solutionId, String version) {
        return versionManager.rollbackToVersion(solutionId, version);
    }

    public List<RecommendationResult> recommend(RecommendationContext context, int limit) {
        return recommendationEngine.recommend(repository.findAll(), context, limit);
    }

    public List<RecommendationResult> recommendPersonalized(int limit) {
        return recommendationEngine.getPersonalizedRecommendations(repository.findAll(), limit);
    }

    public List<SimilarSolution> similarTo(String solutionId) {
        return repository.get(solutionId)
                .map(target -> recommendationEngine.getSimilarSolutions(
                        target, repository.findAll(), settings.getSimilarLimit()))
                .orElse(Collections.emptyList());
    }

    public List<Solution> trending(int limit) {
        return recommendationEngine.getTrendingSolutions(
                repository.findAll(), settings.getTrendingWindowDays(), limit);
    }

    public void exportBehavior(Path file) throws IOException {
        new BehaviorLogFile(file).export(tracker, preferenceModel);
    }

    public int importBehavior(Path file) throws IOException {
        int imported = new BehaviorLogFile(file).importInto(tracker);
        recommendationEngine.invalidateCache();
        return imported;
    }
}
