package org.carball.motif.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.motif.model.QualityTier;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionMetrics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores each solution as {@code <id>.json} in a directory, next to a
 * {@code favorites.json} array of solution ids.
 */
@Slf4j
public class JsonFileSolutionStore implements SolutionStore {

    static final String FAVORITES_FILE = "favorites.json";
    private static final String JSON_EXTENSION = ".json";

    @Getter
    private final Path storageDirectory;
    private final ObjectMapper objectMapper;

    public JsonFileSolutionStore(Path storageDirectory) throws IOException {
        this.storageDirectory = storageDirectory;
        this.objectMapper = SolutionJson.createMapper();
        Files.createDirectories(storageDirectory);
    }

    @Override
    public List<Solution> loadAll() throws IOException {
        List<Path> files;
        try (Stream<Path> paths = Files.list(storageDirectory)) {
            files = paths.filter(this::isSolutionFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<Solution> solutions = new ArrayList<>();
        for (Path file : files) {
            try {
                Solution solution = objectMapper.readValue(file.toFile(), Solution.class);
                if (solution.getId() == null || solution.getId().isBlank()) {
                    log.warn("Skipping solution file without an id: {}", file.getFileName());
                    continue;
                }
                if (solution.getCategory() == null || solution.getTechStack() == null) {
                    log.warn("Skipping solution file without a category or tech stack: {}", file.getFileName());
                    continue;
                }
                if (solution.getMetrics() == null) {
                    solution.setMetrics(SolutionMetrics.empty());
                }
                if (solution.getQualityTier() == null) {
                    solution.setQualityTier(QualityTier.fromScore(solution.getOverallScore()));
                }
                solutions.add(solution);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable solution file {}: {}", file.getFileName(), e.getMessage());
            }
        }

        solutions.sort(Comparator.comparing(Solution::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Solution::getId));

        log.info("Loaded {} solutions from {}", solutions.size(), storageDirectory);
        return solutions;
    }

    @Override
    public void save(Solution solution) throws IOException {
        Path file = solutionFile(solution.getId());
        objectMapper.writeValue(file.toFile(), solution);
        log.debug("Saved solution {} to {}", solution.getId(), file);
    }

    @Override
    public void delete(String solutionId) throws IOException {
        Files.deleteIfExists(solutionFile(solutionId));
    }

    @Override
    public List<String> loadFavorites() throws IOException {
        Path file = storageDirectory.resolve(FAVORITES_FILE);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        return objectMapper.readValue(file.toFile(), new TypeReference<List<String>>() {
        });
    }

    @Override
    public void saveFavorites(List<String> favoriteIds) throws IOException {
        objectMapper.writeValue(storageDirectory.resolve(FAVORITES_FILE).toFile(), favoriteIds);
    }

    private Path solutionFile(String solutionId) {
        return storageDirectory.resolve(solutionId + JSON_EXTENSION);
    }

    private boolean isSolutionFile(Path path) {
        String fileName = path.getFileName().toString();
        return Files.isRegularFile(path)
                && fileName.endsWith(JSON_EXTENSION)
                && !fileName.equals(FAVORITES_FILE)
                && !fileName.equals(BehaviorLogFile.DEFAULT_FILE_NAME);
    }
}
