package org.carball.motif.persistence;

import org.carball.motif.model.Solution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps persisted copies in memory. Saved solutions are duplicated so later
 * in-memory edits are only visible after another {@link #save(Solution)}.
 */
public class InMemorySolutionStore implements SolutionStore {

    private final Map<String, Solution> records = new LinkedHashMap<>();
    private final List<String> favorites = new ArrayList<>();

    @Override
    public List<Solution> loadAll() {
        List<Solution> solutions = new ArrayList<>(records.size());
        for (Solution solution : records.values()) {
            solutions.add(solution.duplicate());
        }
        return solutions;
    }

    @Override
    public void save(Solution solution) {
        records.put(solution.getId(), solution.duplicate());
    }

    @Override
    public void delete(String solutionId) {
        records.remove(solutionId);
    }

    @Override
    public List<String> loadFavorites() {
        return new ArrayList<>(favorites);
    }

    @Override
    public void saveFavorites(List<String> favoriteIds) {
        favorites.clear();
        favorites.addAll(favoriteIds);
    }

    public int size() {
        return records.size();
    }
}
