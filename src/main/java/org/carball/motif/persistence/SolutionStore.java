package org.carball.motif.persistence;

import org.carball.motif.model.Solution;

import java.io.IOException;
import java.util.List;

/**
 * Persistence boundary for the solution corpus: load everything on start,
 * write one solution at a time.
 */
public interface SolutionStore {

    /**
     * Loads every readable solution. Individually malformed records are
     * skipped rather than failing the whole load.
     */
    List<Solution> loadAll() throws IOException;

    void save(Solution solution) throws IOException;

    void delete(String solutionId) throws IOException;

    List<String> loadFavorites() throws IOException;

    void saveFavorites(List<String> favoriteIds) throws IOException;
}
