package org.carball.motif.versioning;

import lombok.extern.slf4j.Slf4j;
import org.carball.motif.model.Solution;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the ordered version history of each solution lineage, keyed by the id
 * of the solution the versions were branched from.
 */
@Slf4j
public class SolutionVersionManager {

    private static final String FALLBACK_VERSION = "1.0.1";

    private final Map<String, List<VersionEntry>> versionHistory = new HashMap<>();
    private final Clock clock;

    public SolutionVersionManager() {
        this(Clock.systemDefaultZone());
    }

    public SolutionVersionManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Branches the solution into a new version of its lineage and returns the
     * assigned version string.
     */
    public String createVersion(Solution solution, String changesDescription) {
        List<VersionEntry> lineage = versionHistory.computeIfAbsent(solution.getId(), id -> new ArrayList<>());

        String newVersion = lineage.isEmpty()
                ? Solution.INITIAL_VERSION
                : incrementVersion(lineage.get(lineage.size() - 1).version());

        LocalDateTime now = LocalDateTime.now(clock);
        Solution snapshot = solution.branch(now);
        snapshot.setVersion(newVersion);
        snapshot.setParentSolutionId(solution.getId());
        solution.getChildSolutionIds().add(snapshot.getId());

        lineage.add(new VersionEntry(newVersion, changesDescription == null ? "" : changesDescription, now, snapshot));

        log.info("Created version {} of solution {} ({})", newVersion, solution.getId(), snapshot.getId());
        return newVersion;
    }

    /**
     * Bumps the patch component; anything that is not {@code major.minor.patch}
     * falls back to {@value #FALLBACK_VERSION}.
     */
    public String incrementVersion(String version) {
        if (version == null) {
            return FALLBACK_VERSION;
        }

        String[] parts = version.split("\\.");
        if (parts.length != 3) {
            log.debug("Malformed version '{}', falling back to {}", version, FALLBACK_VERSION);
            return FALLBACK_VERSION;
        }

        try {
            int major = Integer.parseInt(parts[0].trim());
            int minor = Integer.parseInt(parts[1].trim());
            int patch = Integer.parseInt(parts[2].trim());
            return major + "." + minor + "." + (patch + 1);
        } catch (NumberFormatException e) {
            log.debug("Malformed version '{}', falling back to {}", version, FALLBACK_VERSION);
            return FALLBACK_VERSION;
        }
    }

    public List<VersionEntry> getVersionHistory(String solutionId) {
        List<VersionEntry> lineage = versionHistory.get(solutionId);
        if (lineage == null) {
            return Collections.emptyList();
        }

        List<VersionEntry> copies = new ArrayList<>(lineage.size());
        for (VersionEntry entry : lineage) {
            copies.add(entry.copy());
        }
        return Collections.unmodifiableList(copies);
    }

    public Optional<String> getLatestVersion(String solutionId) {
        List<VersionEntry> lineage = versionHistory.get(solutionId);
        if (lineage == null || lineage.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(lineage.get(lineage.size() - 1).version());
    }

    /**
     * Returns a fresh branch of the requested historical version, or empty when
     * the lineage or the version does not exist.
     */
    public Optional<Solution> rollbackToVersion(String solutionId, String version) {
        List<VersionEntry> lineage = versionHistory.getOrDefault(solutionId, Collections.emptyList());

        for (VersionEntry entry : lineage) {
            if (entry.version().equals(version)) {
                Solution restored = entry.snapshot().branch(LocalDateTime.now(clock));
                log.info("Rolled back solution {} to version {} as {}", solutionId, version, restored.getId());
                return Optional.of(restored);
            }
        }

        log.debug("No version {} recorded for solution {}", version, solutionId);
        return Optional.empty();
    }
}
