package org.carball.motif.versioning;

import org.carball.motif.MutableClock;
import org.carball.motif.TestSolutions;
import org.carball.motif.model.Solution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionVersionManagerTest {

    private MutableClock clock;
    private SolutionVersionManager versionManager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(TestSolutions.NOW);
        versionManager = new SolutionVersionManager(clock);
    }

    @Test
    void shouldAssignSuccessivePatchVersions() {
        // Given
        Solution solution = TestSolutions.solution("Slide").build();

        // When
        String first = versionManager.createVersion(solution, "initial");
        String second = versionManager.createVersion(solution, "slower");
        String third = versionManager.createVersion(solution, "bouncier");

        // Then
        assertThat(List.of(first, second, third)).containsExactly("1.0.0", "1.0.1", "1.0.2");
        assertThat(versionManager.getLatestVersion(solution.getId())).contains("1.0.2");
        assertThat(versionManager.getVersionHistory(solution.getId()))
                .extracting(VersionEntry::changesDescription)
                .containsExactly("initial", "slower", "bouncier");
    }

    @Test
    void shouldLinkBranchesToTheirSource() {
        // Given
        Solution solution = TestSolutions.solution("Slide").build();

        // When
        versionManager.createVersion(solution, "initial");

        // Then
        VersionEntry entry = versionManager.getVersionHistory(solution.getId()).get(0);
        assertThat(entry.snapshot().getId()).isNotEqualTo(solution.getId());
        assertThat(entry.snapshot().getParentSolutionId()).isEqualTo(solution.getId());
        assertThat(solution.getChildSolutionIds()).containsExactly(entry.snapshot().getId());
        assertThat(solution.getVersion()).isEqualTo("1.0.0");
    }

    @Test
    void shouldRollbackToFreshCloneOfHistoricalContent() {
        // Given
        Solution solution = TestSolutions.solution("Slide").build();
        versionManager.createVersion(solution, "initial");
        solution.setCssCode(".a { animation-duration: 2s; }");
        versionManager.createVersion(solution, "slower");
        solution.setCssCode(".a { animation-duration: 3s; }");
        versionManager.createVersion(solution, "even slower");
        clock.advance(Duration.ofHours(2));

        // When
        Optional<Solution> restored = versionManager.rollbackToVersion(solution.getId(), "1.0.1");

        // Then
        assertThat(restored).isPresent();
        assertThat(restored.get().getCssCode()).isEqualTo(".a { animation-duration: 2s; }");
        assertThat(restored.get().getVersion()).isEqualTo("1.0.1");
        assertThat(restored.get().getId()).isNotEqualTo(solution.getId());
        assertThat(restored.get().getCreatedAt()).isEqualTo(clock.now());

        VersionEntry second = versionManager.getVersionHistory(solution.getId()).get(1);
        assertThat(restored.get().getId()).isNotEqualTo(second.snapshot().getId());
    }

    @Test
    void shouldReturnEmptyForUnknownVersionOrLineage() {
        // Given
        Solution solution = TestSolutions.solution("Slide").build();
        versionManager.createVersion(solution, "initial");

        // Then
        assertThat(versionManager.rollbackToVersion(solution.getId(), "9.9.9")).isEmpty();
        assertThat(versionManager.rollbackToVersion("missing", "1.0.0")).isEmpty();
        assertThat(versionManager.getVersionHistory("missing")).isEmpty();
        assertThat(versionManager.getLatestVersion("missing")).isEmpty();
    }

    @Test
    void shouldProtectHistoryFromCallerMutation() {
        // Given
        Solution solution = TestSolutions.solution("Slide").build();
        versionManager.createVersion(solution, "initial");

        // When
        versionManager.getVersionHistory(solution.getId()).get(0).snapshot().setName("Tampered");

        // Then
        assertThat(versionManager.getVersionHistory(solution.getId()).get(0).snapshot().getName())
                .isEqualTo("Slide");
    }

    @Test
    void shouldIncrementPatchAndFallBackOnMalformedInput() {
        assertThat(versionManager.incrementVersion("2.3.9")).isEqualTo("2.3.10");
        assertThat(versionManager.incrementVersion("1.0")).isEqualTo("1.0.1");
        assertThat(versionManager.incrementVersion("a.b.c")).isEqualTo("1.0.1");
        assertThat(versionManager.incrementVersion(null)).isEqualTo("1.0.1");
    }
}
