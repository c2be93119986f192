package org.carball.motif.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.motif.TestSolutions;
import org.carball.motif.persistence.SolutionJson;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SolutionTest {

    private static final LocalDateTime LATER = TestSolutions.NOW.plusHours(1);

    @Test
    void shouldKeepRunningMeanOfRatings() {
        // Given
        Solution solution = TestSolutions.solution("Fade In").build();

        // When
        solution.addUserRating(5.0, LATER);
        solution.addUserRating(3.0, LATER);
        solution.addUserRating(4.0, LATER);

        // Then
        assertThat(solution.getRatingCount()).isEqualTo(3);
        assertThat(solution.getUserRating()).isCloseTo(4.0, within(1e-9));
        assertThat(solution.getUpdatedAt()).isEqualTo(LATER);
        assertThat(solution.isRated()).isTrue();
    }

    @Test
    void shouldRejectOutOfRangeRatingWithoutTouchingCounters() {
        // Given
        Solution solution = TestSolutions.solution("Fade In").build();
        solution.addUserRating(4.0, LATER);

        // When / Then
        assertThatThrownBy(() -> solution.addUserRating(5.5, LATER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0 and 5");
        assertThatThrownBy(() -> solution.addUserRating(-0.1, LATER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> solution.addUserRating(Double.NaN, LATER))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(solution.getRatingCount()).isEqualTo(1);
        assertThat(solution.getUserRating()).isEqualTo(4.0);
    }

    @Test
    void shouldAcceptBoundaryRatings() {
        // Given
        Solution solution = TestSolutions.solution("Fade In").build();

        // When
        solution.addUserRating(0.0, LATER);
        solution.addUserRating(5.0, LATER);

        // Then
        assertThat(solution.getUserRating()).isEqualTo(2.5);
    }

    @Test
    void shouldNotDecrementFavoritesBelowZero() {
        // Given
        Solution solution = TestSolutions.solution("Fade In").build();
        solution.incrementFavorites(LATER);

        // When
        solution.decrementFavorites(LATER);
        solution.decrementFavorites(LATER);

        // Then
        assertThat(solution.getFavoriteCount()).isZero();
    }

    @Test
    void shouldBranchUnderNewIdentityWithIndependentCollections() {
        // Given
        Solution original = TestSolutions.solution("Fade In").build();
        original.addTag("fade");

        // When
        Solution branch = original.branch(LATER);
        branch.addTag("entrance");

        // Then
        assertThat(branch.getId()).isNotEqualTo(original.getId());
        assertThat(branch.getCreatedAt()).isEqualTo(LATER);
        assertThat(branch.getCssCode()).isEqualTo(original.getCssCode());
        assertThat(original.getTags()).containsExactly("fade");
        assertThat(branch.getTags()).containsExactlyInAnyOrder("fade", "entrance");
    }

    @Test
    void shouldDuplicateKeepingIdentity() {
        // Given
        Solution original = TestSolutions.solution("Fade In").build();

        // When
        Solution copy = original.duplicate();
        copy.setName("Changed");

        // Then
        assertThat(copy).isEqualTo(original);
        assertThat(copy).isNotSameAs(original);
        assertThat(original.getName()).isEqualTo("Fade In");
    }

    @Test
    void shouldDefaultCodeBlobsToEmpty() {
        // When
        Solution solution = Solution.builder().htmlCode(null).build();

        // Then
        assertThat(solution.getHtmlCode()).isEmpty();
        assertThat(solution.getCssCode()).isEmpty();
        assertThat(solution.getJsCode()).isEmpty();
        assertThat(solution.getVersion()).isEqualTo("1.0.0");
        assertThat(solution.getId()).isNotBlank();
    }

    @Test
    void shouldApplyMetricsAndDeriveTier() {
        // Given
        Solution solution = TestSolutions.solution("Fade In").build();

        // When
        solution.applyMetrics(new SolutionMetrics(90, 90, 90, 90, 90));

        // Then
        assertThat(solution.getQualityTier()).isEqualTo(QualityTier.EXCELLENT);
        assertThat(solution.getOverallScore()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    void shouldExposeNoSettersForRatingAndCounters() {
        // When
        List<String> methods = Arrays.stream(Solution.class.getMethods())
                .map(Method::getName)
                .collect(Collectors.toList());

        // Then
        assertThat(methods)
                .doesNotContain("setUserRating", "setRatingCount", "setFavoriteCount", "setUsageCount")
                .contains("addUserRating", "incrementUsage", "setName");
    }

    @Test
    void shouldKeepCountersWhenDeserialized() throws Exception {
        // Given
        ObjectMapper mapper = SolutionJson.createMapper();
        Solution solution = TestSolutions.solution("Rated").build();
        solution.addUserRating(3.0, TestSolutions.NOW);
        solution.addUserRating(5.0, TestSolutions.NOW);
        solution.incrementUsage(TestSolutions.NOW);

        // When
        Solution copy = mapper.readValue(mapper.writeValueAsString(solution), Solution.class);

        // Then
        assertThat(copy.getUserRating()).isCloseTo(4.0, within(1e-9));
        assertThat(copy.getRatingCount()).isEqualTo(2);
        assertThat(copy.getUsageCount()).isEqualTo(1);
    }
}
