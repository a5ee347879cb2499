package uk.gegc.diagnosis.features.ability.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.diagnosis.BaseUnitTest;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.AbilityEstimate;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.ConfidenceInterval;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.ScoredResponse;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DifficultyWeightedAbilityEstimator Tests")
class DifficultyWeightedAbilityEstimatorTest extends BaseUnitTest {

    private final DifficultyWeightedAbilityEstimator estimator = new DifficultyWeightedAbilityEstimator();

    @Test
    @DisplayName("incrementalUpdate moves by 0.1 in the direction of the answer")
    void incrementalUpdate_stepsByTenth() {
        assertThat(estimator.incrementalUpdate(0.0, true)).isCloseTo(0.1, within(1e-9));
        assertThat(estimator.incrementalUpdate(0.0, false)).isCloseTo(-0.1, within(1e-9));
    }

    @Test
    @DisplayName("incrementalUpdate clamps at both ends of the scale")
    void incrementalUpdate_clamps() {
        assertThat(estimator.incrementalUpdate(3.0, true)).isEqualTo(3.0);
        assertThat(estimator.incrementalUpdate(-3.0, false)).isEqualTo(-3.0);
        assertThat(estimator.incrementalUpdate(2.95, true)).isEqualTo(3.0);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1})
    @DisplayName("incrementalStandardError is 1 with at most one answer")
    void incrementalStandardError_floorsAtOneAnswer(int answered) {
        assertThat(estimator.incrementalStandardError(answered)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("incrementalStandardError shrinks with the square root of the answer count")
    void incrementalStandardError_sqrt() {
        assertThat(estimator.incrementalStandardError(4)).isCloseTo(0.5, within(1e-9));
        assertThat(estimator.incrementalStandardError(25)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("estimate: ten correct answers at difficulty 5 reach the top of the scale")
    void estimate_allCorrectAtTopDifficulty() {
        List<ScoredResponse> responses = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            responses.add(new ScoredResponse(5, true));
        }

        AbilityEstimate estimate = estimator.estimate(responses);

        assertThat(estimate.ability()).isCloseTo(3.0, within(1e-9));
        assertThat(estimate.standardError()).isCloseTo(0.316, within(0.001));
        assertThat(estimate.confidenceInterval().lower()).isCloseTo(2.38, within(0.01));
        assertThat(estimate.confidenceInterval().upper()).isEqualTo(3.0);
        assertThat(estimate.confidenceInterval().level()).isEqualTo(0.95);
        assertThat(estimate.responseCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("estimate: all wrong answers clamp to the bottom of the scale")
    void estimate_allWrong() {
        AbilityEstimate estimate = estimator.estimate(List.of(
                new ScoredResponse(1, false),
                new ScoredResponse(3, false)
        ));

        assertThat(estimate.ability()).isEqualTo(-3.0);
        assertThat(estimate.confidenceInterval().lower()).isEqualTo(-3.0);
    }

    @Test
    @DisplayName("estimate: harder correct answers weigh more")
    void estimate_weightsByDifficulty() {
        // weighted score 4*4 = 16, total weight 2 + 4 = 6 -> (16/6 - 2.5) * 1.2 = 0.2
        AbilityEstimate estimate = estimator.estimate(List.of(
                new ScoredResponse(2, false),
                new ScoredResponse(4, true)
        ));

        assertThat(estimate.ability()).isCloseTo(0.2, within(1e-9));
        assertThat(estimate.standardError()).isCloseTo(1.0 / Math.sqrt(2), within(1e-9));
    }

    @Test
    @DisplayName("estimate: no responses yields ability 0")
    void estimate_empty() {
        AbilityEstimate estimate = estimator.estimate(List.of());

        assertThat(estimate.ability()).isEqualTo(0.0);
        assertThat(estimate.standardError()).isEqualTo(1.0);
        assertThat(estimate.confidenceInterval().lower()).isCloseTo(-1.96, within(1e-9));
        assertThat(estimate.confidenceInterval().upper()).isCloseTo(1.96, within(1e-9));
        assertThat(estimate.responseCount()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 1.0, -1.96, 1.96",
            "1.0, 0.5, 0.02, 1.98",
            "2.9, 0.5, 1.92, 3.0",
            "-2.5, 1.0, -3.0, -0.54"
    })
    @DisplayName("confidenceInterval spans 1.96 standard errors and stays on the scale")
    void confidenceInterval_clampedToScale(double ability, double standardError, double lower, double upper) {
        ConfidenceInterval interval = estimator.confidenceInterval(ability, standardError);

        assertThat(interval.lower()).isCloseTo(lower, within(1e-9));
        assertThat(interval.upper()).isCloseTo(upper, within(1e-9));
        assertThat(interval.level()).isEqualTo(0.95);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -1})
    @DisplayName("ScoredResponse rejects difficulties outside 1..5")
    void scoredResponse_rejectsOutOfRange(int difficulty) {
        assertThatThrownBy(() -> new ScoredResponse(difficulty, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 5");
    }
}
