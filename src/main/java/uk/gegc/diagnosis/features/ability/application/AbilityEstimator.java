package uk.gegc.diagnosis.features.ability.application;

import java.util.List;

/**
 * Latent ability estimation on the [-3, 3] scale.
 * <p>
 * The incremental mode is applied after every answer inside a session; the batch
 * mode recomputes the estimate from a full response history at report completion.
 */
public interface AbilityEstimator {

    double MIN_ABILITY = -3.0;
    double MAX_ABILITY = 3.0;

    double incrementalUpdate(double currentAbility, boolean correct);

    double incrementalStandardError(int questionsAnswered);

    AbilityEstimate estimate(List<ScoredResponse> responses);

    /**
     * 95% interval around an estimate, clamped to the ability scale.
     */
    ConfidenceInterval confidenceInterval(double ability, double standardError);

    record ScoredResponse(int difficulty, boolean correct) {
        public ScoredResponse {
            if (difficulty < 1 || difficulty > 5) {
                throw new IllegalArgumentException("Difficulty must be between 1 and 5, got " + difficulty);
            }
        }
    }

    record ConfidenceInterval(double lower, double upper, double level) {
    }

    record AbilityEstimate(
            double ability,
            double standardError,
            ConfidenceInterval confidenceInterval,
            int responseCount
    ) {
    }
}
