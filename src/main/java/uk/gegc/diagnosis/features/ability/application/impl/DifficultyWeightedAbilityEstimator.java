package uk.gegc.diagnosis.features.ability.application.impl;

import uk.gegc.diagnosis.features.ability.application.AbilityEstimator;

import java.util.List;

public class DifficultyWeightedAbilityEstimator implements AbilityEstimator {

    private static final double STEP = 0.1;
    private static final double CENTER = 2.5;
    private static final double SCALE = 1.2;
    private static final double Z_95 = 1.96;
    private static final double CONFIDENCE_LEVEL = 0.95;

    @Override
    public double incrementalUpdate(double currentAbility, boolean correct) {
        return clamp(currentAbility + (correct ? STEP : -STEP));
    }

    @Override
    public double incrementalStandardError(int questionsAnswered) {
        return 1.0 / Math.sqrt(Math.max(1, questionsAnswered));
    }

    @Override
    public AbilityEstimate estimate(List<ScoredResponse> responses) {
        double weightedScore = 0.0;
        double totalWeight = 0.0;
        for (ScoredResponse response : responses) {
            double weight = response.difficulty();
            if (response.correct()) {
                weightedScore += weight * response.difficulty();
            }
            totalWeight += weight;
        }

        double ability = totalWeight == 0.0
                ? 0.0
                : clamp((weightedScore / totalWeight - CENTER) * SCALE);
        double standardError = incrementalStandardError(responses.size());
        return new AbilityEstimate(ability, standardError, confidenceInterval(ability, standardError), responses.size());
    }

    @Override
    public ConfidenceInterval confidenceInterval(double ability, double standardError) {
        return new ConfidenceInterval(
                clamp(ability - Z_95 * standardError),
                clamp(ability + Z_95 * standardError),
                CONFIDENCE_LEVEL
        );
    }

    private static double clamp(double value) {
        return Math.max(MIN_ABILITY, Math.min(MAX_ABILITY, value));
    }
}
