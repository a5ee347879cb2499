package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

import java.util.List;

public record ResponsePatternAnalysis(
        int totalQuestions,
        int correctAnswers,
        double accuracy,
        double averageTimeSeconds,
        List<Integer> difficultyProgression,
        List<Double> abilityTrajectory,
        double consistencyScore,
        Trend trend,
        double efficiency
) {

    public enum Trend {
        IMPROVING,
        STABLE,
        DECLINING
    }
}
