package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

import java.util.List;

public record DiagnosisAnalysis(
        OverallAssessment overallAssessment,
        LearningStyle learningStyle,
        List<String> commonErrors
) {

    public enum OverallAssessment {
        EXCELLENT,
        GOOD,
        FAIR,
        NEEDS_IMPROVEMENT
    }

    public enum Pace {
        FAST,
        MODERATE,
        SLOW
    }

    public enum DifficultyPreference {
        LOW,
        MEDIUM,
        HIGH
    }

    public record LearningStyle(Pace pace, DifficultyPreference difficultyPreference) {
    }
}
