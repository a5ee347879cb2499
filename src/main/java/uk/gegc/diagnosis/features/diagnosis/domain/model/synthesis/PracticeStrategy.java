package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

public enum PracticeStrategy {
    FOUNDATION_BUILDING,
    SKILL_DEVELOPMENT,
    MASTERY_REFINEMENT;

    public static PracticeStrategy forMastery(double masteryScore) {
        if (masteryScore < 30) {
            return FOUNDATION_BUILDING;
        }
        if (masteryScore < 60) {
            return SKILL_DEVELOPMENT;
        }
        return MASTERY_REFINEMENT;
    }
}
