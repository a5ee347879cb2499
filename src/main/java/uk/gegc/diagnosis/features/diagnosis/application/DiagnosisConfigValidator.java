package uk.gegc.diagnosis.features.diagnosis.application;

import org.springframework.stereotype.Component;
import uk.gegc.diagnosis.shared.exception.DiagnosisConfigurationException;

/**
 * Rejects report and session settings that could not produce a valid run.
 */
@Component
public class DiagnosisConfigValidator {

    public void validateReport(int plannedQuestions, int timeLimitMinutes, int minDifficulty, int maxDifficulty) {
        if (plannedQuestions < 1) {
            throw new DiagnosisConfigurationException("plannedQuestions", "Planned question count must be at least 1");
        }
        if (timeLimitMinutes < 1) {
            throw new DiagnosisConfigurationException("timeLimitMinutes", "Time limit must be at least 1 minute");
        }
        if (minDifficulty < 1 || maxDifficulty > 5) {
            throw new DiagnosisConfigurationException("difficultyRange", "Difficulty bounds must lie within 1..5");
        }
        if (minDifficulty > maxDifficulty) {
            throw new DiagnosisConfigurationException("difficultyRange",
                    "Minimum difficulty " + minDifficulty + " exceeds maximum difficulty " + maxDifficulty);
        }
    }

    public void validateSession(int minQuestions, int maxQuestions, double targetPrecision) {
        if (minQuestions < 1) {
            throw new DiagnosisConfigurationException("minQuestions", "Minimum question count must be at least 1");
        }
        if (maxQuestions < minQuestions) {
            throw new DiagnosisConfigurationException("maxQuestions",
                    "Maximum question count " + maxQuestions + " is below minimum " + minQuestions);
        }
        if (!(targetPrecision > 0.0) || Double.isInfinite(targetPrecision)) {
            throw new DiagnosisConfigurationException("targetPrecision", "Target precision must be a positive number");
        }
    }
}
