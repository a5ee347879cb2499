package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

import java.util.Map;

/**
 * Per-knowledge-point mastery derived from all responses of a report.
 *
 * @param masteryScore percentage of correct answers, 0..100
 * @param errorTypes   tally of recorded error types on incorrect answers
 * @param priority     improvement priority 1 (most urgent) .. 5
 */
public record MasteryLevel(
        String knowledgePointId,
        String knowledgePointName,
        double masteryScore,
        int totalQuestions,
        int correctAnswers,
        double accuracy,
        double averageDifficulty,
        long totalTimeSeconds,
        double averageTimeSeconds,
        double errorRate,
        Map<String, Integer> errorTypes,
        int priority
) {
}
