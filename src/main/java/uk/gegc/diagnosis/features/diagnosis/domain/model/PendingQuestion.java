package uk.gegc.diagnosis.features.diagnosis.domain.model;

/**
 * Item served to the learner and not yet answered.
 */
public record PendingQuestion(
        int questionIndex,
        String questionId,
        String knowledgePointId,
        int difficulty,
        int suggestedDifficulty,
        String content,
        String questionType
) {
}
