package uk.gegc.diagnosis.features.diagnosis.domain.model;

import java.time.Instant;

public record SelectionLogEntry(
        int questionIndex,
        int suggestedDifficulty,
        int actualDifficulty,
        String knowledgePointId,
        String questionId,
        Instant selectedAt
) {
}
