package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

import java.util.List;

public record LearningPathStep(
        int step,
        String knowledgePointId,
        String knowledgePointName,
        double currentMastery,
        double targetMastery,
        double estimatedHours,
        PracticeStrategy practiceStrategy,
        List<String> prerequisites
) {
}
