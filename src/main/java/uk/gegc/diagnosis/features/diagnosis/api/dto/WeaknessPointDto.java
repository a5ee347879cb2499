package uk.gegc.diagnosis.features.diagnosis.api.dto;

import java.util.Map;
import java.util.UUID;

public record WeaknessPointDto(
        UUID id,
        String knowledgePointId,
        String knowledgePointName,
        int weaknessLevel,
        double masteryScore,
        double accuracy,
        double averageTimeSeconds,
        Map<String, Integer> errorTypes,
        int improvementPriority,
        double estimatedImprovementHours
) {
}
