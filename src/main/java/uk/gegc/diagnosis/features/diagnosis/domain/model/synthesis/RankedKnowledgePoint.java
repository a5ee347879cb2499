package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

public record RankedKnowledgePoint(
        int rank,
        String knowledgePointId,
        String knowledgePointName,
        double masteryScore,
        int priority
) {
}
