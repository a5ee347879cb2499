package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.RankedKnowledgePoint;

import java.util.List;
import java.util.UUID;

@Schema(name = "WeaknessAnalysisDto", description = "Weak points of a completed report with rankings and the remediation path")
public record WeaknessAnalysisDto(
        UUID reportId,
        List<WeaknessPointDto> weaknessPoints,
        List<RankedKnowledgePoint> topWeaknesses,
        List<RankedKnowledgePoint> topStrengths,
        List<LearningPathStep> learningPath,
        double totalImprovementHours
) {
}
