package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisStatus;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisType;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.MasteryLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.RankedKnowledgePoint;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.Recommendation;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Schema(name = "DiagnosisReportDto", description = "Full diagnostic report. Aggregates are null until completion.")
public record DiagnosisReportDto(
        UUID id,
        String userId,
        String subjectId,
        String name,
        String description,
        DiagnosisType diagnosisType,
        DiagnosisLevel targetLevel,
        List<String> knowledgePointIds,
        int plannedQuestions,
        int timeLimitMinutes,
        int minDifficulty,
        int maxDifficulty,
        boolean adaptiveEnabled,
        DiagnosisStatus status,
        List<DiagnosisSessionDto> sessions,
        Integer totalQuestions,
        Integer correctAnswers,
        Long totalTimeSeconds,
        Double averageTimeSeconds,
        Double accuracy,
        Integer overallScore,
        Double finalAbility,
        Double abilityStandardError,
        Double confidenceLower,
        Double confidenceUpper,
        Map<String, MasteryLevel> masteryMap,
        HeatmapData heatmap,
        List<RankedKnowledgePoint> weaknesses,
        List<RankedKnowledgePoint> strengths,
        List<LearningPathStep> learningPath,
        DiagnosisAnalysis analysis,
        List<Recommendation> recommendations,
        Instant createdAt,
        Instant completedAt
) {
}
