package uk.gegc.diagnosis.features.diagnosis.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.diagnosis.features.diagnosis.api.dto.*;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisReport;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisSession;
import uk.gegc.diagnosis.features.diagnosis.domain.model.PendingQuestion;
import uk.gegc.diagnosis.features.diagnosis.domain.model.WeaknessPoint;

import java.util.List;

@Component
public class DiagnosisMapper {

    public DiagnosisReportDto toDto(DiagnosisReport report) {
        List<DiagnosisSessionDto> sessions = report.getSessions().stream()
                .map(this::toDto)
                .toList();

        return new DiagnosisReportDto(
                report.getId(),
                report.getUserId(),
                report.getSubjectId(),
                report.getName(),
                report.getDescription(),
                report.getDiagnosisType(),
                report.getTargetLevel(),
                List.copyOf(report.getKnowledgePointFilter()),
                report.getPlannedQuestions(),
                report.getTimeLimitMinutes(),
                report.getDifficultyRange().getMin(),
                report.getDifficultyRange().getMax(),
                report.isAdaptiveEnabled(),
                report.getStatus(),
                sessions,
                report.getTotalQuestions(),
                report.getCorrectAnswers(),
                report.getTotalTimeSeconds(),
                report.getAverageTimeSeconds(),
                report.getAccuracy(),
                report.getOverallScore(),
                report.getFinalAbility(),
                report.getAbilityStandardError(),
                report.getConfidenceLower(),
                report.getConfidenceUpper(),
                report.getMasteryMap(),
                report.getHeatmap(),
                report.getWeaknesses(),
                report.getStrengths(),
                report.getLearningPath(),
                report.getAnalysis(),
                report.getRecommendations(),
                report.getCreatedAt(),
                report.getCompletedAt()
        );
    }

    public ReportSummaryDto toSummaryDto(DiagnosisReport report) {
        return new ReportSummaryDto(
                report.getId(),
                report.getSubjectId(),
                report.getName(),
                report.getDiagnosisType(),
                report.getStatus(),
                report.getOverallScore(),
                report.getFinalAbility(),
                report.getCreatedAt(),
                report.getCompletedAt()
        );
    }

    public DiagnosisSessionDto toDto(DiagnosisSession session) {
        return new DiagnosisSessionDto(
                session.getId(),
                session.getReport().getId(),
                session.getName(),
                session.getLevel(),
                session.getStatus(),
                session.getMinQuestions(),
                session.getMaxQuestions(),
                session.getTargetPrecision(),
                session.getCurrentAbility(),
                session.getAbilityStandardError(),
                session.getQuestionsAnswered(),
                session.getCorrectAnswers(),
                session.getCurrentQuestionIndex(),
                session.getTotalTimeSeconds(),
                session.getAccuracyRate(),
                session.getStartedAt(),
                session.getEndedAt()
        );
    }

    public QuestionForDiagnosisDto toQuestionDto(PendingQuestion pending) {
        return new QuestionForDiagnosisDto(
                pending.questionIndex(),
                pending.questionId(),
                pending.knowledgePointId(),
                pending.difficulty(),
                pending.suggestedDifficulty(),
                pending.content(),
                pending.questionType()
        );
    }

    public WeaknessPointDto toDto(WeaknessPoint weaknessPoint) {
        return new WeaknessPointDto(
                weaknessPoint.getId(),
                weaknessPoint.getKnowledgePointId(),
                weaknessPoint.getKnowledgePointName(),
                weaknessPoint.getWeaknessLevel(),
                weaknessPoint.getMasteryScore(),
                weaknessPoint.getAccuracy(),
                weaknessPoint.getAverageTimeSeconds(),
                weaknessPoint.getErrorTypes(),
                weaknessPoint.getImprovementPriority(),
                weaknessPoint.getEstimatedImprovementHours()
        );
    }
}
