package uk.gegc.diagnosis.features.diagnosis.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.diagnosis.features.diagnosis.api.dto.*;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis;

import java.util.List;
import java.util.UUID;

/**
 * Adaptive diagnosis operations. Every method acts on behalf of {@code userId} and
 * refuses access to reports and sessions that user does not own.
 */
public interface DiagnosisService {

    DiagnosisReportDto createReport(String userId, CreateReportRequest request);

    DiagnosisReportDto getReport(String userId, UUID reportId);

    Page<ReportSummaryDto> listReports(String userId, String subjectId, Pageable pageable);

    /**
     * Creates a session in the report and starts it. The report moves to IN_PROGRESS on its first session.
     */
    DiagnosisSessionDto startSession(String userId, UUID reportId, StartSessionRequest request);

    /**
     * Returns the pending question, selects a new one, or reports the session as finished.
     * Finishing because of the stopping rule or an exhausted pool ends the session.
     */
    NextQuestionDto nextQuestion(String userId, UUID sessionId);

    AnswerResultDto submitAnswer(String userId, UUID sessionId, AnswerSubmissionRequest request);

    DiagnosisSessionDto endSession(String userId, UUID sessionId);

    DiagnosisSessionDto cancelSession(String userId, UUID sessionId);

    DiagnosisSessionDto getSession(String userId, UUID sessionId);

    AbilityEstimateDto getAbilityEstimate(String userId, UUID sessionId);

    ResponsePatternAnalysis analyzeSession(String userId, UUID sessionId);

    /**
     * Synthesizes all responses of the report and writes its aggregates and weakness points.
     */
    DiagnosisReportDto completeReport(String userId, UUID reportId);

    HeatmapData getHeatmap(String userId, UUID reportId);

    List<LearningPathStep> getLearningPath(String userId, UUID reportId);

    WeaknessAnalysisDto getWeaknessAnalysis(String userId, UUID reportId);

    DiagnosisStatisticsDto getStatistics(String userId, String subjectId);
}
