package uk.gegc.diagnosis.features.diagnosis.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.ConfidenceInterval;
import uk.gegc.diagnosis.features.diagnosis.api.dto.*;
import uk.gegc.diagnosis.features.diagnosis.application.DiagnosisConfigValidator;
import uk.gegc.diagnosis.features.diagnosis.application.DiagnosisService;
import uk.gegc.diagnosis.features.diagnosis.application.SessionStateMachine;
import uk.gegc.diagnosis.features.diagnosis.application.synthesis.ReportSynthesizer;
import uk.gegc.diagnosis.features.diagnosis.application.synthesis.ResponsePatternAnalyzer;
import uk.gegc.diagnosis.features.diagnosis.domain.model.*;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisSynthesis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.MasteryLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis;
import uk.gegc.diagnosis.features.diagnosis.domain.repository.DiagnosisReportRepository;
import uk.gegc.diagnosis.features.diagnosis.domain.repository.DiagnosisSessionRepository;
import uk.gegc.diagnosis.features.diagnosis.domain.repository.QuestionResponseRepository;
import uk.gegc.diagnosis.features.diagnosis.domain.repository.WeaknessPointRepository;
import uk.gegc.diagnosis.features.diagnosis.infra.mapping.DiagnosisMapper;
import uk.gegc.diagnosis.features.questionbank.application.KnowledgePointCatalog;
import uk.gegc.diagnosis.features.questionbank.application.KnowledgePointCatalog.KnowledgePointInfo;
import uk.gegc.diagnosis.features.questionbank.application.QuestionBank.CandidateQuestion;
import uk.gegc.diagnosis.features.selection.application.ItemSelection;
import uk.gegc.diagnosis.features.selection.application.ItemSelector;
import uk.gegc.diagnosis.features.selection.application.SelectionRequest;
import uk.gegc.diagnosis.shared.config.DiagnosisProperties;
import uk.gegc.diagnosis.shared.exception.InvalidStateTransitionException;
import uk.gegc.diagnosis.shared.exception.ReportNotCompletedException;
import uk.gegc.diagnosis.shared.exception.ResourceNotFoundException;
import uk.gegc.diagnosis.shared.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class DiagnosisServiceImpl implements DiagnosisService {

    static final String FINISH_STOPPING_RULE = "STOPPING_RULE";
    static final String FINISH_POOL_EXHAUSTED = "ITEM_POOL_EXHAUSTED";
    static final String FINISH_NOT_ACTIVE = "SESSION_NOT_ACTIVE";

    private final DiagnosisReportRepository reportRepository;
    private final DiagnosisSessionRepository sessionRepository;
    private final QuestionResponseRepository responseRepository;
    private final WeaknessPointRepository weaknessPointRepository;
    private final SessionStateMachine stateMachine;
    private final AbilityEstimator abilityEstimator;
    private final ItemSelector itemSelector;
    private final ReportSynthesizer reportSynthesizer;
    private final ResponsePatternAnalyzer patternAnalyzer;
    private final KnowledgePointCatalog knowledgePointCatalog;
    private final DiagnosisConfigValidator configValidator;
    private final DiagnosisProperties properties;
    private final DiagnosisMapper diagnosisMapper;
    private final Clock clock;

    @Override
    public DiagnosisReportDto createReport(String userId, CreateReportRequest request) {
        int planned = request.plannedQuestions() != null ? request.plannedQuestions() : properties.getDefaultPlannedQuestions();
        int timeLimit = request.timeLimitMinutes() != null ? request.timeLimitMinutes() : properties.getDefaultTimeLimitMinutes();
        int minDifficulty = request.minDifficulty() != null ? request.minDifficulty() : DifficultyRange.LOWEST;
        int maxDifficulty = request.maxDifficulty() != null ? request.maxDifficulty() : DifficultyRange.HIGHEST;
        configValidator.validateReport(planned, timeLimit, minDifficulty, maxDifficulty);

        DiagnosisReport report = new DiagnosisReport();
        report.setUserId(userId);
        report.setSubjectId(request.subjectId());
        report.setName(request.name());
        report.setDescription(request.description());
        report.setDiagnosisType(request.diagnosisType() != null ? request.diagnosisType() : DiagnosisType.COMPREHENSIVE);
        report.setTargetLevel(request.targetLevel());
        report.setKnowledgePointFilter(request.knowledgePointIds() != null
                ? new ArrayList<>(request.knowledgePointIds())
                : new ArrayList<>());
        report.setPlannedQuestions(planned);
        report.setTimeLimitMinutes(timeLimit);
        report.setDifficultyRange(new DifficultyRange(minDifficulty, maxDifficulty));
        report.setAdaptiveEnabled(request.adaptiveEnabled() == null || request.adaptiveEnabled());
        report.setStatus(DiagnosisStatus.PENDING);

        DiagnosisReport saved = reportRepository.save(report);
        log.info("Created diagnosis report {} for user {} on subject {}", saved.getId(), userId, saved.getSubjectId());
        return diagnosisMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public DiagnosisReportDto getReport(String userId, UUID reportId) {
        return diagnosisMapper.toDto(loadOwnedReport(userId, reportId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ReportSummaryDto> listReports(String userId, String subjectId, Pageable pageable) {
        Page<DiagnosisReport> page = subjectId == null || subjectId.isBlank()
                ? reportRepository.findAllByUserId(userId, pageable)
                : reportRepository.findAllByUserIdAndSubjectId(userId, subjectId, pageable);
        return page.map(diagnosisMapper::toSummaryDto);
    }

    @Override
    public DiagnosisSessionDto startSession(String userId, UUID reportId, StartSessionRequest request) {
        DiagnosisReport report = reportRepository.findByIdForUpdate(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Diagnosis report " + reportId + " not found"));
        ensureOwner(userId, report);
        if (report.getStatus() == DiagnosisStatus.COMPLETED) {
            throw new InvalidStateTransitionException(
                    report.getStatus().name(),
                    "startSession",
                    "Cannot start a session in completed report " + reportId
            );
        }

        int maxQuestions = request.maxQuestions() != null ? request.maxQuestions() : report.getPlannedQuestions();
        int minQuestions = request.minQuestions() != null
                ? request.minQuestions()
                : Math.min(properties.getDefaultMinQuestions(), maxQuestions);
        double precision = request.targetPrecision() != null
                ? request.targetPrecision()
                : properties.getDefaultTargetPrecision();
        configValidator.validateSession(minQuestions, maxQuestions, precision);

        DiagnosisSession session = new DiagnosisSession();
        session.setName(request.name() != null && !request.name().isBlank()
                ? request.name()
                : request.level().name() + " session");
        session.setLevel(request.level());
        session.setMinQuestions(minQuestions);
        session.setMaxQuestions(maxQuestions);
        session.setTargetPrecision(precision);
        report.addSession(session);

        stateMachine.start(session);
        if (report.getStatus() == DiagnosisStatus.PENDING) {
            report.setStatus(DiagnosisStatus.IN_PROGRESS);
        }

        DiagnosisSession saved = sessionRepository.save(session);
        log.info("Started {} session {} in report {} (min={}, max={})",
                saved.getLevel(), saved.getId(), reportId, minQuestions, maxQuestions);
        return diagnosisMapper.toDto(saved);
    }

    @Override
    public NextQuestionDto nextQuestion(String userId, UUID sessionId) {
        DiagnosisSession session = loadOwnedSessionForUpdate(userId, sessionId);

        if (session.getStatus() != DiagnosisStatus.IN_PROGRESS) {
            return finished(session, FINISH_NOT_ACTIVE);
        }
        if (session.getPendingQuestion() != null) {
            return serving(session, session.getPendingQuestion());
        }
        if (!stateMachine.shouldContinue(session)) {
            stateMachine.end(session);
            log.info("Session {} stopped after {} questions (ability={})",
                    sessionId, session.getQuestionsAnswered(), session.getCurrentAbility());
            return finished(session, FINISH_STOPPING_RULE);
        }

        DiagnosisReport report = session.getReport();
        Set<String> served = new LinkedHashSet<>();
        Set<String> covered = new LinkedHashSet<>();
        for (SelectionLogEntry entry : session.getSelectionLog()) {
            served.add(entry.questionId());
            covered.add(entry.knowledgePointId());
        }

        SelectionRequest selectionRequest = new SelectionRequest(
                report.getSubjectId(),
                report.getKnowledgePointFilter(),
                report.getDifficultyRange().narrowTo(session.getLevel()),
                report.isAdaptiveEnabled(),
                session.getCurrentAbility(),
                served,
                covered
        );
        ItemSelection selection = itemSelector.select(selectionRequest);

        if (selection.isExhausted()) {
            stateMachine.end(session);
            log.info("Session {} force-stopped: item pool exhausted after {} questions",
                    sessionId, session.getQuestionsAnswered());
            return finished(session, FINISH_POOL_EXHAUSTED);
        }

        CandidateQuestion chosen = selection.question();
        PendingQuestion pending = new PendingQuestion(
                session.getCurrentQuestionIndex(),
                chosen.questionId(),
                chosen.knowledgePointId(),
                chosen.difficulty(),
                selection.suggestedDifficulty(),
                chosen.content(),
                chosen.questionType()
        );
        session.appendSelection(new SelectionLogEntry(
                pending.questionIndex(),
                selection.suggestedDifficulty(),
                chosen.difficulty(),
                chosen.knowledgePointId(),
                chosen.questionId(),
                Instant.now(clock)
        ));
        session.setPendingQuestion(pending);
        return serving(session, pending);
    }

    @Override
    public AnswerResultDto submitAnswer(String userId, UUID sessionId, AnswerSubmissionRequest request) {
        DiagnosisSession session = loadOwnedSessionForUpdate(userId, sessionId);
        if (session.getStatus() != DiagnosisStatus.IN_PROGRESS) {
            throw new InvalidStateTransitionException(
                    session.getStatus().name(),
                    "submitAnswer",
                    "Cannot submit an answer to session " + sessionId + " in status " + session.getStatus()
            );
        }
        PendingQuestion pending = session.getPendingQuestion();
        if (pending == null) {
            throw new ValidationException("No question is pending in session " + sessionId);
        }
        if (!pending.questionId().equals(request.questionId())) {
            throw new ValidationException("Question " + request.questionId()
                    + " is not the pending question of session " + sessionId);
        }

        boolean correct = Boolean.TRUE.equals(request.correct());
        AbilityProgressionEntry entry = stateMachine.recordAnswer(session, correct, pending.difficulty());

        QuestionResponse response = new QuestionResponse();
        response.setSession(session);
        response.setQuestionIndex(pending.questionIndex());
        response.setQuestionId(pending.questionId());
        response.setKnowledgePointId(pending.knowledgePointId());
        response.setQuestionContent(pending.content());
        response.setQuestionType(pending.questionType());
        response.setDifficulty(pending.difficulty());
        response.setUserAnswer(request.userAnswer());
        response.setCorrectAnswer(request.correctAnswer());
        response.setCorrect(correct);
        response.setTimeSpentSeconds(request.timeSpentSeconds());
        response.setConfidenceLevel(request.confidenceLevel());
        response.setErrorType(correct ? null : request.errorType());
        response.setAnsweredAt(entry.timestamp());
        QuestionResponse saved = responseRepository.save(response);

        session.setTotalTimeSeconds(session.getTotalTimeSeconds() + request.timeSpentSeconds());
        session.setPendingQuestion(null);

        boolean shouldContinue = stateMachine.shouldContinue(session);
        return new AnswerResultDto(
                saved.getId(),
                correct,
                shouldContinue,
                session.getCurrentAbility(),
                session.getAbilityStandardError(),
                session.getQuestionsAnswered(),
                remaining(session)
        );
    }

    @Override
    public DiagnosisSessionDto endSession(String userId, UUID sessionId) {
        DiagnosisSession session = loadOwnedSessionForUpdate(userId, sessionId);
        stateMachine.end(session);
        log.info("Ended session {} with {} answers, accuracy {}",
                sessionId, session.getQuestionsAnswered(), session.getAccuracyRate());
        return diagnosisMapper.toDto(session);
    }

    @Override
    public DiagnosisSessionDto cancelSession(String userId, UUID sessionId) {
        DiagnosisSession session = loadOwnedSessionForUpdate(userId, sessionId);
        stateMachine.cancel(session);
        log.info("Cancelled session {}", sessionId);
        return diagnosisMapper.toDto(session);
    }

    @Override
    @Transactional(readOnly = true)
    public DiagnosisSessionDto getSession(String userId, UUID sessionId) {
        return diagnosisMapper.toDto(loadOwnedSession(userId, sessionId));
    }

    @Override
    @Transactional(readOnly = true)
    public AbilityEstimateDto getAbilityEstimate(String userId, UUID sessionId) {
        DiagnosisSession session = loadOwnedSession(userId, sessionId);
        double ability = session.getCurrentAbility();
        double se = session.getAbilityStandardError();
        ConfidenceInterval interval = abilityEstimator.confidenceInterval(ability, se);
        List<AbilityStepDto> steps = session.getAbilityProgression().stream()
                .map(this::toStep)
                .toList();
        return new AbilityEstimateDto(
                session.getId(),
                ability,
                se,
                interval.lower(),
                interval.upper(),
                session.getQuestionsAnswered(),
                steps
        );
    }

    private AbilityStepDto toStep(AbilityProgressionEntry entry) {
        double se = abilityEstimator.incrementalStandardError(entry.questionIndex() + 1);
        ConfidenceInterval interval = abilityEstimator.confidenceInterval(entry.newEstimate(), se);
        return new AbilityStepDto(
                entry.questionIndex(),
                entry.previousEstimate(),
                entry.newEstimate(),
                se,
                interval.lower(),
                interval.upper(),
                entry.correct(),
                entry.difficulty(),
                entry.timestamp()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public ResponsePatternAnalysis analyzeSession(String userId, UUID sessionId) {
        DiagnosisSession session = loadOwnedSession(userId, sessionId);
        return patternAnalyzer.analyze(session, responseRepository.findAllBySessionOrdered(sessionId));
    }

    @Override
    public DiagnosisReportDto completeReport(String userId, UUID reportId) {
        DiagnosisReport report = reportRepository.findByIdForUpdate(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Diagnosis report " + reportId + " not found"));
        ensureOwner(userId, report);
        if (report.getStatus() == DiagnosisStatus.COMPLETED) {
            throw new InvalidStateTransitionException(
                    report.getStatus().name(),
                    "complete",
                    "Report " + reportId + " is already completed"
            );
        }
        boolean hasActiveSession = report.getSessions().stream()
                .anyMatch(s -> s.getStatus() == DiagnosisStatus.PENDING || s.getStatus() == DiagnosisStatus.IN_PROGRESS);
        if (hasActiveSession) {
            throw new InvalidStateTransitionException(
                    report.getStatus().name(),
                    "complete",
                    "Report " + reportId + " still has an active session; end or cancel it first"
            );
        }

        List<QuestionResponse> responses = responseRepository.findAllByReportOrdered(reportId);
        Set<String> knowledgePointIds = responses.stream()
                .map(QuestionResponse::getKnowledgePointId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, KnowledgePointInfo> catalog = knowledgePointCatalog.describe(knowledgePointIds);

        DiagnosisSynthesis synthesis = reportSynthesizer.synthesize(responses, catalog);
        applySynthesis(report, synthesis);
        report.setStatus(DiagnosisStatus.COMPLETED);
        report.setCompletedAt(Instant.now(clock));

        DiagnosisReport saved = reportRepository.save(report);
        log.info("Completed diagnosis report {}: {} responses, score {}, ability {}, {} weak points",
                reportId, synthesis.totalQuestions(), synthesis.overallScore(),
                synthesis.abilityEstimate().ability(), synthesis.gaps().size());
        return diagnosisMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public HeatmapData getHeatmap(String userId, UUID reportId) {
        return loadCompletedReport(userId, reportId).getHeatmap();
    }

    @Override
    @Transactional(readOnly = true)
    public List<LearningPathStep> getLearningPath(String userId, UUID reportId) {
        return List.copyOf(loadCompletedReport(userId, reportId).getLearningPath());
    }

    @Override
    @Transactional(readOnly = true)
    public WeaknessAnalysisDto getWeaknessAnalysis(String userId, UUID reportId) {
        DiagnosisReport report = loadCompletedReport(userId, reportId);
        List<WeaknessPointDto> weaknessPoints = weaknessPointRepository
                .findAllByReport_IdOrderByImprovementPriorityAscMasteryScoreAscKnowledgePointIdAsc(reportId)
                .stream()
                .map(diagnosisMapper::toDto)
                .toList();
        double totalHours = report.getLearningPath().stream().mapToDouble(LearningPathStep::estimatedHours).sum();
        return new WeaknessAnalysisDto(
                reportId,
                weaknessPoints,
                List.copyOf(report.getWeaknesses()),
                List.copyOf(report.getStrengths()),
                List.copyOf(report.getLearningPath()),
                BigDecimal.valueOf(totalHours).setScale(1, RoundingMode.HALF_UP).doubleValue()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public DiagnosisStatisticsDto getStatistics(String userId, String subjectId) {
        boolean bySubject = subjectId != null && !subjectId.isBlank();
        long totalReports = bySubject
                ? reportRepository.countByUserIdAndSubjectId(userId, subjectId)
                : reportRepository.countByUserId(userId);
        List<DiagnosisReport> completed = bySubject
                ? reportRepository.findAllByUserIdAndSubjectIdAndStatusOrderByCompletedAtAsc(userId, subjectId, DiagnosisStatus.COMPLETED)
                : reportRepository.findAllByUserIdAndStatusOrderByCompletedAtAsc(userId, DiagnosisStatus.COMPLETED);

        List<Double> abilityHistory = completed.stream()
                .map(DiagnosisReport::getFinalAbility)
                .filter(Objects::nonNull)
                .toList();
        Double averageScore = averageOrNull(completed.stream()
                .map(DiagnosisReport::getOverallScore)
                .filter(Objects::nonNull)
                .mapToDouble(Integer::doubleValue));
        Double averageAbility = averageOrNull(abilityHistory.stream().mapToDouble(Double::doubleValue));
        Double latestAbility = abilityHistory.isEmpty() ? null : abilityHistory.get(abilityHistory.size() - 1);
        Integer improvement = null;
        if (completed.size() >= 2) {
            Integer first = completed.get(0).getOverallScore();
            Integer last = completed.get(completed.size() - 1).getOverallScore();
            if (first != null && last != null) {
                improvement = last - first;
            }
        }

        return new DiagnosisStatisticsDto(
                bySubject ? subjectId : null,
                totalReports,
                completed.size(),
                averageScore,
                averageAbility,
                latestAbility,
                abilityHistory,
                improvement
        );
    }

    private static Double averageOrNull(DoubleStream values) {
        OptionalDouble average = values.average();
        return average.isPresent() ? Double.valueOf(average.getAsDouble()) : null;
    }

    private void applySynthesis(DiagnosisReport report, DiagnosisSynthesis synthesis) {
        report.setTotalQuestions(synthesis.totalQuestions());
        report.setCorrectAnswers(synthesis.correctAnswers());
        report.setTotalTimeSeconds(synthesis.totalTimeSeconds());
        report.setAverageTimeSeconds(synthesis.averageTimeSeconds());
        report.setAccuracy(synthesis.accuracy());
        report.setOverallScore(synthesis.overallScore());
        report.setFinalAbility(synthesis.abilityEstimate().ability());
        report.setAbilityStandardError(synthesis.abilityEstimate().standardError());
        report.setConfidenceLower(synthesis.abilityEstimate().confidenceInterval().lower());
        report.setConfidenceUpper(synthesis.abilityEstimate().confidenceInterval().upper());
        report.setMasteryMap(synthesis.masteryMap());
        report.setHeatmap(synthesis.heatmap());
        report.setWeaknesses(synthesis.weaknesses());
        report.setStrengths(synthesis.strengths());
        report.setLearningPath(synthesis.learningPath());
        report.setAnalysis(synthesis.analysis());
        report.setRecommendations(synthesis.recommendations());

        report.getWeaknessPoints().clear();
        for (MasteryLevel gap : synthesis.gaps()) {
            WeaknessPoint point = new WeaknessPoint();
            point.setKnowledgePointId(gap.knowledgePointId());
            point.setKnowledgePointName(gap.knowledgePointName());
            point.setWeaknessLevel(weaknessLevel(gap.masteryScore()));
            point.setMasteryScore(gap.masteryScore());
            point.setAccuracy(gap.accuracy());
            point.setAverageTimeSeconds(gap.averageTimeSeconds());
            point.setErrorTypes(gap.errorTypes());
            point.setImprovementPriority(gap.priority());
            point.setEstimatedImprovementHours(ReportSynthesizer.estimateHours(gap.masteryScore(), gap.priority()));
            report.addWeaknessPoint(point);
        }
    }

    /**
     * 1 just below the weakness threshold, 5 at zero mastery.
     */
    static int weaknessLevel(double masteryScore) {
        int level = (int) Math.ceil((ReportSynthesizer.WEAKNESS_THRESHOLD - masteryScore) / 12.0);
        return Math.max(1, Math.min(5, level));
    }

    private NextQuestionDto serving(DiagnosisSession session, PendingQuestion pending) {
        return new NextQuestionDto(
                session.getId(),
                false,
                null,
                diagnosisMapper.toQuestionDto(pending),
                session.getQuestionsAnswered(),
                remaining(session),
                session.getCurrentAbility()
        );
    }

    private NextQuestionDto finished(DiagnosisSession session, String reason) {
        return new NextQuestionDto(
                session.getId(),
                true,
                reason,
                null,
                session.getQuestionsAnswered(),
                remaining(session),
                session.getCurrentAbility()
        );
    }

    private static int remaining(DiagnosisSession session) {
        return Math.max(0, session.getMaxQuestions() - session.getQuestionsAnswered());
    }

    private DiagnosisReport loadOwnedReport(String userId, UUID reportId) {
        DiagnosisReport report = reportRepository.findById(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Diagnosis report " + reportId + " not found"));
        ensureOwner(userId, report);
        return report;
    }

    private DiagnosisReport loadCompletedReport(String userId, UUID reportId) {
        DiagnosisReport report = loadOwnedReport(userId, reportId);
        if (report.getStatus() != DiagnosisStatus.COMPLETED) {
            throw new ReportNotCompletedException(reportId);
        }
        return report;
    }

    private DiagnosisSession loadOwnedSession(String userId, UUID sessionId) {
        DiagnosisSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Diagnosis session " + sessionId + " not found"));
        ensureOwner(userId, session.getReport());
        return session;
    }

    private DiagnosisSession loadOwnedSessionForUpdate(String userId, UUID sessionId) {
        DiagnosisSession session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Diagnosis session " + sessionId + " not found"));
        ensureOwner(userId, session.getReport());
        return session;
    }

    private void ensureOwner(String userId, DiagnosisReport report) {
        if (!report.getUserId().equals(userId)) {
            throw new AccessDeniedException("You do not have access to diagnosis report " + report.getId());
        }
    }
}
