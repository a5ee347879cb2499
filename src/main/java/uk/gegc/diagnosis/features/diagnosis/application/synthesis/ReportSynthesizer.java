package uk.gegc.diagnosis.features.diagnosis.application.synthesis;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.AbilityEstimate;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.ScoredResponse;
import uk.gegc.diagnosis.features.diagnosis.application.ImprovementPriorityPolicy;
import uk.gegc.diagnosis.features.diagnosis.domain.model.QuestionResponse;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis.DifficultyPreference;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis.LearningStyle;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis.OverallAssessment;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis.Pace;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisSynthesis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.MasteryLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.PracticeStrategy;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.RankedKnowledgePoint;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.Recommendation;
import uk.gegc.diagnosis.features.questionbank.application.KnowledgePointCatalog.KnowledgePointInfo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Turns the full response history of a report into mastery data, rankings, a learning
 * path, an analysis and recommendations.
 * <p>
 * Output depends only on the responses and the knowledge point lookup, so running it
 * twice over the same history yields equal results.
 */
@Component
@RequiredArgsConstructor
public class ReportSynthesizer {

    public static final double WEAKNESS_THRESHOLD = 60.0;
    static final double STRENGTH_THRESHOLD = 80.0;
    static final double TARGET_MASTERY = 80.0;
    static final int TOP_N = 5;
    static final int RECOMMENDED_STEPS = 3;

    private static final double HOURS_PER_MASTERY_POINT = 0.1;
    private static final double FAST_PACE_SECONDS = 60.0;
    private static final double SLOW_PACE_SECONDS = 150.0;

    private static final Comparator<MasteryLevel> WEAKNESS_ORDER = Comparator
            .comparingInt(MasteryLevel::priority)
            .thenComparingDouble(MasteryLevel::masteryScore)
            .thenComparing(MasteryLevel::knowledgePointId);

    private static final Comparator<MasteryLevel> STRENGTH_ORDER = Comparator
            .comparingDouble(MasteryLevel::masteryScore).reversed()
            .thenComparing(MasteryLevel::knowledgePointId);

    private final AbilityEstimator abilityEstimator;
    private final ImprovementPriorityPolicy priorityPolicy;

    public DiagnosisSynthesis synthesize(List<QuestionResponse> responses, Map<String, KnowledgePointInfo> knowledgePoints) {
        AbilityEstimate estimate = abilityEstimator.estimate(responses.stream()
                .map(r -> new ScoredResponse(r.getDifficulty(), r.isCorrect()))
                .toList());

        Map<String, MasteryLevel> masteryMap = buildMasteryMap(responses, knowledgePoints);
        HeatmapData heatmap = buildHeatmap(masteryMap);

        List<MasteryLevel> gaps = masteryMap.values().stream()
                .filter(m -> m.masteryScore() < WEAKNESS_THRESHOLD)
                .sorted(WEAKNESS_ORDER)
                .toList();
        List<MasteryLevel> topWeaknesses = gaps.stream().limit(TOP_N).toList();
        List<MasteryLevel> topStrengths = masteryMap.values().stream()
                .filter(m -> m.masteryScore() >= STRENGTH_THRESHOLD)
                .sorted(STRENGTH_ORDER)
                .limit(TOP_N)
                .toList();

        List<LearningPathStep> learningPath = buildLearningPath(topWeaknesses, knowledgePoints);

        int total = responses.size();
        int correct = (int) responses.stream().filter(QuestionResponse::isCorrect).count();
        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        long totalTime = responses.stream().mapToLong(QuestionResponse::getTimeSpentSeconds).sum();
        double averageTime = total == 0 ? 0.0 : (double) totalTime / total;

        DiagnosisAnalysis analysis = analyze(responses, estimate.ability(), accuracy, averageTime);
        List<Recommendation> recommendations = recommend(learningPath, analysis);

        return new DiagnosisSynthesis(
                estimate,
                masteryMap,
                heatmap,
                gaps,
                rank(topWeaknesses),
                rank(topStrengths),
                learningPath,
                total,
                correct,
                accuracy,
                (int) Math.round(accuracy * 100),
                totalTime,
                averageTime,
                analysis,
                recommendations
        );
    }

    public static double estimateHours(double masteryScore, int priority) {
        double gap = Math.max(0.0, TARGET_MASTERY - masteryScore);
        return roundOneDecimal(gap * HOURS_PER_MASTERY_POINT * priorityMultiplier(priority));
    }

    static double priorityMultiplier(int priority) {
        return switch (priority) {
            case 1 -> 1.5;
            case 2 -> 1.3;
            case 4 -> 0.8;
            case 5 -> 0.6;
            default -> 1.0;
        };
    }

    private Map<String, MasteryLevel> buildMasteryMap(List<QuestionResponse> responses,
                                                      Map<String, KnowledgePointInfo> knowledgePoints) {
        Map<String, List<QuestionResponse>> byKnowledgePoint = new TreeMap<>();
        for (QuestionResponse response : responses) {
            byKnowledgePoint.computeIfAbsent(response.getKnowledgePointId(), k -> new ArrayList<>()).add(response);
        }

        Map<String, MasteryLevel> masteryMap = new TreeMap<>();
        byKnowledgePoint.forEach((kpId, kpResponses) -> {
            int total = kpResponses.size();
            int correct = (int) kpResponses.stream().filter(QuestionResponse::isCorrect).count();
            double accuracy = (double) correct / total;
            double masteryScore = accuracy * 100.0;
            long totalTime = kpResponses.stream().mapToLong(QuestionResponse::getTimeSpentSeconds).sum();

            Map<String, Integer> errorTypes = new TreeMap<>();
            kpResponses.stream()
                    .filter(r -> !r.isCorrect() && r.getErrorType() != null && !r.getErrorType().isBlank())
                    .forEach(r -> errorTypes.merge(r.getErrorType(), 1, Integer::sum));

            masteryMap.put(kpId, new MasteryLevel(
                    kpId,
                    nameOf(kpId, knowledgePoints),
                    masteryScore,
                    total,
                    correct,
                    accuracy,
                    kpResponses.stream().mapToInt(QuestionResponse::getDifficulty).average().orElse(0.0),
                    totalTime,
                    (double) totalTime / total,
                    1.0 - accuracy,
                    errorTypes,
                    priorityPolicy.priorityFor(kpId, masteryScore)
            ));
        });
        return masteryMap;
    }

    private HeatmapData buildHeatmap(Map<String, MasteryLevel> masteryMap) {
        List<MasteryLevel> ordered = List.copyOf(masteryMap.values());
        return new HeatmapData(
                ordered.stream().map(MasteryLevel::knowledgePointId).toList(),
                ordered.stream().map(MasteryLevel::knowledgePointName).toList(),
                ordered.stream().map(MasteryLevel::masteryScore).toList(),
                ordered.stream().map(MasteryLevel::averageDifficulty).toList(),
                ordered.stream().map(MasteryLevel::averageTimeSeconds).toList(),
                ordered.stream().map(MasteryLevel::errorRate).toList()
        );
    }

    private List<LearningPathStep> buildLearningPath(List<MasteryLevel> weaknesses,
                                                     Map<String, KnowledgePointInfo> knowledgePoints) {
        return IntStream.range(0, weaknesses.size())
                .mapToObj(i -> {
                    MasteryLevel weakness = weaknesses.get(i);
                    KnowledgePointInfo info = knowledgePoints.get(weakness.knowledgePointId());
                    return new LearningPathStep(
                            i + 1,
                            weakness.knowledgePointId(),
                            weakness.knowledgePointName(),
                            weakness.masteryScore(),
                            TARGET_MASTERY,
                            estimateHours(weakness.masteryScore(), weakness.priority()),
                            PracticeStrategy.forMastery(weakness.masteryScore()),
                            info != null ? info.prerequisiteIds() : List.of()
                    );
                })
                .toList();
    }

    private DiagnosisAnalysis analyze(List<QuestionResponse> responses, double ability, double accuracy, double averageTime) {
        OverallAssessment overall;
        if (accuracy >= 0.8 && ability > 1.0) {
            overall = OverallAssessment.EXCELLENT;
        } else if (accuracy >= 0.6 && ability > 0.0) {
            overall = OverallAssessment.GOOD;
        } else if (accuracy >= 0.4) {
            overall = OverallAssessment.FAIR;
        } else {
            overall = OverallAssessment.NEEDS_IMPROVEMENT;
        }

        Pace pace = averageTime < FAST_PACE_SECONDS
                ? Pace.FAST
                : averageTime > SLOW_PACE_SECONDS ? Pace.SLOW : Pace.MODERATE;

        double meanDifficulty = responses.stream().mapToInt(QuestionResponse::getDifficulty).average().orElse(3.0);
        DifficultyPreference preference = meanDifficulty > 3.5
                ? DifficultyPreference.HIGH
                : meanDifficulty < 2.5 ? DifficultyPreference.LOW : DifficultyPreference.MEDIUM;

        Map<String, Integer> errorCounts = new TreeMap<>();
        responses.stream()
                .filter(r -> !r.isCorrect() && r.getErrorType() != null && !r.getErrorType().isBlank())
                .forEach(r -> errorCounts.merge(r.getErrorType(), 1, Integer::sum));
        List<String> commonErrors = errorCounts.entrySet().stream()
                .filter(e -> e.getValue() >= 2)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(3)
                .map(Map.Entry::getKey)
                .toList();

        return new DiagnosisAnalysis(overall, new LearningStyle(pace, preference), commonErrors);
    }

    private List<Recommendation> recommend(List<LearningPathStep> learningPath, DiagnosisAnalysis analysis) {
        List<Recommendation> recommendations = new ArrayList<>();
        learningPath.stream()
                .limit(RECOMMENDED_STEPS)
                .forEach(step -> recommendations.add(new Recommendation(
                        Recommendation.Type.KNOWLEDGE_IMPROVEMENT,
                        step.currentMastery() < 40 ? Recommendation.Priority.HIGH : Recommendation.Priority.MEDIUM,
                        "Strengthen " + step.knowledgePointName(),
                        "Current mastery is " + Math.round(step.currentMastery())
                                + "%. Plan about " + step.estimatedHours() + " hours of "
                                + step.practiceStrategy().name().toLowerCase().replace('_', ' ') + ".",
                        step.knowledgePointId()
                )));

        if (analysis.learningStyle().pace() == Pace.SLOW) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.STUDY_METHOD,
                    Recommendation.Priority.MEDIUM,
                    "Improve answering speed",
                    "Answers took longer than average. Practise timed sets to build fluency.",
                    null
            ));
        }
        return recommendations;
    }

    private static List<RankedKnowledgePoint> rank(List<MasteryLevel> levels) {
        return IntStream.range(0, levels.size())
                .mapToObj(i -> new RankedKnowledgePoint(
                        i + 1,
                        levels.get(i).knowledgePointId(),
                        levels.get(i).knowledgePointName(),
                        levels.get(i).masteryScore(),
                        levels.get(i).priority()))
                .toList();
    }

    private static String nameOf(String knowledgePointId, Map<String, KnowledgePointInfo> knowledgePoints) {
        KnowledgePointInfo info = knowledgePoints.get(knowledgePointId);
        return info != null && info.name() != null ? info.name() : knowledgePointId;
    }

    private static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
