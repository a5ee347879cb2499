package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

import uk.gegc.diagnosis.features.ability.application.AbilityEstimator.AbilityEstimate;

import java.util.List;
import java.util.Map;

/**
 * Full result of synthesizing a report's response history.
 *
 * @param masteryMap keyed and ordered by knowledge point id
 * @param gaps       every knowledge point under the weakness threshold, ranked
 */
public record DiagnosisSynthesis(
        AbilityEstimate abilityEstimate,
        Map<String, MasteryLevel> masteryMap,
        HeatmapData heatmap,
        List<MasteryLevel> gaps,
        List<RankedKnowledgePoint> weaknesses,
        List<RankedKnowledgePoint> strengths,
        List<LearningPathStep> learningPath,
        int totalQuestions,
        int correctAnswers,
        double accuracy,
        int overallScore,
        long totalTimeSeconds,
        double averageTimeSeconds,
        DiagnosisAnalysis analysis,
        List<Recommendation> recommendations
) {
}
