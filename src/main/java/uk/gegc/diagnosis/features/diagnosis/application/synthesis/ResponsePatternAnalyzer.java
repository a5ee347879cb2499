package uk.gegc.diagnosis.features.diagnosis.application.synthesis;

import org.springframework.stereotype.Component;
import uk.gegc.diagnosis.features.diagnosis.domain.model.AbilityProgressionEntry;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisSession;
import uk.gegc.diagnosis.features.diagnosis.domain.model.QuestionResponse;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis.Trend;

import java.util.List;

/**
 * Secondary signals over one session. Reads only.
 */
@Component
public class ResponsePatternAnalyzer {

    private static final int CONSISTENCY_WINDOW = 5;
    private static final double SLOPE_EPSILON = 1e-9;

    public ResponsePatternAnalysis analyze(DiagnosisSession session, List<QuestionResponse> responses) {
        int total = responses.size();
        int correct = (int) responses.stream().filter(QuestionResponse::isCorrect).count();
        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        double averageTime = responses.stream().mapToInt(QuestionResponse::getTimeSpentSeconds).average().orElse(0.0);

        List<Integer> difficulties = responses.stream().map(QuestionResponse::getDifficulty).toList();
        List<Double> trajectory = session.getAbilityProgression().stream()
                .map(AbilityProgressionEntry::newEstimate)
                .toList();

        double efficiency = averageTime > 0 ? accuracy * 60.0 / averageTime : accuracy;

        return new ResponsePatternAnalysis(
                total,
                correct,
                accuracy,
                averageTime,
                difficulties,
                trajectory,
                consistency(trajectory),
                trend(trajectory),
                efficiency
        );
    }

    static double consistency(List<Double> trajectory) {
        if (trajectory.isEmpty()) {
            return 1.0;
        }
        List<Double> window = trajectory.subList(Math.max(0, trajectory.size() - CONSISTENCY_WINDOW), trajectory.size());
        double mean = window.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = window.stream()
                .mapToDouble(v -> (v - mean) * (v - mean))
                .average()
                .orElse(0.0);
        return 1.0 / (1.0 + variance);
    }

    static Trend trend(List<Double> trajectory) {
        int n = trajectory.size();
        if (n < 2) {
            return Trend.STABLE;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = trajectory.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            numerator += (i - meanX) * (trajectory.get(i) - meanY);
            denominator += (i - meanX) * (i - meanX);
        }
        double slope = numerator / denominator;
        if (slope > SLOPE_EPSILON) {
            return Trend.IMPROVING;
        }
        if (slope < -SLOPE_EPSILON) {
            return Trend.DECLINING;
        }
        return Trend.STABLE;
    }
}
