package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

import java.util.List;

/**
 * Parallel arrays, one slot per knowledge point ordered by knowledge point id.
 */
public record HeatmapData(
        List<String> knowledgePointIds,
        List<String> knowledgePoints,
        List<Double> masteryScores,
        List<Double> difficulties,
        List<Double> averageTimes,
        List<Double> errorRates
) {

    public static HeatmapData empty() {
        return new HeatmapData(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
