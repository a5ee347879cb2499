package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "DiagnosisStatisticsDto", description = "Aggregates over a learner's reports, optionally for one subject")
public record DiagnosisStatisticsDto(
        @Schema(description = "Subject filter; null for all subjects") String subjectId,
        long totalReports,
        long completedReports,
        @Schema(description = "Mean overall score of completed reports; null when none") Double averageScore,
        @Schema(description = "Mean final ability of completed reports; null when none") Double averageAbility,
        @Schema(description = "Final ability of the most recently completed report") Double latestAbility,
        @Schema(description = "Final abilities of completed reports, oldest first") List<Double> abilityHistory,
        @Schema(description = "Latest minus first overall score; null with fewer than two completed reports") Integer scoreImprovement
) {
}
