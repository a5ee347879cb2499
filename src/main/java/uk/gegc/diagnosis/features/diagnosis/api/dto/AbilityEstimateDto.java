package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "AbilityEstimateDto", description = "Running ability estimate of a session with a 95% confidence interval")
public record AbilityEstimateDto(
        UUID sessionId,
        double ability,
        double standardError,
        double confidenceLower,
        double confidenceUpper,
        int questionsAnswered,
        List<AbilityStepDto> progression
) {
}
