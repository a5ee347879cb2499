package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "AbilityStepDto", description = "Ability estimate after one answer, with its standard error and 95% interval")
public record AbilityStepDto(
        int questionIndex,
        double previousEstimate,
        double estimate,
        double standardError,
        double confidenceLower,
        double confidenceUpper,
        boolean correct,
        int difficulty,
        Instant timestamp
) {
}
