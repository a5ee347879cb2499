package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisLevel;

@Schema(name = "StartSessionRequest", description = "Settings of a new adaptive session")
public record StartSessionRequest(
        @Schema(description = "Session name; defaults to the level name", example = "Application round")
        @Size(max = 255)
        String name,

        @Schema(description = "Cognitive level assessed by this session", requiredMode = Schema.RequiredMode.REQUIRED,
                example = "APPLICATION")
        @NotNull(message = "Diagnosis level is required")
        DiagnosisLevel level,

        @Schema(description = "Minimum questions before the stopping rule applies; defaults to 10", example = "10")
        Integer minQuestions,

        @Schema(description = "Hard upper bound of questions; defaults to the report's planned count", example = "30")
        Integer maxQuestions,

        @Schema(description = "Ability variance threshold for stopping; defaults to 0.3", example = "0.3")
        Double targetPrecision
) {
}
