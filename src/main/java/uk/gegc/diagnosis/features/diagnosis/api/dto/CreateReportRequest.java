package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisType;

import java.util.List;

@Schema(name = "CreateReportRequest", description = "Configuration of a new diagnostic report")
public record CreateReportRequest(
        @Schema(description = "Subject to diagnose", requiredMode = Schema.RequiredMode.REQUIRED, example = "math-algebra")
        @NotBlank(message = "Subject ID is required")
        String subjectId,

        @Schema(description = "Report name", requiredMode = Schema.RequiredMode.REQUIRED, example = "Algebra baseline")
        @NotBlank(message = "Report name is required")
        @Size(max = 255, message = "Report name must not exceed 255 characters")
        String name,

        @Schema(description = "Optional description")
        @Size(max = 2000, message = "Description must not exceed 2000 characters")
        String description,

        @Schema(description = "Diagnosis type; defaults to COMPREHENSIVE", example = "ADAPTIVE")
        DiagnosisType diagnosisType,

        @Schema(description = "Target cognitive level", example = "APPLICATION")
        DiagnosisLevel targetLevel,

        @Schema(description = "Restrict questions to these knowledge points; empty means all")
        List<String> knowledgePointIds,

        @Schema(description = "Planned question count; defaults to 30", example = "30")
        @Min(value = 1, message = "Planned questions must be at least 1")
        Integer plannedQuestions,

        @Schema(description = "Time limit in minutes; defaults to 60", example = "60")
        @Min(value = 1, message = "Time limit must be at least 1 minute")
        Integer timeLimitMinutes,

        @Schema(description = "Lowest item difficulty; defaults to 1", example = "1")
        @Min(1) @Max(5)
        Integer minDifficulty,

        @Schema(description = "Highest item difficulty; defaults to 5", example = "5")
        @Min(1) @Max(5)
        Integer maxDifficulty,

        @Schema(description = "Adaptive item selection; defaults to true", example = "true")
        Boolean adaptiveEnabled
) {
}
