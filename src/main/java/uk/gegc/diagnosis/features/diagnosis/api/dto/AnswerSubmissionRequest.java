package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(
        name = "AnswerSubmissionRequest",
        description = "Graded answer to the question currently pending in the session"
)
public record AnswerSubmissionRequest(
        @Schema(description = "ID of the pending question", requiredMode = Schema.RequiredMode.REQUIRED, example = "q-101")
        @NotBlank(message = "Question ID is required")
        String questionId,

        @Schema(description = "Answer given by the learner", example = "x = 4")
        @Size(max = 2000)
        String userAnswer,

        @Schema(description = "Reference answer", example = "x = 4")
        @Size(max = 2000)
        String correctAnswer,

        @Schema(description = "Whether the answer was graded correct", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Correctness is required")
        Boolean correct,

        @Schema(description = "Seconds spent on the question", requiredMode = Schema.RequiredMode.REQUIRED, example = "45")
        @NotNull(message = "Time spent is required")
        @Min(value = 0, message = "Time spent must not be negative")
        Integer timeSpentSeconds,

        @Schema(description = "Self-reported confidence 1..5", example = "3")
        @Min(1) @Max(5)
        Integer confidenceLevel,

        @Schema(description = "Error category for incorrect answers", example = "calculation")
        @Size(max = 50)
        String errorType
) {
}
