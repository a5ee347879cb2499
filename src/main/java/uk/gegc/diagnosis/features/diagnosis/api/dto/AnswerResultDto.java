package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "AnswerResultDto", description = "Outcome of recording an answer")
public record AnswerResultDto(
        @Schema(description = "Recorded response UUID") UUID responseId,
        @Schema(description = "Whether the answer was correct") boolean correct,
        @Schema(description = "Whether the session should serve another question") boolean shouldContinue,
        @Schema(description = "Updated ability estimate") double currentAbility,
        @Schema(description = "Standard error of the estimate") double standardError,
        @Schema(description = "Questions answered so far") int questionsAnswered,
        @Schema(description = "Questions left before the hard limit") int remainingQuestions
) {
}
