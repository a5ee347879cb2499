package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "NextQuestionDto", description = "Either the next question or a finished marker")
public record NextQuestionDto(
        @Schema(description = "Session UUID") UUID sessionId,
        @Schema(description = "True when no more questions will be served") boolean finished,
        @Schema(description = "Why the session finished; null while running",
                allowableValues = {"STOPPING_RULE", "ITEM_POOL_EXHAUSTED", "SESSION_NOT_ACTIVE"}) String finishReason,
        @Schema(description = "Question to answer; null when finished") QuestionForDiagnosisDto question,
        @Schema(description = "Questions answered so far") int questionsAnswered,
        @Schema(description = "Questions left before the hard limit") int remainingQuestions,
        @Schema(description = "Current ability estimate") double currentAbility
) {
}
