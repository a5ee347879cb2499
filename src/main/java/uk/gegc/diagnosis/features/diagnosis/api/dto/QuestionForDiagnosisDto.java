package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "QuestionForDiagnosisDto", description = "Question served to the learner, without its answer")
public record QuestionForDiagnosisDto(
        @Schema(description = "Position of the question in the session, 0-based") int questionIndex,
        @Schema(description = "Question ID") String questionId,
        @Schema(description = "Knowledge point the question targets") String knowledgePointId,
        @Schema(description = "Item difficulty 1..5") int difficulty,
        @Schema(description = "Difficulty the selector aimed for") int suggestedDifficulty,
        @Schema(description = "Question text") String content,
        @Schema(description = "Question type") String questionType
) {
}
