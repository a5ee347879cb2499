package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "DiagnosisSessionDto", description = "State of an adaptive session")
public record DiagnosisSessionDto(
        UUID id,
        UUID reportId,
        String name,
        DiagnosisLevel level,
        DiagnosisStatus status,
        int minQuestions,
        int maxQuestions,
        double targetPrecision,
        double currentAbility,
        double abilityStandardError,
        int questionsAnswered,
        int correctAnswers,
        int currentQuestionIndex,
        long totalTimeSeconds,
        Double accuracyRate,
        Instant startedAt,
        Instant endedAt
) {
}
