package uk.gegc.diagnosis.features.diagnosis.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisStatus;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReportSummaryDto", description = "List entry of a diagnostic report")
public record ReportSummaryDto(
        UUID id,
        String subjectId,
        String name,
        DiagnosisType diagnosisType,
        DiagnosisStatus status,
        Integer overallScore,
        Double finalAbility,
        Instant createdAt,
        Instant completedAt
) {
}
