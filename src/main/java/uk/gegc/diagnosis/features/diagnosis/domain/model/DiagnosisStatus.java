package uk.gegc.diagnosis.features.diagnosis.domain.model;

public enum DiagnosisStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
