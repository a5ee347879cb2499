package uk.gegc.diagnosis.features.diagnosis.domain.model;

public enum DiagnosisType {
    BASIC,
    COMPREHENSIVE,
    ADAPTIVE,
    TARGETED
}
