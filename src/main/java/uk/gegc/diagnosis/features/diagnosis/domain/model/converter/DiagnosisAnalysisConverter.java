package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis;

@Converter
public class DiagnosisAnalysisConverter extends JsonAttributeConverter<DiagnosisAnalysis> {

    public DiagnosisAnalysisConverter() {
        super(new TypeReference<>() {
        }, () -> null);
    }
}
