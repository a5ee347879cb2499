package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.PendingQuestion;

@Converter
public class PendingQuestionConverter extends JsonAttributeConverter<PendingQuestion> {

    public PendingQuestionConverter() {
        super(new TypeReference<>() {
        }, () -> null);
    }
}
