package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;

import java.util.ArrayList;
import java.util.List;

@Converter
public class LearningPathConverter extends JsonAttributeConverter<List<LearningPathStep>> {

    public LearningPathConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
