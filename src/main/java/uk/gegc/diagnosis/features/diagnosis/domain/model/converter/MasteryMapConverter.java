package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.MasteryLevel;

import java.util.Map;
import java.util.TreeMap;

@Converter
public class MasteryMapConverter extends JsonAttributeConverter<Map<String, MasteryLevel>> {

    public MasteryMapConverter() {
        super(new TypeReference<>() {
        }, TreeMap::new);
    }
}
