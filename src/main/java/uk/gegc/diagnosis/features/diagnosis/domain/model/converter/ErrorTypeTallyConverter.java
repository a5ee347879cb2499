package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

@Converter
public class ErrorTypeTallyConverter extends JsonAttributeConverter<Map<String, Integer>> {

    public ErrorTypeTallyConverter() {
        super(new TypeReference<>() {
        }, TreeMap::new);
    }
}
