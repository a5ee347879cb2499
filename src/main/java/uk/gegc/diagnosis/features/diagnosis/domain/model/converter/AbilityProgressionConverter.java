package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.AbilityProgressionEntry;

import java.util.ArrayList;
import java.util.List;

@Converter
public class AbilityProgressionConverter extends JsonAttributeConverter<List<AbilityProgressionEntry>> {

    public AbilityProgressionConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
