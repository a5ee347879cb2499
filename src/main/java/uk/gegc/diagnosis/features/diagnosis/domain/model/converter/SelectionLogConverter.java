package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.SelectionLogEntry;

import java.util.ArrayList;
import java.util.List;

@Converter
public class SelectionLogConverter extends JsonAttributeConverter<List<SelectionLogEntry>> {

    public SelectionLogConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
