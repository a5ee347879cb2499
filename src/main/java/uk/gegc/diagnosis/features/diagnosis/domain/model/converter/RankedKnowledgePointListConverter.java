package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.RankedKnowledgePoint;

import java.util.ArrayList;
import java.util.List;

@Converter
public class RankedKnowledgePointListConverter extends JsonAttributeConverter<List<RankedKnowledgePoint>> {

    public RankedKnowledgePointListConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
