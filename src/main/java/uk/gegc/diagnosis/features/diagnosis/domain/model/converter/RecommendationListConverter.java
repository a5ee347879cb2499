package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.Recommendation;

import java.util.ArrayList;
import java.util.List;

@Converter
public class RecommendationListConverter extends JsonAttributeConverter<List<Recommendation>> {

    public RecommendationListConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
