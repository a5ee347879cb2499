package uk.gegc.diagnosis.features.diagnosis.domain.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;

@Converter
public class HeatmapDataConverter extends JsonAttributeConverter<HeatmapData> {

    public HeatmapDataConverter() {
        super(new TypeReference<>() {
        }, HeatmapData::empty);
    }
}
