package uk.gegc.diagnosis.features.diagnosis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.diagnosis.features.diagnosis.application.ImprovementPriorityPolicy;
import uk.gegc.diagnosis.features.diagnosis.application.impl.FixedImprovementPriorityPolicy;
import uk.gegc.diagnosis.shared.config.DiagnosisProperties;

@Configuration
public class DiagnosisConfig {

    @Bean
    public ImprovementPriorityPolicy improvementPriorityPolicy(DiagnosisProperties properties) {
        return new FixedImprovementPriorityPolicy(properties.getDefaultImprovementPriority());
    }
}
