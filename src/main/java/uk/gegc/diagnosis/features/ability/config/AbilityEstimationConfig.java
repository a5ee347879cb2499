package uk.gegc.diagnosis.features.ability.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator;
import uk.gegc.diagnosis.features.ability.application.impl.DifficultyWeightedAbilityEstimator;

@Configuration
public class AbilityEstimationConfig {

    @Bean
    public AbilityEstimator abilityEstimator() {
        return new DifficultyWeightedAbilityEstimator();
    }
}
