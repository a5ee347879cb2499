package uk.gegc.diagnosis.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults applied when a report or session is created without explicit settings.
 */
@Component
@ConfigurationProperties(prefix = "diagnosis")
public class DiagnosisProperties {

    private int defaultMinQuestions = 10;
    private double defaultTargetPrecision = 0.3;
    private int defaultPlannedQuestions = 30;
    private int defaultTimeLimitMinutes = 60;
    private int defaultImprovementPriority = 3;

    public int getDefaultMinQuestions() {
        return defaultMinQuestions;
    }

    public void setDefaultMinQuestions(int defaultMinQuestions) {
        this.defaultMinQuestions = defaultMinQuestions;
    }

    public double getDefaultTargetPrecision() {
        return defaultTargetPrecision;
    }

    public void setDefaultTargetPrecision(double defaultTargetPrecision) {
        this.defaultTargetPrecision = defaultTargetPrecision;
    }

    public int getDefaultPlannedQuestions() {
        return defaultPlannedQuestions;
    }

    public void setDefaultPlannedQuestions(int defaultPlannedQuestions) {
        this.defaultPlannedQuestions = defaultPlannedQuestions;
    }

    public int getDefaultTimeLimitMinutes() {
        return defaultTimeLimitMinutes;
    }

    public void setDefaultTimeLimitMinutes(int defaultTimeLimitMinutes) {
        this.defaultTimeLimitMinutes = defaultTimeLimitMinutes;
    }

    public int getDefaultImprovementPriority() {
        return defaultImprovementPriority;
    }

    public void setDefaultImprovementPriority(int defaultImprovementPriority) {
        this.defaultImprovementPriority = defaultImprovementPriority;
    }
}
