package uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis;

public record Recommendation(
        Type type,
        Priority priority,
        String title,
        String description,
        String knowledgePointId
) {

    public enum Type {
        KNOWLEDGE_IMPROVEMENT,
        STUDY_METHOD
    }

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
