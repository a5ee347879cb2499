package uk.gegc.diagnosis.features.diagnosis.application.impl;

import uk.gegc.diagnosis.features.diagnosis.application.ImprovementPriorityPolicy;

public class FixedImprovementPriorityPolicy implements ImprovementPriorityPolicy {

    private final int priority;

    public FixedImprovementPriorityPolicy(int priority) {
        if (priority < 1 || priority > 5) {
            throw new IllegalArgumentException("Improvement priority must be between 1 and 5, got " + priority);
        }
        this.priority = priority;
    }

    @Override
    public int priorityFor(String knowledgePointId, double masteryScore) {
        return priority;
    }
}
