package uk.gegc.diagnosis.features.diagnosis.application;

/**
 * Decides how urgent improving a knowledge point is, 1 (most urgent) to 5.
 */
public interface ImprovementPriorityPolicy {

    int priorityFor(String knowledgePointId, double masteryScore);
}
