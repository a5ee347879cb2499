package uk.gegc.diagnosis.features.selection.application;

import uk.gegc.diagnosis.features.diagnosis.domain.model.DifficultyRange;

import java.util.Collection;
import java.util.Set;

/**
 * Everything the selector needs to pick the next item of a session.
 *
 * @param effectiveRange report range already narrowed to the session level band
 */
public record SelectionRequest(
        String subjectId,
        Collection<String> knowledgePointFilter,
        DifficultyRange effectiveRange,
        boolean adaptive,
        double ability,
        Set<String> servedQuestionIds,
        Set<String> coveredKnowledgePoints
) {
}
