package uk.gegc.diagnosis.features.diagnosis.domain.model;

import java.time.Instant;

/**
 * One step of a session's ability trajectory, appended per recorded answer.
 */
public record AbilityProgressionEntry(
        int questionIndex,
        double previousEstimate,
        double newEstimate,
        boolean correct,
        int difficulty,
        Instant timestamp
) {
}
