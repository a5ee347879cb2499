package uk.gegc.diagnosis.features.selection.application;

import uk.gegc.diagnosis.features.questionbank.application.QuestionBank.CandidateQuestion;

/**
 * Outcome of a selection round. An empty {@code question} means the pool is exhausted.
 */
public record ItemSelection(int suggestedDifficulty, CandidateQuestion question) {

    public static ItemSelection exhausted(int suggestedDifficulty) {
        return new ItemSelection(suggestedDifficulty, null);
    }

    public boolean isExhausted() {
        return question == null;
    }
}
