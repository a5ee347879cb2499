package uk.gegc.diagnosis.features.questionbank.application;

import java.util.Collection;
import java.util.List;

/**
 * Source of candidate items for adaptive selection.
 */
public interface QuestionBank {

    /**
     * Returns the questions of a subject at exactly the given difficulty.
     *
     * @param subjectId              subject the report targets
     * @param knowledgePointFilter   restricts candidates to these knowledge points; empty or null means no restriction
     * @param difficulty             item difficulty 1..5
     * @param excludeQuestionIds     ids already served in the session
     */
    List<CandidateQuestion> fetchCandidates(
            String subjectId,
            Collection<String> knowledgePointFilter,
            int difficulty,
            Collection<String> excludeQuestionIds
    );

    record CandidateQuestion(
            String questionId,
            String knowledgePointId,
            int difficulty,
            String content,
            String questionType
    ) {
    }
}
