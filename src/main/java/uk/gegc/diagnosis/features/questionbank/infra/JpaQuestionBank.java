package uk.gegc.diagnosis.features.questionbank.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.diagnosis.features.questionbank.application.QuestionBank;
import uk.gegc.diagnosis.features.questionbank.domain.model.BankQuestion;
import uk.gegc.diagnosis.features.questionbank.domain.repository.BankQuestionRepository;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class JpaQuestionBank implements QuestionBank {

    private final BankQuestionRepository bankQuestionRepository;

    @Override
    @Transactional(readOnly = true)
    public List<CandidateQuestion> fetchCandidates(
            String subjectId,
            Collection<String> knowledgePointFilter,
            int difficulty,
            Collection<String> excludeQuestionIds
    ) {
        Set<String> excluded = excludeQuestionIds == null ? Set.of() : new HashSet<>(excludeQuestionIds);
        boolean filtered = knowledgePointFilter != null && !knowledgePointFilter.isEmpty();

        return bankQuestionRepository.findAllBySubjectIdAndDifficultyOrderByIdAsc(subjectId, difficulty).stream()
                .filter(q -> !excluded.contains(q.getId()))
                .filter(q -> !filtered || knowledgePointFilter.contains(q.getKnowledgePointId()))
                .map(this::toCandidate)
                .toList();
    }

    private CandidateQuestion toCandidate(BankQuestion question) {
        return new CandidateQuestion(
                question.getId(),
                question.getKnowledgePointId(),
                question.getDifficulty(),
                question.getContent(),
                question.getQuestionType()
        );
    }
}
