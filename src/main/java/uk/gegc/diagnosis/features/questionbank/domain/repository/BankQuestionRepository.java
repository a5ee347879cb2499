package uk.gegc.diagnosis.features.questionbank.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.diagnosis.features.questionbank.domain.model.BankQuestion;

import java.util.List;

@Repository
public interface BankQuestionRepository extends JpaRepository<BankQuestion, String> {

    List<BankQuestion> findAllBySubjectIdAndDifficultyOrderByIdAsc(String subjectId, int difficulty);
}
