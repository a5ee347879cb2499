package uk.gegc.diagnosis.features.questionbank.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Getter
@Setter
@Table(name = "bank_questions", indexes = {
        @Index(name = "idx_bank_questions_subject_difficulty", columnList = "subject_id, difficulty")
})
public class BankQuestion {

    @Id
    @Column(name = "id", length = 64, nullable = false, updatable = false)
    private String id;

    @Column(name = "subject_id", length = 64, nullable = false)
    private String subjectId;

    @Column(name = "knowledge_point_id", length = 64, nullable = false)
    private String knowledgePointId;

    @Column(name = "difficulty", nullable = false)
    private int difficulty;

    @Column(name = "question_type", length = 30, nullable = false)
    private String questionType;

    @Lob
    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "correct_answer", length = 1000)
    private String correctAnswer;
}
