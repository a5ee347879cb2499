package uk.gegc.diagnosis.features.diagnosis.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * A recorded answer. Rows are never updated once written.
 */
@Entity
@Immutable
@Getter
@Setter
@Table(name = "diagnosis_question_responses", indexes = {
        @Index(name = "idx_question_responses_session", columnList = "session_id, question_index")
})
public class QuestionResponse {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private DiagnosisSession session;

    @Column(name = "question_index", nullable = false)
    private int questionIndex;

    @Column(name = "question_id", length = 64, nullable = false)
    private String questionId;

    @Column(name = "knowledge_point_id", length = 64, nullable = false)
    private String knowledgePointId;

    @Lob
    @Column(name = "question_content")
    private String questionContent;

    @Column(name = "question_type", length = 30)
    private String questionType;

    @Column(name = "difficulty", nullable = false)
    private int difficulty;

    @Column(name = "user_answer", length = 2000)
    private String userAnswer;

    @Column(name = "correct_answer", length = 2000)
    private String correctAnswer;

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @Column(name = "time_spent_seconds", nullable = false)
    private int timeSpentSeconds;

    @Column(name = "confidence_level")
    private Integer confidenceLevel;

    @Column(name = "error_type", length = 50)
    private String errorType;

    @Column(name = "answered_at", nullable = false, updatable = false)
    private Instant answeredAt;
}
