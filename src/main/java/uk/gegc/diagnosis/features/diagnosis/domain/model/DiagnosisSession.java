package uk.gegc.diagnosis.features.diagnosis.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.AbilityProgressionConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.PendingQuestionConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.SelectionLogConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One adaptive run inside a report. Lifecycle changes go through the session state machine.
 */
@Entity
@Getter
@Setter
@Table(name = "diagnosis_sessions")
public class DiagnosisSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "report_id", nullable = false, updatable = false)
    private DiagnosisReport report;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "diagnosis_level", nullable = false, length = 30)
    private DiagnosisLevel level;

    @Column(name = "min_questions", nullable = false)
    private int minQuestions;

    @Column(name = "max_questions", nullable = false)
    private int maxQuestions;

    @Column(name = "target_precision", nullable = false)
    private double targetPrecision;

    @Column(name = "current_ability", nullable = false)
    private double currentAbility;

    @Column(name = "ability_standard_error", nullable = false)
    private double abilityStandardError = 1.0;

    @Column(name = "questions_answered", nullable = false)
    private int questionsAnswered;

    @Column(name = "correct_answers", nullable = false)
    private int correctAnswers;

    @Column(name = "current_question_index", nullable = false)
    private int currentQuestionIndex;

    @Column(name = "total_time_seconds", nullable = false)
    private long totalTimeSeconds;

    @Lob
    @Convert(converter = PendingQuestionConverter.class)
    @Column(name = "pending_question")
    private PendingQuestion pendingQuestion;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private DiagnosisStatus status = DiagnosisStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "accuracy_rate")
    private Double accuracyRate;

    @Lob
    @Convert(converter = AbilityProgressionConverter.class)
    @Column(name = "ability_progression")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private List<AbilityProgressionEntry> abilityProgression = new ArrayList<>();

    @Lob
    @Convert(converter = SelectionLogConverter.class)
    @Column(name = "selection_log")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private List<SelectionLogEntry> selectionLog = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    public List<AbilityProgressionEntry> getAbilityProgression() {
        return List.copyOf(abilityProgression);
    }

    public List<SelectionLogEntry> getSelectionLog() {
        return List.copyOf(selectionLog);
    }

    /**
     * Appends to the progression. The list is replaced so the JSON column is seen as dirty.
     */
    public void appendProgression(AbilityProgressionEntry entry) {
        List<AbilityProgressionEntry> updated = new ArrayList<>(abilityProgression);
        updated.add(entry);
        this.abilityProgression = updated;
    }

    public void appendSelection(SelectionLogEntry entry) {
        List<SelectionLogEntry> updated = new ArrayList<>(selectionLog);
        updated.add(entry);
        this.selectionLog = updated;
    }
}
