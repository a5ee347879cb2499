package uk.gegc.diagnosis.features.diagnosis.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.DiagnosisAnalysisConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.HeatmapDataConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.LearningPathConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.MasteryMapConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.RankedKnowledgePointListConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.RecommendationListConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.StringListConverter;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.DiagnosisAnalysis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.MasteryLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.RankedKnowledgePoint;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.Recommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A diagnostic report for one learner and subject. Configuration is fixed at creation;
 * the aggregate columns are written once, when the report is completed.
 */
@Entity
@Getter
@Setter
@Table(name = "diagnosis_reports", indexes = {
        @Index(name = "idx_diagnosis_reports_user_subject", columnList = "user_id, subject_id")
})
public class DiagnosisReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", length = 64, nullable = false, updatable = false)
    private String userId;

    @Column(name = "subject_id", length = 64, nullable = false, updatable = false)
    private String subjectId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "diagnosis_type", nullable = false, length = 30)
    private DiagnosisType diagnosisType = DiagnosisType.COMPREHENSIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_level", length = 30)
    private DiagnosisLevel targetLevel;

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "knowledge_point_filter")
    private List<String> knowledgePointFilter = new ArrayList<>();

    @Column(name = "planned_questions", nullable = false)
    private int plannedQuestions;

    @Column(name = "time_limit_minutes", nullable = false)
    private int timeLimitMinutes;

    @Embedded
    private DifficultyRange difficultyRange = DifficultyRange.full();

    @Column(name = "adaptive_enabled", nullable = false)
    private boolean adaptiveEnabled = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private DiagnosisStatus status = DiagnosisStatus.PENDING;

    @OneToMany(mappedBy = "report", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<DiagnosisSession> sessions = new ArrayList<>();

    @OneToMany(mappedBy = "report", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<WeaknessPoint> weaknessPoints = new ArrayList<>();

    // Aggregates, written at completion

    @Column(name = "total_questions")
    private Integer totalQuestions;

    @Column(name = "correct_answers")
    private Integer correctAnswers;

    @Column(name = "total_time_seconds")
    private Long totalTimeSeconds;

    @Column(name = "average_time_seconds")
    private Double averageTimeSeconds;

    @Column(name = "accuracy")
    private Double accuracy;

    @Column(name = "overall_score")
    private Integer overallScore;

    @Column(name = "final_ability")
    private Double finalAbility;

    @Column(name = "ability_standard_error")
    private Double abilityStandardError;

    @Column(name = "confidence_lower")
    private Double confidenceLower;

    @Column(name = "confidence_upper")
    private Double confidenceUpper;

    @Lob
    @Convert(converter = MasteryMapConverter.class)
    @Column(name = "mastery_map")
    private Map<String, MasteryLevel> masteryMap = new TreeMap<>();

    @Lob
    @Convert(converter = HeatmapDataConverter.class)
    @Column(name = "heatmap")
    private HeatmapData heatmap;

    @Lob
    @Convert(converter = RankedKnowledgePointListConverter.class)
    @Column(name = "weaknesses")
    private List<RankedKnowledgePoint> weaknesses = new ArrayList<>();

    @Lob
    @Convert(converter = RankedKnowledgePointListConverter.class)
    @Column(name = "strengths")
    private List<RankedKnowledgePoint> strengths = new ArrayList<>();

    @Lob
    @Convert(converter = LearningPathConverter.class)
    @Column(name = "learning_path")
    private List<LearningPathStep> learningPath = new ArrayList<>();

    @Lob
    @Convert(converter = DiagnosisAnalysisConverter.class)
    @Column(name = "analysis")
    private DiagnosisAnalysis analysis;

    @Lob
    @Convert(converter = RecommendationListConverter.class)
    @Column(name = "recommendations")
    private List<Recommendation> recommendations = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void addSession(DiagnosisSession session) {
        session.setReport(this);
        sessions.add(session);
    }

    public void addWeaknessPoint(WeaknessPoint weaknessPoint) {
        weaknessPoint.setReport(this);
        weaknessPoints.add(weaknessPoint);
    }
}
