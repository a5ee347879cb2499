package uk.gegc.diagnosis.features.diagnosis.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import uk.gegc.diagnosis.features.diagnosis.domain.model.converter.ErrorTypeTallyConverter;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "diagnosis_weakness_points")
public class WeaknessPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "report_id", nullable = false, updatable = false)
    private DiagnosisReport report;

    @Column(name = "knowledge_point_id", length = 64, nullable = false)
    private String knowledgePointId;

    @Column(name = "knowledge_point_name")
    private String knowledgePointName;

    /** 1 (mild) .. 5 (severe). */
    @Column(name = "weakness_level", nullable = false)
    private int weaknessLevel;

    @Column(name = "mastery_score", nullable = false)
    private double masteryScore;

    @Column(name = "accuracy", nullable = false)
    private double accuracy;

    @Column(name = "average_time_seconds", nullable = false)
    private double averageTimeSeconds;

    @Lob
    @Convert(converter = ErrorTypeTallyConverter.class)
    @Column(name = "error_types")
    private Map<String, Integer> errorTypes = new TreeMap<>();

    @Column(name = "improvement_priority", nullable = false)
    private int improvementPriority;

    @Column(name = "estimated_improvement_hours", nullable = false)
    private double estimatedImprovementHours;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
