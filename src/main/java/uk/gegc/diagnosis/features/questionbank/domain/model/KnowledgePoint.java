package uk.gegc.diagnosis.features.questionbank.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Getter
@Setter
@Table(name = "knowledge_points")
public class KnowledgePoint {

    @Id
    @Column(name = "id", length = 64, nullable = false, updatable = false)
    private String id;

    @Column(name = "subject_id", length = 64, nullable = false)
    private String subjectId;

    @Column(name = "name", nullable = false)
    private String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "knowledge_point_prerequisites",
            joinColumns = @JoinColumn(name = "knowledge_point_id")
    )
    @Column(name = "prerequisite_id", length = 64, nullable = false)
    private Set<String> prerequisiteIds = new LinkedHashSet<>();
}
