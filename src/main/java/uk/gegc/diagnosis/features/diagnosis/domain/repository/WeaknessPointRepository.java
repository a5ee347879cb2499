package uk.gegc.diagnosis.features.diagnosis.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.diagnosis.features.diagnosis.domain.model.WeaknessPoint;

import java.util.List;
import java.util.UUID;

@Repository
public interface WeaknessPointRepository extends JpaRepository<WeaknessPoint, UUID> {

    List<WeaknessPoint> findAllByReport_IdOrderByImprovementPriorityAscMasteryScoreAscKnowledgePointIdAsc(UUID reportId);
}
