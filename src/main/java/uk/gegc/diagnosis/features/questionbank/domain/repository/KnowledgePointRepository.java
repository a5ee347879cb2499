package uk.gegc.diagnosis.features.questionbank.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.diagnosis.features.questionbank.domain.model.KnowledgePoint;

@Repository
public interface KnowledgePointRepository extends JpaRepository<KnowledgePoint, String> {
}
