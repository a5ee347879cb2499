package uk.gegc.diagnosis.features.diagnosis.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisSession;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DiagnosisSessionRepository extends JpaRepository<DiagnosisSession, UUID> {

    /**
     * Locks the session row only, so concurrent calls on one session serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DiagnosisSession s WHERE s.id = :id")
    Optional<DiagnosisSession> findByIdForUpdate(@Param("id") UUID id);
}
