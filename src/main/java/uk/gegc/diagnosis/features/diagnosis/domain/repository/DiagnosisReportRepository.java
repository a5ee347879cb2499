package uk.gegc.diagnosis.features.diagnosis.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisReport;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DiagnosisReportRepository extends JpaRepository<DiagnosisReport, UUID> {

    /**
     * Find report by ID with pessimistic lock for session start and completion
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM DiagnosisReport r WHERE r.id = :id")
    Optional<DiagnosisReport> findByIdForUpdate(@Param("id") UUID id);

    Page<DiagnosisReport> findAllByUserId(String userId, Pageable pageable);

    Page<DiagnosisReport> findAllByUserIdAndSubjectId(String userId, String subjectId, Pageable pageable);

    List<DiagnosisReport> findAllByUserIdAndStatusOrderByCompletedAtAsc(String userId, DiagnosisStatus status);

    List<DiagnosisReport> findAllByUserIdAndSubjectIdAndStatusOrderByCompletedAtAsc(
            String userId, String subjectId, DiagnosisStatus status);

    long countByUserId(String userId);

    long countByUserIdAndSubjectId(String userId, String subjectId);
}
