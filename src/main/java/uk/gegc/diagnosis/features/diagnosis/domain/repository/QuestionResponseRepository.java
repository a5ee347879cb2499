package uk.gegc.diagnosis.features.diagnosis.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.diagnosis.features.diagnosis.domain.model.QuestionResponse;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionResponseRepository extends JpaRepository<QuestionResponse, UUID> {

    @Query("""
            SELECT qr FROM QuestionResponse qr
            WHERE qr.session.id = :sessionId
            ORDER BY qr.answeredAt ASC, qr.questionIndex ASC
            """)
    List<QuestionResponse> findAllBySessionOrdered(@Param("sessionId") UUID sessionId);

    /**
     * All responses of a report across its sessions, in answer order.
     */
    @Query("""
            SELECT qr FROM QuestionResponse qr
            WHERE qr.session.report.id = :reportId
            ORDER BY qr.answeredAt ASC, qr.questionIndex ASC
            """)
    List<QuestionResponse> findAllByReportOrdered(@Param("reportId") UUID reportId);
}
