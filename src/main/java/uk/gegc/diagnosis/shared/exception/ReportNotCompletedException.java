package uk.gegc.diagnosis.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Exception thrown when trying to read heatmap, learning path or weakness analysis
 * of a report that has not been completed yet.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ReportNotCompletedException extends RuntimeException {

    private final UUID reportId;

    public ReportNotCompletedException(UUID reportId) {
        super("Report " + reportId + " is not completed yet. Diagnostic results are only available for completed reports.");
        this.reportId = reportId;
    }

    public UUID getReportId() {
        return reportId;
    }
}
