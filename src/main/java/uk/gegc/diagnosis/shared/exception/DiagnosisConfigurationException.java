package uk.gegc.diagnosis.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a report or session configuration is rejected at creation time,
 * e.g. {@code minQuestions > maxQuestions} or a malformed difficulty range.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class DiagnosisConfigurationException extends RuntimeException {

    private final String field;

    public DiagnosisConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
