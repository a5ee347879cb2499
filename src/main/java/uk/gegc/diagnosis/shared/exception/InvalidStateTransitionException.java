package uk.gegc.diagnosis.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a session or report is asked to perform a transition its current status does not allow.
 * The target entity is left untouched.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStateTransitionException extends RuntimeException {

    private final String currentState;
    private final String attemptedTransition;

    public InvalidStateTransitionException(String currentState, String attemptedTransition, String message) {
        super(message);
        this.currentState = currentState;
        this.attemptedTransition = attemptedTransition;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getAttemptedTransition() {
        return attemptedTransition;
    }
}
