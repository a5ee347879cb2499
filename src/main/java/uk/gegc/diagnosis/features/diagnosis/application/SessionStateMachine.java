package uk.gegc.diagnosis.features.diagnosis.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.diagnosis.features.ability.application.AbilityEstimator;
import uk.gegc.diagnosis.features.diagnosis.domain.model.AbilityProgressionEntry;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisSession;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisStatus;
import uk.gegc.diagnosis.shared.exception.InvalidStateTransitionException;
import uk.gegc.diagnosis.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Lifecycle and stopping rule of a diagnosis session.
 * <p>
 * {@code PENDING -> IN_PROGRESS -> COMPLETED | CANCELLED}. Every guard is checked
 * before any field is touched, so a rejected transition leaves the session unchanged.
 */
@Component
@RequiredArgsConstructor
public class SessionStateMachine {

    static final int STABILITY_WINDOW = 5;

    private final AbilityEstimator abilityEstimator;
    private final Clock clock;

    public void start(DiagnosisSession session) {
        requireStatus(session, DiagnosisStatus.PENDING, "start");
        session.setStatus(DiagnosisStatus.IN_PROGRESS);
        session.setStartedAt(Instant.now(clock));
    }

    /**
     * Applies one answer to the running estimate and the counters.
     *
     * @return the progression entry appended for this answer
     */
    public AbilityProgressionEntry recordAnswer(DiagnosisSession session, boolean correct, int difficulty) {
        requireStatus(session, DiagnosisStatus.IN_PROGRESS, "recordAnswer");
        if (session.getQuestionsAnswered() >= session.getMaxQuestions()) {
            throw new InvalidStateTransitionException(
                    session.getStatus().name(),
                    "recordAnswer",
                    "Session " + session.getId() + " already reached its maximum of "
                            + session.getMaxQuestions() + " questions"
            );
        }
        if (difficulty < 1 || difficulty > 5) {
            throw new ValidationException("Difficulty must be between 1 and 5, got " + difficulty);
        }

        double previous = session.getCurrentAbility();
        double updated = abilityEstimator.incrementalUpdate(previous, correct);
        AbilityProgressionEntry entry = new AbilityProgressionEntry(
                session.getCurrentQuestionIndex(),
                previous,
                updated,
                correct,
                difficulty,
                Instant.now(clock)
        );

        session.appendProgression(entry);
        session.setCurrentAbility(updated);
        session.setQuestionsAnswered(session.getQuestionsAnswered() + 1);
        if (correct) {
            session.setCorrectAnswers(session.getCorrectAnswers() + 1);
        }
        session.setCurrentQuestionIndex(session.getCurrentQuestionIndex() + 1);
        session.setAbilityStandardError(abilityEstimator.incrementalStandardError(session.getQuestionsAnswered()));
        return entry;
    }

    public boolean shouldContinue(DiagnosisSession session) {
        if (session.getQuestionsAnswered() >= session.getMaxQuestions()) {
            return false;
        }
        if (session.getQuestionsAnswered() < session.getMinQuestions()) {
            return true;
        }
        List<AbilityProgressionEntry> progression = session.getAbilityProgression();
        if (progression.size() < STABILITY_WINDOW) {
            return true;
        }
        double current = session.getCurrentAbility();
        double variance = progression.subList(progression.size() - STABILITY_WINDOW, progression.size()).stream()
                .mapToDouble(entry -> {
                    double diff = entry.previousEstimate() - current;
                    return diff * diff;
                })
                .average()
                .orElse(0.0);
        return variance >= session.getTargetPrecision();
    }

    public void end(DiagnosisSession session) {
        requireStatus(session, DiagnosisStatus.IN_PROGRESS, "end");
        session.setStatus(DiagnosisStatus.COMPLETED);
        session.setEndedAt(Instant.now(clock));
        session.setAccuracyRate((double) session.getCorrectAnswers() / Math.max(1, session.getQuestionsAnswered()));
        session.setPendingQuestion(null);
    }

    public void cancel(DiagnosisSession session) {
        DiagnosisStatus status = session.getStatus();
        if (status != DiagnosisStatus.PENDING && status != DiagnosisStatus.IN_PROGRESS) {
            throw invalid(session, "cancel");
        }
        session.setStatus(DiagnosisStatus.CANCELLED);
        session.setEndedAt(Instant.now(clock));
        session.setPendingQuestion(null);
    }

    private void requireStatus(DiagnosisSession session, DiagnosisStatus expected, String transition) {
        if (session.getStatus() != expected) {
            throw invalid(session, transition);
        }
    }

    private InvalidStateTransitionException invalid(DiagnosisSession session, String transition) {
        return new InvalidStateTransitionException(
                session.getStatus().name(),
                transition,
                "Cannot " + transition + " session " + session.getId() + " in status " + session.getStatus()
        );
    }
}
