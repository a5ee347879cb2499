package uk.gegc.diagnosis.features.diagnosis.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.diagnosis.BaseUnitTest;
import uk.gegc.diagnosis.features.ability.application.impl.DifficultyWeightedAbilityEstimator;
import uk.gegc.diagnosis.features.diagnosis.domain.model.AbilityProgressionEntry;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisSession;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisStatus;
import uk.gegc.diagnosis.shared.exception.InvalidStateTransitionException;
import uk.gegc.diagnosis.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SessionStateMachine Tests")
class SessionStateMachineTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SessionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new SessionStateMachine(
                new DifficultyWeightedAbilityEstimator(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("start moves PENDING to IN_PROGRESS and records the start time")
    void start_fromPending() {
        DiagnosisSession session = session(10, 30, 0.3);

        stateMachine.start(session);

        assertThat(session.getStatus()).isEqualTo(DiagnosisStatus.IN_PROGRESS);
        assertThat(session.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("recordAnswer updates estimate, counters, SE and progression")
    void recordAnswer_updatesState() {
        DiagnosisSession session = started(10, 30, 0.3);

        AbilityProgressionEntry first = stateMachine.recordAnswer(session, true, 4);
        stateMachine.recordAnswer(session, false, 2);
        stateMachine.recordAnswer(session, true, 3);

        assertThat(first.previousEstimate()).isEqualTo(0.0);
        assertThat(first.newEstimate()).isCloseTo(0.1, within(1e-9));
        assertThat(first.difficulty()).isEqualTo(4);
        assertThat(first.timestamp()).isEqualTo(NOW);
        assertThat(session.getCurrentAbility()).isCloseTo(0.1, within(1e-9));
        assertThat(session.getQuestionsAnswered()).isEqualTo(3);
        assertThat(session.getCorrectAnswers()).isEqualTo(2);
        assertThat(session.getCurrentQuestionIndex()).isEqualTo(3);
        assertThat(session.getAbilityStandardError()).isCloseTo(1 / Math.sqrt(3), within(1e-9));
        assertThat(session.getAbilityProgression()).hasSize(3);
        assertThat(session.getAbilityProgression().get(1).questionIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("counters never decrease and correct answers never exceed answered")
    void recordAnswer_countersMonotonic() {
        DiagnosisSession session = started(1, 20, 0.3);
        int previousAnswered = 0;
        int previousCorrect = 0;

        for (int i = 0; i < 20; i++) {
            stateMachine.recordAnswer(session, i % 3 == 0, 1 + i % 5);

            assertThat(session.getQuestionsAnswered()).isGreaterThan(previousAnswered);
            assertThat(session.getCorrectAnswers()).isGreaterThanOrEqualTo(previousCorrect);
            assertThat(session.getCorrectAnswers()).isLessThanOrEqualTo(session.getQuestionsAnswered());
            assertThat(session.getCurrentAbility()).isBetween(-3.0, 3.0);
            previousAnswered = session.getQuestionsAnswered();
            previousCorrect = session.getCorrectAnswers();
        }
    }

    @Test
    @DisplayName("recordAnswer at the question limit is rejected and leaves the session unchanged")
    void recordAnswer_atMax_rejected() {
        DiagnosisSession session = started(1, 2, 0.3);
        stateMachine.recordAnswer(session, true, 3);
        stateMachine.recordAnswer(session, true, 3);
        double ability = session.getCurrentAbility();

        assertThatThrownBy(() -> stateMachine.recordAnswer(session, true, 3))
                .isInstanceOf(InvalidStateTransitionException.class);

        assertThat(session.getQuestionsAnswered()).isEqualTo(2);
        assertThat(session.getCorrectAnswers()).isEqualTo(2);
        assertThat(session.getCurrentAbility()).isEqualTo(ability);
        assertThat(session.getAbilityProgression()).hasSize(2);
    }

    @Test
    @DisplayName("recordAnswer on a completed session fails without touching counters")
    void recordAnswer_onCompleted_rejected() {
        DiagnosisSession session = started(1, 10, 0.3);
        stateMachine.recordAnswer(session, true, 3);
        stateMachine.end(session);

        assertThatThrownBy(() -> stateMachine.recordAnswer(session, true, 3))
                .isInstanceOf(InvalidStateTransitionException.class)
                .satisfies(ex -> {
                    InvalidStateTransitionException e = (InvalidStateTransitionException) ex;
                    assertThat(e.getCurrentState()).isEqualTo("COMPLETED");
                    assertThat(e.getAttemptedTransition()).isEqualTo("recordAnswer");
                });

        assertThat(session.getQuestionsAnswered()).isEqualTo(1);
        assertThat(session.getCorrectAnswers()).isEqualTo(1);
    }

    @Test
    @DisplayName("recordAnswer rejects difficulties outside 1..5")
    void recordAnswer_invalidDifficulty() {
        DiagnosisSession session = started(1, 10, 0.3);

        assertThatThrownBy(() -> stateMachine.recordAnswer(session, true, 6))
                .isInstanceOf(ValidationException.class);
        assertThat(session.getQuestionsAnswered()).isZero();
    }

    @Test
    @DisplayName("shouldContinue keeps going below the minimum")
    void shouldContinue_belowMin() {
        DiagnosisSession session = started(10, 30, 0.3);
        for (int i = 0; i < 9; i++) {
            stateMachine.recordAnswer(session, true, 3);
        }

        assertThat(stateMachine.shouldContinue(session)).isTrue();
    }

    @Test
    @DisplayName("shouldContinue stops once the estimate is stable after the minimum")
    void shouldContinue_stableAfterMin() {
        DiagnosisSession session = started(10, 30, 0.3);
        for (int i = 0; i < 10; i++) {
            stateMachine.recordAnswer(session, true, 3);
        }

        assertThat(stateMachine.shouldContinue(session)).isFalse();
    }

    @Test
    @DisplayName("shouldContinue stops at the maximum whatever the precision")
    void shouldContinue_stopsAtMax() {
        DiagnosisSession session = started(10, 30, 1e-6);
        int answered = 0;
        while (stateMachine.shouldContinue(session)) {
            stateMachine.recordAnswer(session, answered % 2 == 0, 3);
            answered++;
        }

        assertThat(session.getQuestionsAnswered()).isEqualTo(30);
    }

    @Test
    @DisplayName("a full run always stops between the minimum and maximum")
    void shouldContinue_stopsWithinBounds() {
        DiagnosisSession session = started(10, 30, 0.3);
        while (stateMachine.shouldContinue(session)) {
            stateMachine.recordAnswer(session, session.getQuestionsAnswered() % 4 != 0, 3);
        }

        assertThat(session.getQuestionsAnswered()).isBetween(10, 30);
    }

    @Test
    @DisplayName("shouldContinue continues with fewer than five progression entries")
    void shouldContinue_shortProgression() {
        DiagnosisSession session = started(3, 10, 100.0);
        for (int i = 0; i < 4; i++) {
            stateMachine.recordAnswer(session, true, 3);
        }

        assertThat(stateMachine.shouldContinue(session)).isTrue();
    }

    @Test
    @DisplayName("end computes accuracy and clears the pending question")
    void end_computesAccuracy() {
        DiagnosisSession session = started(1, 10, 0.3);
        stateMachine.recordAnswer(session, true, 3);
        stateMachine.recordAnswer(session, false, 3);
        stateMachine.recordAnswer(session, true, 3);
        stateMachine.recordAnswer(session, true, 3);

        stateMachine.end(session);

        assertThat(session.getStatus()).isEqualTo(DiagnosisStatus.COMPLETED);
        assertThat(session.getAccuracyRate()).isEqualTo(0.75);
        assertThat(session.getEndedAt()).isEqualTo(NOW);
        assertThat(session.getPendingQuestion()).isNull();
    }

    @Test
    @DisplayName("end with no answers yields zero accuracy")
    void end_noAnswers() {
        DiagnosisSession session = started(1, 10, 0.3);

        stateMachine.end(session);

        assertThat(session.getAccuracyRate()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("end twice is an invalid transition")
    void end_twice_rejected() {
        DiagnosisSession session = started(1, 10, 0.3);
        stateMachine.end(session);

        assertThatThrownBy(() -> stateMachine.end(session))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(session.getStatus()).isEqualTo(DiagnosisStatus.COMPLETED);
    }

    @Test
    @DisplayName("cancel works from PENDING and IN_PROGRESS only")
    void cancel_transitions() {
        DiagnosisSession pending = session(1, 10, 0.3);
        DiagnosisSession running = started(1, 10, 0.3);
        DiagnosisSession completed = started(1, 10, 0.3);
        stateMachine.end(completed);

        stateMachine.cancel(pending);
        stateMachine.cancel(running);

        assertThat(pending.getStatus()).isEqualTo(DiagnosisStatus.CANCELLED);
        assertThat(running.getStatus()).isEqualTo(DiagnosisStatus.CANCELLED);
        assertThatThrownBy(() -> stateMachine.cancel(completed))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(completed.getStatus()).isEqualTo(DiagnosisStatus.COMPLETED);
    }

    @Test
    @DisplayName("start on a running session is an invalid transition")
    void start_twice_rejected() {
        DiagnosisSession session = started(1, 10, 0.3);

        assertThatThrownBy(() -> stateMachine.start(session))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    private DiagnosisSession started(int min, int max, double precision) {
        DiagnosisSession session = session(min, max, precision);
        stateMachine.start(session);
        return session;
    }

    private static DiagnosisSession session(int min, int max, double precision) {
        DiagnosisSession session = new DiagnosisSession();
        session.setName("test");
        session.setLevel(DiagnosisLevel.APPLICATION);
        session.setMinQuestions(min);
        session.setMaxQuestions(max);
        session.setTargetPrecision(precision);
        return session;
    }
}
