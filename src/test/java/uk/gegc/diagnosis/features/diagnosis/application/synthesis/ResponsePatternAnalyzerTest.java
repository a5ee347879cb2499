package uk.gegc.diagnosis.features.diagnosis.application.synthesis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.diagnosis.BaseUnitTest;
import uk.gegc.diagnosis.features.diagnosis.domain.model.AbilityProgressionEntry;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisSession;
import uk.gegc.diagnosis.features.diagnosis.domain.model.QuestionResponse;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis.Trend;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ResponsePatternAnalyzer Tests")
class ResponsePatternAnalyzerTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ResponsePatternAnalyzer analyzer = new ResponsePatternAnalyzer();

    @Test
    @DisplayName("analyze summarizes accuracy, timing, difficulties and trajectory")
    void analyze_summarizesSession() {
        DiagnosisSession session = new DiagnosisSession();
        session.appendProgression(new AbilityProgressionEntry(0, 0.0, 0.1, true, 3, NOW));
        session.appendProgression(new AbilityProgressionEntry(1, 0.1, 0.2, true, 4, NOW));
        session.appendProgression(new AbilityProgressionEntry(2, 0.2, 0.1, false, 4, NOW));
        List<QuestionResponse> responses = List.of(
                response(3, true, 30),
                response(4, true, 60),
                response(4, false, 90)
        );

        ResponsePatternAnalysis analysis = analyzer.analyze(session, responses);

        assertThat(analysis.totalQuestions()).isEqualTo(3);
        assertThat(analysis.correctAnswers()).isEqualTo(2);
        assertThat(analysis.accuracy()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(analysis.averageTimeSeconds()).isEqualTo(60.0);
        assertThat(analysis.difficultyProgression()).containsExactly(3, 4, 4);
        assertThat(analysis.abilityTrajectory()).containsExactly(0.1, 0.2, 0.1);
        assertThat(analysis.efficiency()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(analysis.consistencyScore()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("analyze of an unanswered session is neutral")
    void analyze_empty() {
        ResponsePatternAnalysis analysis = analyzer.analyze(new DiagnosisSession(), List.of());

        assertThat(analysis.totalQuestions()).isZero();
        assertThat(analysis.accuracy()).isZero();
        assertThat(analysis.efficiency()).isZero();
        assertThat(analysis.consistencyScore()).isEqualTo(1.0);
        assertThat(analysis.trend()).isEqualTo(Trend.STABLE);
    }

    @Test
    @DisplayName("a flat trajectory is perfectly consistent")
    void consistency_flat() {
        assertThat(ResponsePatternAnalyzer.consistency(List.of(0.5, 0.5, 0.5, 0.5))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("consistency only looks at the last five estimates")
    void consistency_usesWindow() {
        double score = ResponsePatternAnalyzer.consistency(List.of(-3.0, 3.0, 1.0, 1.0, 1.0, 1.0, 1.0));

        assertThat(score).isEqualTo(1.0);
    }

    @Test
    @DisplayName("an oscillating trajectory is less consistent than a flat one")
    void consistency_oscillating() {
        double score = ResponsePatternAnalyzer.consistency(List.of(1.0, -1.0, 1.0, -1.0, 1.0));

        assertThat(score).isLessThan(1.0).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("trend follows the slope of the trajectory")
    void trend_followsSlope() {
        assertThat(ResponsePatternAnalyzer.trend(List.of(0.1, 0.2, 0.3))).isEqualTo(Trend.IMPROVING);
        assertThat(ResponsePatternAnalyzer.trend(List.of(0.3, 0.2, 0.1))).isEqualTo(Trend.DECLINING);
        assertThat(ResponsePatternAnalyzer.trend(List.of(0.2, 0.2, 0.2))).isEqualTo(Trend.STABLE);
        assertThat(ResponsePatternAnalyzer.trend(List.of(0.2))).isEqualTo(Trend.STABLE);
    }

    private static QuestionResponse response(int difficulty, boolean correct, int seconds) {
        QuestionResponse response = new QuestionResponse();
        response.setQuestionId("q-" + difficulty);
        response.setKnowledgePointId("kp-a");
        response.setDifficulty(difficulty);
        response.setCorrect(correct);
        response.setTimeSpentSeconds(seconds);
        response.setAnsweredAt(NOW);
        return response;
    }
}
