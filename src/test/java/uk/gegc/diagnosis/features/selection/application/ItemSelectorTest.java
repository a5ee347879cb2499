package uk.gegc.diagnosis.features.selection.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import uk.gegc.diagnosis.BaseUnitTest;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DiagnosisLevel;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DifficultyRange;
import uk.gegc.diagnosis.features.questionbank.application.QuestionBank;
import uk.gegc.diagnosis.features.questionbank.application.QuestionBank.CandidateQuestion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ItemSelector Tests")
class ItemSelectorTest extends BaseUnitTest {

    private static final String SUBJECT = "math";

    @Mock
    private QuestionBank questionBank;

    private ItemSelector selector;
    private List<CandidateQuestion> pool;

    @BeforeEach
    void setUp() {
        selector = new ItemSelector(questionBank);
        pool = new ArrayList<>();
    }

    @ParameterizedTest(name = "ability {0} -> difficulty {1}")
    @CsvSource({
            "0.0, 3",
            "3.0, 5",
            "-3.0, 1",
            "1.0, 4",
            "-1.0, 2",
            "2.0, 4",
            "0.4, 3",
            "0.30000000000000004, 3"
    })
    @DisplayName("suggestDifficulty maps the ability scale onto 1..5")
    void suggestDifficulty_mapsScale(double ability, int expected) {
        assertThat(ItemSelector.suggestDifficulty(ability)).isEqualTo(expected);
    }

    @Test
    @DisplayName("suggestDifficulty always stays within 1..5")
    void suggestDifficulty_staysInBounds() {
        for (double ability = -3.0; ability <= 3.0; ability += 0.1) {
            assertThat(ItemSelector.suggestDifficulty(ability)).isBetween(1, 5);
        }
    }

    @Test
    @DisplayName("targetDifficulty is clamped into the effective range")
    void targetDifficulty_clampedIntoRange() {
        SelectionRequest request = request(new DifficultyRange(1, 2), true, 3.0, Set.of(), Set.of());

        assertThat(selector.targetDifficulty(request)).isEqualTo(2);
    }

    @Test
    @DisplayName("targetDifficulty ignores ability when adaptive selection is off")
    void targetDifficulty_nonAdaptiveUsesMidpoint() {
        SelectionRequest request = request(DifficultyRange.full(), false, 3.0, Set.of(), Set.of());

        assertThat(selector.targetDifficulty(request)).isEqualTo(3);
    }

    @Test
    @DisplayName("select prefers an uncovered knowledge point over a closer difficulty match")
    void select_prefersUncoveredKnowledgePoint() {
        pool.add(candidate("q-1", "kp-a", 3));
        pool.add(candidate("q-2", "kp-b", 5));
        stubPool();

        ItemSelection selection = selector.select(
                request(DifficultyRange.full(), true, 0.0, Set.of("q-0"), Set.of("kp-a")));

        assertThat(selection.isExhausted()).isFalse();
        assertThat(selection.question().questionId()).isEqualTo("q-2");
        assertThat(selection.suggestedDifficulty()).isEqualTo(3);
    }

    @Test
    @DisplayName("select falls back to covered knowledge points by difficulty distance")
    void select_fallsBackToCoveredKnowledgePoints() {
        pool.add(candidate("q-1", "kp-a", 1));
        pool.add(candidate("q-2", "kp-a", 4));
        pool.add(candidate("q-3", "kp-b", 5));
        stubPool();

        ItemSelection selection = selector.select(
                request(DifficultyRange.full(), true, 0.0, Set.of(), Set.of("kp-a", "kp-b")));

        assertThat(selection.question().questionId()).isEqualTo("q-2");
    }

    @Test
    @DisplayName("select breaks ties by question id")
    void select_breaksTiesByQuestionId() {
        pool.add(candidate("q-9", "kp-a", 2));
        pool.add(candidate("q-3", "kp-b", 4));
        stubPool();

        ItemSelection selection = selector.select(
                request(DifficultyRange.full(), true, 0.0, Set.of(), Set.of()));

        assertThat(selection.question().questionId()).isEqualTo("q-3");
    }

    @Test
    @DisplayName("select never returns an already served question")
    void select_skipsServedQuestions() {
        pool.add(candidate("q-1", "kp-a", 3));
        pool.add(candidate("q-2", "kp-a", 2));
        stubPool();

        ItemSelection selection = selector.select(
                request(DifficultyRange.full(), true, 0.0, Set.of("q-1"), Set.of()));

        assertThat(selection.question().questionId()).isEqualTo("q-2");
    }

    @Test
    @DisplayName("select queries every difficulty of the effective range")
    void select_queriesEachDifficultyOfRange() {
        stubPool();

        DifficultyRange applicationBand = DifficultyRange.full().narrowTo(DiagnosisLevel.APPLICATION);

        selector.select(request(applicationBand, true, 0.0, Set.of(), Set.of()));

        verify(questionBank, times(3)).fetchCandidates(eq(SUBJECT), any(), anyInt(), any());
    }

    @Test
    @DisplayName("select reports exhaustion when no candidate is left")
    void select_exhausted() {
        stubPool();

        ItemSelection selection = selector.select(
                request(DifficultyRange.full(), true, 1.0, Set.of(), Set.of()));

        assertThat(selection.isExhausted()).isTrue();
        assertThat(selection.question()).isNull();
        assertThat(selection.suggestedDifficulty()).isEqualTo(4);
    }

    private void stubPool() {
        when(questionBank.fetchCandidates(eq(SUBJECT), any(), anyInt(), any())).thenAnswer(invocation -> {
            int difficulty = invocation.getArgument(2);
            Collection<String> excluded = invocation.getArgument(3);
            return pool.stream()
                    .filter(c -> c.difficulty() == difficulty)
                    .filter(c -> excluded == null || !excluded.contains(c.questionId()))
                    .toList();
        });
    }

    private static SelectionRequest request(DifficultyRange range, boolean adaptive, double ability,
                                            Set<String> served, Set<String> covered) {
        return new SelectionRequest(SUBJECT, List.of(), range, adaptive, ability, served, covered);
    }

    private static CandidateQuestion candidate(String id, String kp, int difficulty) {
        return new CandidateQuestion(id, kp, difficulty, "Question " + id, "MCQ_SINGLE");
    }
}
