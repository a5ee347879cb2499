package uk.gegc.diagnosis.features.selection.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.diagnosis.features.diagnosis.domain.model.DifficultyRange;
import uk.gegc.diagnosis.features.questionbank.application.QuestionBank;
import uk.gegc.diagnosis.features.questionbank.application.QuestionBank.CandidateQuestion;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Maps an ability estimate to a target difficulty and picks the best matching item.
 * <p>
 * Candidates whose knowledge point is not yet covered in the session always win over
 * covered ones; ties break on distance from the target difficulty, then on question id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItemSelector {

    private static final int CENTER_DIFFICULTY = 3;
    private static final BigDecimal ABILITY_TO_DIFFICULTY = new BigDecimal("0.5");

    private final QuestionBank questionBank;

    /**
     * Suggested difficulty for an ability on the [-3, 3] scale. Halves round away from zero,
     * so the scale ends map onto the difficulty ends.
     */
    public static int suggestDifficulty(double ability) {
        int offset = BigDecimal.valueOf(ability)
                .multiply(ABILITY_TO_DIFFICULTY)
                .setScale(6, RoundingMode.HALF_UP)
                .setScale(0, RoundingMode.HALF_UP)
                .intValue();
        return Math.max(DifficultyRange.LOWEST, Math.min(DifficultyRange.HIGHEST, CENTER_DIFFICULTY + offset));
    }

    public int targetDifficulty(SelectionRequest request) {
        DifficultyRange range = request.effectiveRange();
        return request.adaptive()
                ? range.clamp(suggestDifficulty(request.ability()))
                : range.midpoint();
    }

    public ItemSelection select(SelectionRequest request) {
        DifficultyRange range = request.effectiveRange();
        int target = targetDifficulty(request);

        List<CandidateQuestion> candidates = new ArrayList<>();
        for (int difficulty = range.getMin(); difficulty <= range.getMax(); difficulty++) {
            candidates.addAll(questionBank.fetchCandidates(
                    request.subjectId(),
                    request.knowledgePointFilter(),
                    difficulty,
                    request.servedQuestionIds()
            ));
        }

        Set<String> served = request.servedQuestionIds() == null ? Set.of() : request.servedQuestionIds();
        Set<String> covered = request.coveredKnowledgePoints() == null ? Set.of() : request.coveredKnowledgePoints();

        return candidates.stream()
                .filter(c -> !served.contains(c.questionId()))
                .min(Comparator
                        .comparing((CandidateQuestion c) -> covered.contains(c.knowledgePointId()))
                        .thenComparingInt(c -> Math.abs(c.difficulty() - target))
                        .thenComparing(CandidateQuestion::questionId))
                .map(chosen -> {
                    log.debug("Selected question {} (kp={}, difficulty={}) for target difficulty {}",
                            chosen.questionId(), chosen.knowledgePointId(), chosen.difficulty(), target);
                    return new ItemSelection(target, chosen);
                })
                .orElseGet(() -> {
                    log.debug("No candidate left in difficulty range {}..{}", range.getMin(), range.getMax());
                    return ItemSelection.exhausted(target);
                });
    }
}
