package uk.gegc.diagnosis.features.diagnosis.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DifficultyRange {

    public static final int LOWEST = 1;
    public static final int HIGHEST = 5;

    @Column(name = "min_difficulty", nullable = false)
    private int min;

    @Column(name = "max_difficulty", nullable = false)
    private int max;

    public DifficultyRange(int min, int max) {
        if (min < LOWEST || max > HIGHEST || min > max) {
            throw new IllegalArgumentException("Difficulty range must satisfy 1 <= min <= max <= 5");
        }
        this.min = min;
        this.max = max;
    }

    public static DifficultyRange full() {
        return new DifficultyRange(LOWEST, HIGHEST);
    }

    /**
     * Narrows this range to the level band, keeping this range when they do not overlap.
     */
    public DifficultyRange narrowTo(DiagnosisLevel level) {
        int lower = Math.max(min, level.getMinDifficulty());
        int upper = Math.min(max, level.getMaxDifficulty());
        return lower <= upper ? new DifficultyRange(lower, upper) : this;
    }

    public int clamp(int difficulty) {
        return Math.max(min, Math.min(max, difficulty));
    }

    public int midpoint() {
        return (min + max) / 2;
    }
}
