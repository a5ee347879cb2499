package uk.gegc.diagnosis.features.diagnosis.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DifficultyRange Tests")
class DifficultyRangeTest {

    @Test
    @DisplayName("narrowTo intersects the range with the level band")
    void narrowTo_intersects() {
        DifficultyRange memory = DifficultyRange.full().narrowTo(DiagnosisLevel.MEMORY);
        DifficultyRange transfer = new DifficultyRange(2, 4).narrowTo(DiagnosisLevel.TRANSFER);

        assertThat(memory.getMin()).isEqualTo(1);
        assertThat(memory.getMax()).isEqualTo(2);
        assertThat(transfer.getMin()).isEqualTo(3);
        assertThat(transfer.getMax()).isEqualTo(4);
    }

    @Test
    @DisplayName("narrowTo keeps the report range when the band does not overlap")
    void narrowTo_disjointKeepsRange() {
        DifficultyRange range = new DifficultyRange(4, 5).narrowTo(DiagnosisLevel.MEMORY);

        assertThat(range.getMin()).isEqualTo(4);
        assertThat(range.getMax()).isEqualTo(5);
    }

    @Test
    @DisplayName("clamp and midpoint stay inside the range")
    void clampAndMidpoint() {
        DifficultyRange range = new DifficultyRange(2, 4);

        assertThat(range.clamp(5)).isEqualTo(4);
        assertThat(range.clamp(1)).isEqualTo(2);
        assertThat(range.clamp(3)).isEqualTo(3);
        assertThat(range.midpoint()).isEqualTo(3);
    }

    @Test
    @DisplayName("constructor rejects inverted or out-of-scale bounds")
    void constructor_rejectsInvalid() {
        assertThatThrownBy(() -> new DifficultyRange(4, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DifficultyRange(0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DifficultyRange(1, 6)).isInstanceOf(IllegalArgumentException.class);
    }
}
