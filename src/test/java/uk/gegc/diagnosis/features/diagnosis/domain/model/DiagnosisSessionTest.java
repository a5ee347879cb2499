package uk.gegc.diagnosis.features.diagnosis.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DiagnosisSession Tests")
class DiagnosisSessionTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("progression is append-only from outside the entity")
    void progression_appendOnly() {
        DiagnosisSession session = new DiagnosisSession();
        session.appendProgression(new AbilityProgressionEntry(0, 0.0, 0.1, true, 3, T0));

        List<AbilityProgressionEntry> view = session.getAbilityProgression();

        assertThatThrownBy(() -> view.add(new AbilityProgressionEntry(1, 0.1, 0.0, false, 3, T0)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(view::clear)
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(session.getAbilityProgression()).hasSize(1);
    }

    @Test
    @DisplayName("earlier views do not change when more answers are appended")
    void progression_viewIsSnapshot() {
        DiagnosisSession session = new DiagnosisSession();
        session.appendProgression(new AbilityProgressionEntry(0, 0.0, 0.1, true, 3, T0));
        List<AbilityProgressionEntry> before = session.getAbilityProgression();

        session.appendProgression(new AbilityProgressionEntry(1, 0.1, 0.2, true, 4, T0.plusSeconds(30)));

        assertThat(before).hasSize(1);
        assertThat(session.getAbilityProgression())
                .extracting(AbilityProgressionEntry::questionIndex)
                .containsExactly(0, 1);
    }

    @Test
    @DisplayName("selection log cannot be modified through its getter")
    void selectionLog_appendOnly() {
        DiagnosisSession session = new DiagnosisSession();
        session.appendSelection(new SelectionLogEntry(0, 3, 3, "kp-linear", "q-1", T0));

        assertThatThrownBy(() -> session.getSelectionLog().remove(0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(session.getSelectionLog()).hasSize(1);
    }
}
