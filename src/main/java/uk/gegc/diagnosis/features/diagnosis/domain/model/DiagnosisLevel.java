package uk.gegc.diagnosis.features.diagnosis.domain.model;

/**
 * Cognitive level a session assesses. Each level prefers its own difficulty band.
 */
public enum DiagnosisLevel {
    MEMORY(1, 2),
    APPLICATION(2, 4),
    TRANSFER(3, 5);

    private final int minDifficulty;
    private final int maxDifficulty;

    DiagnosisLevel(int minDifficulty, int maxDifficulty) {
        this.minDifficulty = minDifficulty;
        this.maxDifficulty = maxDifficulty;
    }

    public int getMinDifficulty() {
        return minDifficulty;
    }

    public int getMaxDifficulty() {
        return maxDifficulty;
    }
}
