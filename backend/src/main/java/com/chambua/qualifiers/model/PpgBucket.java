package com.chambua.qualifiers.model;

public enum PpgBucket {
    TWO_OR_MORE(">=2"),
    ONE_FIVE_TO_TWO("1.5-1.99"),
    ONE_TO_ONE_FIVE("1.0-1.49"),
    BELOW_ONE("<1.0");

    private final String label;

    PpgBucket(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /**
     * Points-per-game band, or {@code null} when no games have been played
     * (there is no ratio to classify).
     */
    public static PpgBucket of(int points, int gamesPlayed) {
        if (gamesPlayed <= 0) return null;
        double ppg = (double) points / gamesPlayed;
        if (ppg >= 2.0) return TWO_OR_MORE;
        if (ppg >= 1.5) return ONE_FIVE_TO_TWO;
        if (ppg >= 1.0) return ONE_TO_ONE_FIVE;
        return BELOW_ONE;
    }

    public static PpgBucket fromLabel(String label) {
        for (PpgBucket b : values()) {
            if (b.label.equals(label)) return b;
        }
        throw new IllegalArgumentException("Unknown points-per-game bucket: " + label);
    }
}
