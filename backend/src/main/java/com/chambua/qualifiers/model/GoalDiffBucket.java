package com.chambua.qualifiers.model;

public enum GoalDiffBucket {
    TEN_OR_MORE(">=10"),
    FIVE_TO_NINE("5-9"),
    ZERO_TO_FOUR("0-4"),
    MINUS_FOUR_TO_MINUS_ONE("-4--1"),
    MINUS_NINE_TO_MINUS_FIVE("-9--5"),
    MINUS_TEN_OR_LESS("<=-10");

    private final String label;

    GoalDiffBucket(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public static GoalDiffBucket of(int goalDiff) {
        if (goalDiff >= 10) return TEN_OR_MORE;
        if (goalDiff >= 5) return FIVE_TO_NINE;
        if (goalDiff >= 0) return ZERO_TO_FOUR;
        if (goalDiff >= -4) return MINUS_FOUR_TO_MINUS_ONE;
        if (goalDiff >= -9) return MINUS_NINE_TO_MINUS_FIVE;
        return MINUS_TEN_OR_LESS;
    }
}
