package com.chambua.qualifiers.model;

public enum RankBucket {
    FIRST("1"),
    SECOND("2"),
    THIRD_FOURTH("3-4"),
    FIFTH("5"),
    SIXTH_OR_LOWER("6+");

    private final String label;

    RankBucket(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /** Unranked rows (null) share the bottom bucket. */
    public static RankBucket of(Integer rank) {
        if (rank == null) return SIXTH_OR_LOWER;
        if (rank == 1) return FIRST;
        if (rank == 2) return SECOND;
        if (rank == 3 || rank == 4) return THIRD_FOURTH;
        if (rank == 5) return FIFTH;
        return SIXTH_OR_LOWER;
    }

    public static RankBucket fromLabel(String label) {
        for (RankBucket b : values()) {
            if (b.label.equals(label)) return b;
        }
        throw new IllegalArgumentException("Unknown rank bucket: " + label);
    }
}
