package com.chambua.qualifiers.model;

/**
 * Outcome of a historical base-rate lookup. A probability is carried only for
 * {@link LookupLevel#RANK} and {@link LookupLevel#BUCKET}; use the factories
 * rather than the canonical constructor.
 */
public record HistoricalMatch(LookupLevel level, Double probability) {

    private static final HistoricalMatch NONE = new HistoricalMatch(LookupLevel.NONE, null);

    public HistoricalMatch {
        if (level == null) throw new IllegalArgumentException("level is required");
        if (level == LookupLevel.NONE && probability != null) {
            throw new IllegalArgumentException("NONE lookup cannot carry a probability");
        }
        if (level != LookupLevel.NONE) {
            if (probability == null || probability < 0.0 || probability > 1.0) {
                throw new IllegalArgumentException("Historical probability must be within [0,1]: " + probability);
            }
        }
    }

    public static HistoricalMatch rank(double probability) {
        return new HistoricalMatch(LookupLevel.RANK, probability);
    }

    public static HistoricalMatch bucket(double probability) {
        return new HistoricalMatch(LookupLevel.BUCKET, probability);
    }

    public static HistoricalMatch none() {
        return NONE;
    }

    public boolean isPresent() {
        return level != LookupLevel.NONE;
    }
}
