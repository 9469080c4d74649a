package com.chambua.qualifiers.model;

/**
 * @param probability        final value in [0,100], two decimals
 * @param formComponent      current-form score before blending, null for qualified teams
 * @param historicalComponent historical rate scaled to 0-100, null when no historical signal was used
 */
public record BlendOutcome(double probability, LookupLevel level, Double formComponent, Double historicalComponent) {

    public static BlendOutcome qualified() {
        return new BlendOutcome(100.0, LookupLevel.NONE, null, null);
    }
}
