package com.chambua.qualifiers.service;

import com.chambua.qualifiers.config.BlendingProperties;
import com.chambua.qualifiers.model.BlendOutcome;
import com.chambua.qualifiers.model.HistoricalMatch;
import com.chambua.qualifiers.model.QualificationStatus;
import com.chambua.qualifiers.model.StandingRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Combines a current-form score with the historical base rate into P(fill slot) in percent.
 *
 * <ol>
 *   <li>Counters are validated first; qualified teams are then 100.00 and skip everything else.</li>
 *   <li>Form = rank score (5..70) + points-per-game score (0..20) + goal-difference score (0..8),
 *       so the form score stays within [5, 98] and never reaches either clamp bound.</li>
 *   <li>Weighted average with the historical rate (×100); form alone when there is no match.</li>
 *   <li>Confederation multiplier, clamp, round HALF_UP to two decimals.</li>
 * </ol>
 */
@Component
public class ProbabilityBlender {

    private static final double GOAL_DIFF_CAP = 10.0;
    private static final double PPG_MAX = 3.0;
    private static final double PPG_WEIGHT = 20.0;
    private static final double GOAL_DIFF_WEIGHT = 0.4;

    private final BlendingProperties properties;

    public ProbabilityBlender(BlendingProperties properties) {
        this.properties = properties;
    }

    public BlendOutcome blend(StandingRow row, HistoricalMatch historical) {
        validate(row);
        if (row.status() == QualificationStatus.QUALIFIED) {
            return BlendOutcome.qualified();
        }

        double form = formScore(row);
        double wForm = properties.getFormWeight();
        double wHist = properties.getHistoricalWeight();
        if (wForm < 0 || wHist < 0 || wForm + wHist <= 0) {
            throw new IllegalStateException("Blend weights must be non-negative with a positive sum");
        }

        Double hist = historical.isPresent() ? historical.probability() * 100.0 : null;
        double blended = switch (historical.level()) {
            case RANK, BUCKET -> (wForm * form + wHist * hist) / (wForm + wHist);
            case NONE -> form;
        };

        double adjusted = blended * properties.multiplierFor(row.confederation());
        double lower = Math.max(0.0, properties.getMinProbability());
        double upper = Math.min(100.0, properties.getMaxProbability());
        double clamped = Math.max(lower, Math.min(upper, adjusted));
        double rounded = BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
        return new BlendOutcome(rounded, historical.level(), form, hist);
    }

    double formScore(StandingRow row) {
        return rankScore(row.rank()) + ppgScore(row.points(), row.played()) + goalDiffScore(row.goalDiff());
    }

    static double rankScore(Integer rank) {
        if (rank == null) return 5;
        if (rank <= 2) return 70;
        if (rank == 3) return 50;
        if (rank == 4) return 30;
        if (rank == 5) return 15;
        return 5;
    }

    static double ppgScore(int points, int played) {
        if (played <= 0) return 0;
        double ppg = Math.min(PPG_MAX, (double) points / played);
        return PPG_WEIGHT * ppg / PPG_MAX;
    }

    // capped to ±10, shifted to [0, 20], then weighted
    static double goalDiffScore(int goalDiff) {
        double capped = Math.max(-GOAL_DIFF_CAP, Math.min(GOAL_DIFF_CAP, goalDiff));
        return GOAL_DIFF_WEIGHT * (capped + GOAL_DIFF_CAP);
    }

    private static void validate(StandingRow row) {
        if (row.rank() != null && row.rank() < 1) {
            throw new InvalidStandingException("Rank must be at least 1: " + row.rank());
        }
        if (row.played() < 0) {
            throw new InvalidStandingException("Games played cannot be negative: " + row.played());
        }
        if (row.points() < 0) {
            throw new InvalidStandingException("Points cannot be negative: " + row.points());
        }
    }
}
