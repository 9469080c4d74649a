package com.chambua.qualifiers.model;

/** {@code ppg} is null when the team has not played yet. */
public record StandingBuckets(RankBucket rank, PpgBucket ppg, GoalDiffBucket goalDiff) {
}
