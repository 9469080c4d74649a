package com.chambua.qualifiers.model;

import java.util.Objects;

/**
 * One team's position in its qualifying group, captured for a single run.
 * {@code stage} falls back to the group name when the source does not report one.
 */
public record StandingRow(String team,
                          Confederation confederation,
                          String group,
                          String stage,
                          Integer rank,
                          int points,
                          int played,
                          int goalDiff,
                          QualificationStatus status) {

    public StandingRow {
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(confederation, "confederation");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(status, "status");
        if (stage == null || stage.isBlank()) stage = group;
    }

    public StandingRow(String team, Confederation confederation, String group, Integer rank,
                       int points, int played, int goalDiff, QualificationStatus status) {
        this(team, confederation, group, null, rank, points, played, goalDiff, status);
    }
}
