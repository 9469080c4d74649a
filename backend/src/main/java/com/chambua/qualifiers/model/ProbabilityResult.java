package com.chambua.qualifiers.model;

/** Blended probability for one team, ready to be written to the current table. */
public record ProbabilityResult(String team,
                                Confederation confederation,
                                String group,
                                Integer position,
                                Integer points,
                                Integer played,
                                Integer goalDiff,
                                double probFillSlot,
                                QualificationStatus status,
                                LookupLevel lookupLevel) {

    public static ProbabilityResult of(StandingRow row, double probability, LookupLevel level) {
        return new ProbabilityResult(row.team(), row.confederation(), row.group(), row.rank(),
                row.points(), row.played(), row.goalDiff(), probability, row.status(), level);
    }

    public static ProbabilityResult host(String team, Confederation confederation, String group) {
        return new ProbabilityResult(team, confederation, group, null, null, null, null,
                100.0, QualificationStatus.QUALIFIED, LookupLevel.NONE);
    }

    /** Natural key used by the store: one current row per team, confederation and group. */
    public String storeKey() {
        return TeamKeys.storeKey(team, confederation, group);
    }
}
