package com.chambua.qualifiers.dto;

import com.chambua.qualifiers.util.TeamNameNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A standings row as delivered by a standings source, before validation.
 * Every field may be missing or malformed; parsing decides whether it becomes a StandingRow.
 */
public class StandingIngestItem {
    private String team;
    private String confederation;
    private String group;
    private String stage;
    private Integer rank;
    private Integer points;
    private Integer played;
    private Integer goalDiff;
    private String status;
    // numeric fields whose source text could not be read, keyed by field name
    private final Map<String, String> unreadableNumbers = new LinkedHashMap<>();

    public StandingIngestItem() {}

    public StandingIngestItem(String team, String confederation, String group, Integer rank,
                              Integer points, Integer played, Integer goalDiff, String status) {
        this(team, confederation, group, null, rank, points, played, goalDiff, status);
    }

    public StandingIngestItem(String team, String confederation, String group, String stage, Integer rank,
                              Integer points, Integer played, Integer goalDiff, String status) {
        this.team = team;
        this.confederation = confederation;
        this.group = group;
        this.stage = stage;
        this.rank = rank;
        this.points = points;
        this.played = played;
        this.goalDiff = goalDiff;
        this.status = status;
    }

    /**
     * Stable single-line form used for the run input hash. Whitespace is collapsed
     * everywhere; team and group keep their spelling so a corrected display name is
     * a new input, while confederation, stage and status are compared case-insensitively.
     * Unreadable numbers contribute their raw text.
     */
    public String canonicalLine() {
        return String.join("|",
                Objects.toString(TeamNameNormalizer.clean(team), ""),
                TeamNameNormalizer.key(confederation),
                Objects.toString(TeamNameNormalizer.clean(group), ""),
                TeamNameNormalizer.key(stage),
                numberText("rank", rank),
                numberText("points", points),
                numberText("played", played),
                numberText("goalDiff", goalDiff),
                TeamNameNormalizer.key(status));
    }

    private String numberText(String field, Integer value) {
        String raw = unreadableNumbers.get(field);
        return raw != null ? "?" + raw : String.valueOf(value);
    }

    /** Records that {@code field} was present in the source but is not a whole number. */
    public void markUnreadable(String field, String rawText) {
        unreadableNumbers.put(field, rawText);
    }

    /** The raw text of an unreadable numeric field, or null when the field was readable or absent. */
    public String unreadableNumber(String field) {
        return unreadableNumbers.get(field);
    }

    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public String getConfederation() { return confederation; }
    public void setConfederation(String confederation) { this.confederation = confederation; }
    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }
    public String getStage() { return stage; }
    public void setStage(String stage) { this.stage = stage; }
    public Integer getRank() { return rank; }
    public void setRank(Integer rank) { this.rank = rank; }
    public Integer getPoints() { return points; }
    public void setPoints(Integer points) { this.points = points; }
    public Integer getPlayed() { return played; }
    public void setPlayed(Integer played) { this.played = played; }
    public Integer getGoalDiff() { return goalDiff; }
    public void setGoalDiff(Integer goalDiff) { this.goalDiff = goalDiff; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    @Override
    public String toString() {
        return "StandingIngestItem{" + canonicalLine() + "}";
    }
}
