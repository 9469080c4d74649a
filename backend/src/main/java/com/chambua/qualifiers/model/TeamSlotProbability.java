package com.chambua.qualifiers.model;

import com.chambua.qualifiers.util.TeamNameNormalizer;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "team_slot_probabilities", uniqueConstraints = {
        @UniqueConstraint(name = "uniq_team_group", columnNames = {"team", "confederation", "current_group"})
}, indexes = {
        @Index(name = "idx_team_slot_prob_confed", columnList = "confederation"),
        @Index(name = "idx_team_slot_prob_status", columnList = "qualification_status"),
        @Index(name = "idx_team_slot_prob_prob", columnList = "prob_fill_slot")
})
public class TeamSlotProbability {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String team;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Confederation confederation;

    @Column(name = "current_group", nullable = false)
    private String currentGroup;

    @Enumerated(EnumType.STRING)
    @Column(name = "qualification_status", nullable = false, length = 16)
    private QualificationStatus qualificationStatus;

    @Column(name = "prob_fill_slot", nullable = false, precision = 5, scale = 2)
    private BigDecimal probFillSlot;

    private Integer position;
    private Integer points;
    private Integer played;

    @Column(name = "goal_diff")
    private Integer goalDiff;

    @Enumerated(EnumType.STRING)
    @Column(name = "lookup_level", length = 16)
    private LookupLevel lookupLevel;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public TeamSlotProbability() {}

    public TeamSlotProbability(String team, Confederation confederation, String currentGroup) {
        this.team = team;
        this.confederation = confederation;
        this.currentGroup = currentGroup;
    }

    /** Overwrites every non-key column from a fresh result (last write wins). */
    public void applyResult(ProbabilityResult result, Instant now) {
        // key is case-insensitive; the latest spelling wins for display
        this.team = TeamNameNormalizer.clean(result.team());
        this.currentGroup = TeamNameNormalizer.clean(result.group());
        this.qualificationStatus = result.status();
        this.probFillSlot = BigDecimal.valueOf(result.probFillSlot()).setScale(2, java.math.RoundingMode.HALF_UP);
        this.position = result.position();
        this.points = result.points();
        this.played = result.played();
        this.goalDiff = result.goalDiff();
        this.lookupLevel = result.lookupLevel();
        this.updatedAt = now;
    }

    public ProbabilityResult toResult() {
        return new ProbabilityResult(team, confederation, currentGroup, position, points, played, goalDiff,
                probFillSlot == null ? 0.0 : probFillSlot.doubleValue(), qualificationStatus, lookupLevel);
    }

    public String storeKey() {
        return TeamKeys.storeKey(team, confederation, currentGroup);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public Confederation getConfederation() { return confederation; }
    public void setConfederation(Confederation confederation) { this.confederation = confederation; }
    public String getCurrentGroup() { return currentGroup; }
    public void setCurrentGroup(String currentGroup) { this.currentGroup = currentGroup; }
    public QualificationStatus getQualificationStatus() { return qualificationStatus; }
    public void setQualificationStatus(QualificationStatus qualificationStatus) { this.qualificationStatus = qualificationStatus; }
    public BigDecimal getProbFillSlot() { return probFillSlot; }
    public void setProbFillSlot(BigDecimal probFillSlot) { this.probFillSlot = probFillSlot; }
    public Integer getPosition() { return position; }
    public void setPosition(Integer position) { this.position = position; }
    public Integer getPoints() { return points; }
    public void setPoints(Integer points) { this.points = points; }
    public Integer getPlayed() { return played; }
    public void setPlayed(Integer played) { this.played = played; }
    public Integer getGoalDiff() { return goalDiff; }
    public void setGoalDiff(Integer goalDiff) { this.goalDiff = goalDiff; }
    public LookupLevel getLookupLevel() { return lookupLevel; }
    public void setLookupLevel(LookupLevel lookupLevel) { this.lookupLevel = lookupLevel; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
