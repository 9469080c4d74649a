package com.chambua.qualifiers.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Archived final-ish table position from a past qualifying cycle, with the buckets
 * that were derived for it at import time.
 */
@Entity
@Table(name = "historical_standings", uniqueConstraints = {
        @UniqueConstraint(name = "uniq_historical_entry", columnNames = {"season", "confederation", "stage", "group_name", "team"})
}, indexes = {
        @Index(name = "idx_historical_confed_stage", columnList = "confederation, stage"),
        @Index(name = "idx_historical_season", columnList = "season")
})
public class HistoricalStanding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Integer season;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Confederation confederation;

    @Column(nullable = false)
    private String stage;

    @Column(name = "group_name", nullable = false)
    private String groupName;

    @Column(nullable = false)
    private String team;

    @Column(name = "group_rank")
    private Integer groupRank;

    private Integer points;

    @Column(name = "games_played")
    private Integer gamesPlayed;

    private Integer wins;
    private Integer draws;
    private Integer losses;

    @Column(name = "goals_for")
    private Integer goalsFor;

    @Column(name = "goals_against")
    private Integer goalsAgainst;

    @Column(name = "goal_difference")
    private Integer goalDifference;

    @Column(nullable = false)
    private boolean qualified;

    @Column(columnDefinition = "TEXT")
    private String note;

    @Enumerated(EnumType.STRING)
    @Column(name = "rank_bucket", length = 20)
    private RankBucket rankBucket;

    @Column(name = "points_per_game", precision = 5, scale = 2)
    private BigDecimal pointsPerGame;

    @Enumerated(EnumType.STRING)
    @Column(name = "ppg_bucket", length = 20)
    private PpgBucket ppgBucket;

    @Enumerated(EnumType.STRING)
    @Column(name = "goal_diff_bucket", length = 30)
    private GoalDiffBucket goalDiffBucket;

    @Column(name = "import_run_id")
    private Long importRunId;

    @Column(name = "scraped_at")
    private Instant scrapedAt;

    public HistoricalStanding() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getSeason() { return season; }
    public void setSeason(Integer season) { this.season = season; }
    public Confederation getConfederation() { return confederation; }
    public void setConfederation(Confederation confederation) { this.confederation = confederation; }
    public String getStage() { return stage; }
    public void setStage(String stage) { this.stage = stage; }
    public String getGroupName() { return groupName; }
    public void setGroupName(String groupName) { this.groupName = groupName; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public Integer getGroupRank() { return groupRank; }
    public void setGroupRank(Integer groupRank) { this.groupRank = groupRank; }
    public Integer getPoints() { return points; }
    public void setPoints(Integer points) { this.points = points; }
    public Integer getGamesPlayed() { return gamesPlayed; }
    public void setGamesPlayed(Integer gamesPlayed) { this.gamesPlayed = gamesPlayed; }
    public Integer getWins() { return wins; }
    public void setWins(Integer wins) { this.wins = wins; }
    public Integer getDraws() { return draws; }
    public void setDraws(Integer draws) { this.draws = draws; }
    public Integer getLosses() { return losses; }
    public void setLosses(Integer losses) { this.losses = losses; }
    public Integer getGoalsFor() { return goalsFor; }
    public void setGoalsFor(Integer goalsFor) { this.goalsFor = goalsFor; }
    public Integer getGoalsAgainst() { return goalsAgainst; }
    public void setGoalsAgainst(Integer goalsAgainst) { this.goalsAgainst = goalsAgainst; }
    public Integer getGoalDifference() { return goalDifference; }
    public void setGoalDifference(Integer goalDifference) { this.goalDifference = goalDifference; }
    public boolean isQualified() { return qualified; }
    public void setQualified(boolean qualified) { this.qualified = qualified; }
    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }
    public RankBucket getRankBucket() { return rankBucket; }
    public void setRankBucket(RankBucket rankBucket) { this.rankBucket = rankBucket; }
    public BigDecimal getPointsPerGame() { return pointsPerGame; }
    public void setPointsPerGame(BigDecimal pointsPerGame) { this.pointsPerGame = pointsPerGame; }
    public PpgBucket getPpgBucket() { return ppgBucket; }
    public void setPpgBucket(PpgBucket ppgBucket) { this.ppgBucket = ppgBucket; }
    public GoalDiffBucket getGoalDiffBucket() { return goalDiffBucket; }
    public void setGoalDiffBucket(GoalDiffBucket goalDiffBucket) { this.goalDiffBucket = goalDiffBucket; }
    public Long getImportRunId() { return importRunId; }
    public void setImportRunId(Long importRunId) { this.importRunId = importRunId; }
    public Instant getScrapedAt() { return scrapedAt; }
    public void setScrapedAt(Instant scrapedAt) { this.scrapedAt = scrapedAt; }
}
