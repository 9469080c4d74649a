package com.chambua.qualifiers.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Ledger entry for one batch (probability update, archive import or lookup rebuild).
 * Created in {@link RunStatus#RUNNING} and finished exactly once.
 */
@Entity
@Table(name = "prediction_runs", indexes = {
        @Index(name = "idx_prediction_runs_input_hash", columnList = "input_hash"),
        @Index(name = "idx_prediction_runs_status", columnList = "status"),
        @Index(name = "idx_prediction_runs_started", columnList = "started_at")
})
public class PredictionRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false, length = 32)
    private RunType runType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunStatus status = RunStatus.RUNNING;

    @Column(name = "input_hash", length = 64, nullable = false)
    private String inputHash;

    @Column(name = "historical_lookup_hash", length = 64)
    private String historicalLookupHash;

    @Column(name = "output_hash", length = 64)
    private String outputHash;

    @Column(name = "model_version", length = 64)
    private String modelVersion;

    @Column(name = "triggered_by", length = 64)
    private String triggeredBy; // api, scheduler, ...

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "execution_ms")
    private Long executionMs;

    @Column(name = "rows_processed")
    private Integer rowsProcessed = 0;

    @Column(name = "rows_inserted")
    private Integer rowsInserted = 0;

    @Column(name = "rows_updated")
    private Integer rowsUpdated = 0;

    @Column(name = "rows_failed")
    private Integer rowsFailed = 0;

    @Column(name = "host_teams")
    private Integer hostTeams = 0;

    @Column(name = "qualified_count")
    private Integer qualifiedCount = 0;

    @Column(name = "in_progress_count")
    private Integer inProgressCount = 0;

    @Column(name = "avg_probability")
    private Double avgProbability;

    @Column(name = "min_probability")
    private Double minProbability;

    @Column(name = "max_probability")
    private Double maxProbability;

    @Column(name = "rank_level_matches")
    private Integer rankLevelMatches = 0;

    @Column(name = "bucket_level_matches")
    private Integer bucketLevelMatches = 0;

    @Column(name = "no_historical_match")
    private Integer noHistoricalMatch = 0;

    @Column(name = "probability_distribution", columnDefinition = "TEXT")
    private String probabilityDistribution;

    @Column(name = "confederation_counts", columnDefinition = "TEXT")
    private String confederationCounts;

    @Column(columnDefinition = "TEXT")
    private String warnings;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_details", columnDefinition = "TEXT")
    private String errorDetails;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public RunType getRunType() { return runType; }
    public void setRunType(RunType runType) { this.runType = runType; }
    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }
    public String getInputHash() { return inputHash; }
    public void setInputHash(String inputHash) { this.inputHash = inputHash; }
    public String getHistoricalLookupHash() { return historicalLookupHash; }
    public void setHistoricalLookupHash(String historicalLookupHash) { this.historicalLookupHash = historicalLookupHash; }
    public String getOutputHash() { return outputHash; }
    public void setOutputHash(String outputHash) { this.outputHash = outputHash; }
    public String getModelVersion() { return modelVersion; }
    public void setModelVersion(String modelVersion) { this.modelVersion = modelVersion; }
    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Long getExecutionMs() { return executionMs; }
    public void setExecutionMs(Long executionMs) { this.executionMs = executionMs; }
    public Integer getRowsProcessed() { return rowsProcessed; }
    public void setRowsProcessed(Integer rowsProcessed) { this.rowsProcessed = rowsProcessed; }
    public Integer getRowsInserted() { return rowsInserted; }
    public void setRowsInserted(Integer rowsInserted) { this.rowsInserted = rowsInserted; }
    public Integer getRowsUpdated() { return rowsUpdated; }
    public void setRowsUpdated(Integer rowsUpdated) { this.rowsUpdated = rowsUpdated; }
    public Integer getRowsFailed() { return rowsFailed; }
    public void setRowsFailed(Integer rowsFailed) { this.rowsFailed = rowsFailed; }
    public Integer getHostTeams() { return hostTeams; }
    public void setHostTeams(Integer hostTeams) { this.hostTeams = hostTeams; }
    public Integer getQualifiedCount() { return qualifiedCount; }
    public void setQualifiedCount(Integer qualifiedCount) { this.qualifiedCount = qualifiedCount; }
    public Integer getInProgressCount() { return inProgressCount; }
    public void setInProgressCount(Integer inProgressCount) { this.inProgressCount = inProgressCount; }
    public Double getAvgProbability() { return avgProbability; }
    public void setAvgProbability(Double avgProbability) { this.avgProbability = avgProbability; }
    public Double getMinProbability() { return minProbability; }
    public void setMinProbability(Double minProbability) { this.minProbability = minProbability; }
    public Double getMaxProbability() { return maxProbability; }
    public void setMaxProbability(Double maxProbability) { this.maxProbability = maxProbability; }
    public Integer getRankLevelMatches() { return rankLevelMatches; }
    public void setRankLevelMatches(Integer rankLevelMatches) { this.rankLevelMatches = rankLevelMatches; }
    public Integer getBucketLevelMatches() { return bucketLevelMatches; }
    public void setBucketLevelMatches(Integer bucketLevelMatches) { this.bucketLevelMatches = bucketLevelMatches; }
    public Integer getNoHistoricalMatch() { return noHistoricalMatch; }
    public void setNoHistoricalMatch(Integer noHistoricalMatch) { this.noHistoricalMatch = noHistoricalMatch; }
    public String getProbabilityDistribution() { return probabilityDistribution; }
    public void setProbabilityDistribution(String probabilityDistribution) { this.probabilityDistribution = probabilityDistribution; }
    public String getConfederationCounts() { return confederationCounts; }
    public void setConfederationCounts(String confederationCounts) { this.confederationCounts = confederationCounts; }
    public String getWarnings() { return warnings; }
    public void setWarnings(String warnings) { this.warnings = warnings; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getErrorDetails() { return errorDetails; }
    public void setErrorDetails(String errorDetails) { this.errorDetails = errorDetails; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
