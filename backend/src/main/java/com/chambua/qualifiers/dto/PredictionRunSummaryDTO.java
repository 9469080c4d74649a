package com.chambua.qualifiers.dto;

import com.chambua.qualifiers.model.PredictionRun;

import java.time.Instant;

public class PredictionRunSummaryDTO {
    private Long id;
    private String runType;
    private String status;
    private String inputHash;
    private String outputHash;
    private String historicalLookupHash;
    private String modelVersion;
    private Integer rowsProcessed;
    private Integer rowsInserted;
    private Integer rowsUpdated;
    private Integer rowsFailed;
    private Integer hostTeams;
    private Integer qualifiedCount;
    private Integer inProgressCount;
    private Double avgProbability;
    private Double minProbability;
    private Double maxProbability;
    private Integer rankLevelMatches;
    private Integer bucketLevelMatches;
    private Integer noHistoricalMatch;
    private String errorMessage;
    private String triggeredBy;
    private Instant startedAt;
    private Instant completedAt;
    private Long executionMs;
    // true when a prior successful run with the same input was reported instead of recomputing
    private boolean reused;

    public PredictionRunSummaryDTO() {}

    public static PredictionRunSummaryDTO from(PredictionRun run, boolean reused) {
        PredictionRunSummaryDTO dto = new PredictionRunSummaryDTO();
        dto.id = run.getId();
        dto.runType = run.getRunType() != null ? run.getRunType().name() : null;
        dto.status = run.getStatus() != null ? run.getStatus().name() : null;
        dto.inputHash = run.getInputHash();
        dto.outputHash = run.getOutputHash();
        dto.historicalLookupHash = run.getHistoricalLookupHash();
        dto.modelVersion = run.getModelVersion();
        dto.rowsProcessed = run.getRowsProcessed();
        dto.rowsInserted = run.getRowsInserted();
        dto.rowsUpdated = run.getRowsUpdated();
        dto.rowsFailed = run.getRowsFailed();
        dto.hostTeams = run.getHostTeams();
        dto.qualifiedCount = run.getQualifiedCount();
        dto.inProgressCount = run.getInProgressCount();
        dto.avgProbability = run.getAvgProbability();
        dto.minProbability = run.getMinProbability();
        dto.maxProbability = run.getMaxProbability();
        dto.rankLevelMatches = run.getRankLevelMatches();
        dto.bucketLevelMatches = run.getBucketLevelMatches();
        dto.noHistoricalMatch = run.getNoHistoricalMatch();
        dto.errorMessage = run.getErrorMessage();
        dto.triggeredBy = run.getTriggeredBy();
        dto.startedAt = run.getStartedAt();
        dto.completedAt = run.getCompletedAt();
        dto.executionMs = run.getExecutionMs();
        dto.reused = reused;
        return dto;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getRunType() { return runType; }
    public void setRunType(String runType) { this.runType = runType; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getInputHash() { return inputHash; }
    public void setInputHash(String inputHash) { this.inputHash = inputHash; }
    public String getOutputHash() { return outputHash; }
    public void setOutputHash(String outputHash) { this.outputHash = outputHash; }
    public String getHistoricalLookupHash() { return historicalLookupHash; }
    public void setHistoricalLookupHash(String historicalLookupHash) { this.historicalLookupHash = historicalLookupHash; }
    public String getModelVersion() { return modelVersion; }
    public void setModelVersion(String modelVersion) { this.modelVersion = modelVersion; }
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
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Long getExecutionMs() { return executionMs; }
    public void setExecutionMs(Long executionMs) { this.executionMs = executionMs; }
    public boolean isReused() { return reused; }
    public void setReused(boolean reused) { this.reused = reused; }
}
