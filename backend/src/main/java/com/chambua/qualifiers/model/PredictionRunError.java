package com.chambua.qualifiers.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "prediction_run_errors", indexes = {
        @Index(name = "idx_run_error_run", columnList = "prediction_run_id")
})
public class PredictionRunError {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prediction_run_id", nullable = false, foreignKey = @ForeignKey(name = "fk_run_error_run"))
    private PredictionRun predictionRun;

    @Column(name = "row_num")
    private Integer rowNumber;

    private String team;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_at")
    private Instant createdAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public PredictionRun getPredictionRun() { return predictionRun; }
    public void setPredictionRun(PredictionRun predictionRun) { this.predictionRun = predictionRun; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
