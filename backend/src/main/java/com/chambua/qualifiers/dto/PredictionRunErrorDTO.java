package com.chambua.qualifiers.dto;

public class PredictionRunErrorDTO {
    private Long id;
    private Integer rowNumber;
    private String team;
    private String reason;
    private String payload;

    public PredictionRunErrorDTO() {}

    public PredictionRunErrorDTO(Long id, Integer rowNumber, String team, String reason, String payload) {
        this.id = id;
        this.rowNumber = rowNumber;
        this.team = team;
        this.reason = reason;
        this.payload = payload;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
}
