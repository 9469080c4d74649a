package com.chambua.qualifiers.model;

import java.util.Locale;

public enum QualificationStatus {
    QUALIFIED("Qualified"),
    IN_PROGRESS("In Progress");

    private final String label;

    QualificationStatus(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    // Accepts "Qualified", "In Progress", "InProgress", "in_progress" (any case)
    public static QualificationStatus fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Qualification status is required");
        }
        String key = raw.trim().replaceAll("[\\s_-]+", "").toLowerCase(Locale.ROOT);
        return switch (key) {
            case "qualified" -> QUALIFIED;
            case "inprogress" -> IN_PROGRESS;
            default -> throw new IllegalArgumentException("Unsupported qualification status: " + raw);
        };
    }
}
