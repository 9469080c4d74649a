package com.chambua.qualifiers.service;

/** A standings or archive row that was skipped, kept for the run's error list. */
public record RowFailure(int rowNumber, String team, String payload, String reason) {
}
