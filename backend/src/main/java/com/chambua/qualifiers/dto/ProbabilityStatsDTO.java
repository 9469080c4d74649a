package com.chambua.qualifiers.dto;

import java.time.Instant;
import java.util.Map;

public record ProbabilityStatsDTO(long totalTeams,
                                  long qualifiedTeams,
                                  long inProgressTeams,
                                  Map<String, Long> teamsByConfederation,
                                  Instant lastUpdatedAt) {
}
