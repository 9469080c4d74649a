package com.chambua.qualifiers.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record TeamProbabilityDTO(String team,
                                 String confederation,
                                 String currentGroup,
                                 String qualificationStatus,
                                 BigDecimal probFillSlot,
                                 Integer position,
                                 Integer points,
                                 Integer played,
                                 Integer goalDiff,
                                 String lookupLevel,
                                 Instant updatedAt) {
}
