package com.chambua.qualifiers.service;

import com.chambua.qualifiers.dto.StandingIngestItem;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.QualificationStatus;
import com.chambua.qualifiers.model.StandingRow;
import com.chambua.qualifiers.util.TeamNameNormalizer;
import org.springframework.stereotype.Component;

/**
 * Turns a raw ingest item into a {@link StandingRow}. Any missing or unreadable field
 * raises {@link IllegalArgumentException}; range checks are left to the blender.
 */
@Component
public class StandingRowParser {

    public StandingRow parse(StandingIngestItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Empty standings row");
        }
        String team = required(item.getTeam(), "team");
        String group = required(item.getGroup(), "group");
        Confederation confederation = Confederation.fromLabel(item.getConfederation());
        QualificationStatus status = QualificationStatus.fromLabel(item.getStatus());
        Integer rank = optionalInt(item, item.getRank(), "rank");
        int points = requiredInt(item, item.getPoints(), "points");
        int played = requiredInt(item, item.getPlayed(), "played");
        int goalDiff = requiredInt(item, item.getGoalDiff(), "goalDiff");
        String stage = item.getStage() == null || item.getStage().isBlank() ? null : TeamNameNormalizer.clean(item.getStage());
        return new StandingRow(team, confederation, group, stage, rank, points, played, goalDiff, status);
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return TeamNameNormalizer.clean(value);
    }

    private static Integer optionalInt(StandingIngestItem item, Integer value, String field) {
        String raw = item.unreadableNumber(field);
        if (raw != null) {
            throw new IllegalArgumentException("Invalid number in " + field + ": " + raw);
        }
        return value;
    }

    private static int requiredInt(StandingIngestItem item, Integer value, String field) {
        Integer checked = optionalInt(item, value, field);
        if (checked == null) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return checked;
    }
}
