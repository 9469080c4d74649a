package com.chambua.qualifiers.service;

import com.chambua.qualifiers.config.QualifierProperties;
import com.chambua.qualifiers.dto.StandingIngestItem;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the current standings from the CSV at {@code qualifiers.standings.csv-path}.
 * Header: team, confederation, group, stage, rank, points, played, goal_diff, status.
 * Unreadable numbers are kept as raw text on the item so the row is rejected later with a reason.
 */
@Component
public class CsvStandingsSource implements StandingsSource {
    private static final Logger log = LoggerFactory.getLogger(CsvStandingsSource.class);

    private final QualifierProperties properties;

    public CsvStandingsSource(QualifierProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<StandingIngestItem> fetchCurrentStandings() {
        Path path = Path.of(properties.getStandings().getCsvPath());
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Standings file not found: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<StandingIngestItem> items = parse(reader);
            log.info("[Standings][CSV] read {} rows from {}", items.size(), path);
            return items;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read standings file " + path, e);
        }
    }

    static List<StandingIngestItem> parse(Reader reader) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        List<StandingIngestItem> items = new ArrayList<>();
        try (CSVParser parser = new CSVParser(reader, fmt)) {
            for (CSVRecord rec : parser) {
                StandingIngestItem item = new StandingIngestItem();
                item.setTeam(opt(rec, "team"));
                item.setConfederation(opt(rec, "confederation"));
                item.setGroup(opt(rec, "group"));
                item.setStage(opt(rec, "stage"));
                item.setRank(readInt(item, "rank", opt(rec, "rank")));
                item.setPoints(readInt(item, "points", opt(rec, "points")));
                item.setPlayed(readInt(item, "played", opt(rec, "played")));
                item.setGoalDiff(readInt(item, "goalDiff", opt(rec, "goal_diff")));
                item.setStatus(opt(rec, "status"));
                items.add(item);
            }
        }
        return items;
    }

    private static String opt(CSVRecord rec, String col) {
        if (!rec.isMapped(col) || !rec.isSet(col)) return null;
        String v = rec.get(col);
        return v == null || v.isBlank() ? null : v;
    }

    // Blank stays null; text that is not a whole number is kept on the item so parsing can reject the row
    static Integer readInt(StandingIngestItem item, String field, String s) {
        if (s == null) return null;
        String t = s.trim();
        if (t.startsWith("+")) t = t.substring(1);
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException e) {
            item.markUnreadable(field, s);
            return null;
        }
    }
}
