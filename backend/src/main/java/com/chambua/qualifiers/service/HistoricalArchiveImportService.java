package com.chambua.qualifiers.service;

import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalStanding;
import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.model.RunType;
import com.chambua.qualifiers.model.StandingBuckets;
import com.chambua.qualifiers.repository.HistoricalStandingRepository;
import com.chambua.qualifiers.util.HashUtils;
import com.chambua.qualifiers.util.TeamNameNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Loads past qualifier tables into {@code historical_standings}, the archive the
 * lookup rebuild aggregates. Expected header:
 * season, confederation, stage, group_name, team, rank, points, games_played, wins,
 * draws, losses, goals_for, goals_against, goal_difference, qualified, note.
 */
@Service
public class HistoricalArchiveImportService {
    private static final Logger log = LoggerFactory.getLogger(HistoricalArchiveImportService.class);

    private static final int BATCH_SIZE = 500;

    private final HistoricalStandingRepository standingRepository;
    private final StandingBucketizer bucketizer;
    private final PredictionRunLedger ledger;
    private final Clock clock;

    public HistoricalArchiveImportService(HistoricalStandingRepository standingRepository,
                                          StandingBucketizer bucketizer,
                                          PredictionRunLedger ledger,
                                          Clock clock) {
        this.standingRepository = standingRepository;
        this.bucketizer = bucketizer;
        this.ledger = ledger;
        this.clock = clock;
    }

    public PredictionRunSummaryDTO importCsv(byte[] content, String filename, String triggeredBy) throws IOException {
        Objects.requireNonNull(content, "content must not be null");
        String fileHash = HashUtils.sha256Hex(content);

        Optional<PredictionRun> prior = ledger.findReusableRun(RunType.HISTORICAL_IMPORT, fileHash);
        if (prior.isPresent()) {
            log.info("[Archive][Import] {} already imported by runId={}", filename, prior.get().getId());
            return PredictionRunSummaryDTO.from(prior.get(), true);
        }

        PredictionRun run = ledger.start(RunType.HISTORICAL_IMPORT, fileHash, triggeredBy, null);
        run.setNotes(filename);

        List<HistoricalStanding> batch = new ArrayList<>(BATCH_SIZE);
        List<RowFailure> failures = new ArrayList<>();
        Set<String> seenInFile = new HashSet<>();
        int total = 0, inserted = 0, duplicates = 0;
        Instant now = Instant.now(clock);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8))) {
            CSVFormat fmt = CSVFormat.DEFAULT.builder()
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .setTrim(true)
                    .setIgnoreEmptyLines(true)
                    .build();
            try (CSVParser parser = new CSVParser(reader, fmt)) {
                int rowNum = 1; // header is row 1
                for (CSVRecord rec : parser) {
                    rowNum++;
                    total++;
                    try {
                        HistoricalStanding s = toStanding(rec);
                        s.setImportRunId(run.getId());
                        s.setScrapedAt(now);
                        String key = s.getSeason() + "|" + s.getConfederation() + "|" + s.getStage() + "|"
                                + s.getGroupName() + "|" + s.getTeam();
                        if (!seenInFile.add(key) || standingRepository.existsBySeasonAndConfederationAndStageAndGroupNameAndTeam(
                                s.getSeason(), s.getConfederation(), s.getStage(), s.getGroupName(), s.getTeam())) {
                            duplicates++;
                            continue;
                        }
                        batch.add(s);
                        inserted++;
                        if (batch.size() >= BATCH_SIZE) {
                            standingRepository.saveAll(batch);
                            batch.clear();
                        }
                    } catch (IllegalArgumentException rowEx) {
                        log.warn("[Archive][Row] row={} skipped: {}", rowNum, rowEx.getMessage());
                        failures.add(new RowFailure(rowNum, opt(rec, "team"), rec.toString(), rowEx.getMessage()));
                    }
                }
            }
            if (!batch.isEmpty()) standingRepository.saveAll(batch);
        } catch (IOException | RuntimeException e) {
            log.error("[Archive][Import] {} aborted: {}", filename, e.getMessage(), e);
            ledger.fail(run, "Archive import failed: " + e.getMessage(), e);
            throw e;
        }

        ledger.recordRowErrors(run, failures);
        run.setRowsProcessed(total);
        run.setRowsInserted(inserted);
        run.setRowsFailed(failures.size());
        if (duplicates > 0) {
            run.setWarnings(ledger.toJson(List.of(duplicates + " duplicate row(s) skipped")));
        }
        log.info("[Archive][Import] file={} total={} inserted={} duplicates={} failed={}",
                filename, total, inserted, duplicates, failures.size());
        return PredictionRunSummaryDTO.from(ledger.finish(run), false);
    }

    HistoricalStanding toStanding(CSVRecord rec) {
        HistoricalStanding s = new HistoricalStanding();
        s.setSeason(requiredInt(rec, "season"));
        s.setConfederation(Confederation.fromLabel(required(rec, "confederation")));
        String stage = TeamNameNormalizer.clean(required(rec, "stage"));
        s.setStage(stage);
        String group = opt(rec, "group_name");
        s.setGroupName(group == null ? stage : TeamNameNormalizer.clean(group));
        s.setTeam(TeamNameNormalizer.clean(required(rec, "team")));

        Integer rank = optInt(rec, "rank");
        if (rank != null && rank < 1) {
            throw new IllegalArgumentException("Rank must be at least 1: " + rank);
        }
        int points = requiredInt(rec, "points");
        int played = requiredInt(rec, "games_played");
        if (points < 0 || played < 0) {
            throw new IllegalArgumentException("Points and games played cannot be negative");
        }
        s.setGroupRank(rank);
        s.setPoints(points);
        s.setGamesPlayed(played);
        s.setWins(optInt(rec, "wins"));
        s.setDraws(optInt(rec, "draws"));
        s.setLosses(optInt(rec, "losses"));
        s.setGoalsFor(optInt(rec, "goals_for"));
        s.setGoalsAgainst(optInt(rec, "goals_against"));

        Integer goalDiff = optInt(rec, "goal_difference");
        if (goalDiff == null && s.getGoalsFor() != null && s.getGoalsAgainst() != null) {
            goalDiff = s.getGoalsFor() - s.getGoalsAgainst();
        }
        if (goalDiff == null) {
            throw new IllegalArgumentException("Missing goal_difference (or goals_for/goals_against)");
        }
        s.setGoalDifference(goalDiff);

        String note = opt(rec, "note");
        s.setNote(note);
        s.setQualified(qualified(opt(rec, "qualified"), note));

        StandingBuckets buckets = bucketizer.bucket(rank, points, played, goalDiff);
        s.setRankBucket(buckets.rank());
        s.setPpgBucket(buckets.ppg());
        s.setGoalDiffBucket(buckets.goalDiff());
        if (played > 0) {
            s.setPointsPerGame(BigDecimal.valueOf(points).divide(BigDecimal.valueOf(played), 2, RoundingMode.HALF_UP));
        }
        return s;
    }

    /** Explicit flag wins; otherwise a note such as "Qualifies for the World Cup" marks the team qualified. */
    static boolean qualified(String flag, String note) {
        if (flag != null) {
            String f = flag.trim().toLowerCase(Locale.ROOT);
            return f.equals("true") || f.equals("1") || f.equals("yes") || f.equals("y");
        }
        if (note == null) return false;
        String n = note.toLowerCase(Locale.ROOT);
        if (n.contains("not qualif") || n.contains("eliminated")) return false;
        return n.contains("qualifies") || n.contains("qualified");
    }

    private static String required(CSVRecord rec, String col) {
        String v = opt(rec, col);
        if (v == null) throw new IllegalArgumentException("Missing required column: " + col);
        return v;
    }

    private static int requiredInt(CSVRecord rec, String col) {
        String v = required(rec, col);
        try {
            return Integer.parseInt(v.startsWith("+") ? v.substring(1) : v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in " + col + ": " + v);
        }
    }

    private static Integer optInt(CSVRecord rec, String col) {
        return opt(rec, col) == null ? null : requiredInt(rec, col);
    }

    private static String opt(CSVRecord rec, String col) {
        if (!rec.isMapped(col) || !rec.isSet(col)) return null;
        String v = rec.get(col);
        return v == null || v.isBlank() ? null : v.trim();
    }
}
