package com.chambua.qualifiers.service;

import com.chambua.qualifiers.config.QualifierProperties;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalProbabilityEntry;
import com.chambua.qualifiers.model.HistoricalStanding;
import com.chambua.qualifiers.model.PpgBucket;
import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.model.RankBucket;
import com.chambua.qualifiers.model.RunType;
import com.chambua.qualifiers.repository.HistoricalProbabilityEntryRepository;
import com.chambua.qualifiers.repository.HistoricalStandingRepository;
import com.chambua.qualifiers.util.HashUtils;
import com.chambua.qualifiers.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the in-memory {@link HistoricalLookupTable} and the rebuild of its backing table
 * from the historical standings archive.
 */
@Service
public class HistoricalLookupService {
    private static final Logger log = LoggerFactory.getLogger(HistoricalLookupService.class);

    private final HistoricalStandingRepository standingRepository;
    private final HistoricalProbabilityEntryRepository entryRepository;
    private final PredictionRunLedger ledger;
    private final QualifierProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final AtomicReference<HistoricalLookupTable> snapshot = new AtomicReference<>();

    public HistoricalLookupService(HistoricalStandingRepository standingRepository,
                                   HistoricalProbabilityEntryRepository entryRepository,
                                   PredictionRunLedger ledger,
                                   QualifierProperties properties,
                                   TransactionTemplate transactionTemplate,
                                   Clock clock) {
        this.standingRepository = standingRepository;
        this.entryRepository = entryRepository;
        this.ledger = ledger;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /** The current snapshot, loaded from the lookup table on first use. */
    public HistoricalLookupTable current() {
        HistoricalLookupTable table = snapshot.get();
        if (table == null) {
            table = reload();
        }
        return table;
    }

    public HistoricalLookupTable reload() {
        HistoricalLookupTable table = new HistoricalLookupTable(entryRepository.findAll());
        snapshot.set(table);
        log.info("[Lookup][Load] entries={} rank={} bucket={}", table.size(), table.getRankEntries(), table.getBucketEntries());
        return table;
    }

    /**
     * Recomputes every lookup entry from the archive and replaces the table in one
     * transaction. Readers keep the previous snapshot until the swap.
     */
    public PredictionRun rebuild(String triggeredBy) {
        List<HistoricalStanding> archive = standingRepository.findAll();
        PredictionRun run = ledger.start(RunType.LOOKUP_REBUILD, archiveHash(archive), triggeredBy, null);
        if (archive.isEmpty()) {
            log.warn("[Lookup][Rebuild] archive is empty; keeping the existing lookup table");
            return ledger.fail(run, "Historical archive is empty", null);
        }
        try {
            int minSamples = properties.getLookup().getMinRankSamples();
            List<HistoricalProbabilityEntry> entries = computeEntries(archive, minSamples);
            Instant now = Instant.now(clock);
            entries.forEach(e -> e.setUpdatedAt(now));
            transactionTemplate.executeWithoutResult(status -> {
                entryRepository.deleteAllInBatch();
                entryRepository.saveAll(entries);
            });
            HistoricalLookupTable table = new HistoricalLookupTable(entries);
            snapshot.set(table);

            run.setRowsProcessed(archive.size());
            run.setRowsInserted(entries.size());
            run.setRankLevelMatches(table.getRankEntries());
            run.setBucketLevelMatches(table.getBucketEntries());
            run.setHistoricalLookupHash(table.fingerprint());
            log.info("[Lookup][Rebuild] archiveRows={} rankEntries={} bucketEntries={}",
                    archive.size(), table.getRankEntries(), table.getBucketEntries());
            return ledger.finish(run);
        } catch (RuntimeException e) {
            log.error("[Lookup][Rebuild] failed: {}", e.getMessage(), e);
            ledger.fail(run, "Lookup rebuild failed: " + e.getMessage(), e);
            throw e;
        }
    }

    static List<HistoricalProbabilityEntry> computeEntries(List<HistoricalStanding> archive, int minRankSamples) {
        Map<String, Tally> byRank = new TreeMap<>();
        Map<String, Tally> byBucket = new TreeMap<>();
        for (HistoricalStanding s : archive) {
            String stage = TeamNameNormalizer.clean(s.getStage());
            if (s.getGroupRank() != null) {
                byRank.computeIfAbsent(HistoricalProbabilityEntry.rankKey(s.getConfederation(), stage, s.getGroupRank()),
                        k -> new Tally(s.getConfederation(), stage, s.getGroupRank(), null, null)).add(s.isQualified());
            }
            if (s.getPpgBucket() != null) {
                RankBucket rb = s.getRankBucket() != null ? s.getRankBucket() : RankBucket.of(s.getGroupRank());
                byBucket.computeIfAbsent(HistoricalProbabilityEntry.bucketKey(s.getConfederation(), stage, rb, s.getPpgBucket()),
                        k -> new Tally(s.getConfederation(), stage, null, rb, s.getPpgBucket())).add(s.isQualified());
            }
        }
        List<HistoricalProbabilityEntry> entries = new ArrayList<>();
        for (Tally t : byRank.values()) {
            if (t.total >= Math.max(1, minRankSamples)) {
                entries.add(HistoricalProbabilityEntry.forRank(t.confederation, t.stage, t.rank, t.rate(), t.total));
            }
        }
        for (Tally t : byBucket.values()) {
            entries.add(HistoricalProbabilityEntry.forBucket(t.confederation, t.stage, t.rankBucket, t.ppgBucket, t.rate(), t.total));
        }
        return entries;
    }

    private static String archiveHash(List<HistoricalStanding> archive) {
        List<String> lines = new ArrayList<>(archive.size());
        for (HistoricalStanding s : archive) {
            lines.add(s.getSeason() + "|" + s.getConfederation() + "|" + TeamNameNormalizer.key(s.getStage()) + "|"
                    + TeamNameNormalizer.key(s.getGroupName()) + "|" + TeamNameNormalizer.key(s.getTeam()) + "|"
                    + s.getGroupRank() + "|" + s.getPpgBucket() + "|" + s.isQualified());
        }
        return HashUtils.sha256OfSortedLines(lines);
    }

    private static final class Tally {
        final Confederation confederation;
        final String stage;
        final Integer rank;
        final RankBucket rankBucket;
        final PpgBucket ppgBucket;
        int total;
        int qualified;

        Tally(Confederation confederation, String stage, Integer rank, RankBucket rankBucket, PpgBucket ppgBucket) {
            this.confederation = confederation;
            this.stage = stage;
            this.rank = rank;
            this.rankBucket = rankBucket;
            this.ppgBucket = ppgBucket;
        }

        void add(boolean q) {
            total++;
            if (q) qualified++;
        }

        BigDecimal rate() {
            return BigDecimal.valueOf(qualified).divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_UP);
        }
    }
}
