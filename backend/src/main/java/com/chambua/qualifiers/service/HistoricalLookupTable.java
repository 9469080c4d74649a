package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalMatch;
import com.chambua.qualifiers.model.HistoricalProbabilityEntry;
import com.chambua.qualifiers.model.LookupLevel;
import com.chambua.qualifiers.model.StandingBuckets;
import com.chambua.qualifiers.util.HashUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of historical qualification rates.
 *
 * <p>Lookup order: exact rank for the stage, exact rank for the simplified stage
 * (text before {@code " - "}), then rank bucket + ppg bucket for the stage and the
 * simplified stage. A row without a ppg bucket never matches at bucket level.
 */
public final class HistoricalLookupTable {

    private static final String STAGE_SUFFIX_SEPARATOR = " - ";
    private static final HistoricalLookupTable EMPTY = new HistoricalLookupTable(List.of());

    private final Map<String, Double> probabilities;
    private final int rankEntries;
    private final int bucketEntries;
    private final String fingerprint;

    public HistoricalLookupTable(Collection<HistoricalProbabilityEntry> entries) {
        Map<String, Double> map = new HashMap<>();
        List<String> lines = new ArrayList<>();
        int ranks = 0;
        int buckets = 0;
        for (HistoricalProbabilityEntry e : entries) {
            double p = e.getHistoricalQualProb().doubleValue();
            if (map.put(e.getLookupKey(), p) != null) {
                throw new IllegalStateException("Duplicate historical lookup key: " + e.getLookupKey());
            }
            if (e.getLookupLevel() == LookupLevel.RANK) ranks++;
            else buckets++;
            lines.add(e.getLookupKey() + "=" + e.getHistoricalQualProb().toPlainString());
        }
        this.probabilities = Collections.unmodifiableMap(map);
        this.rankEntries = ranks;
        this.bucketEntries = buckets;
        this.fingerprint = HashUtils.sha256OfSortedLines(lines);
    }

    public static HistoricalLookupTable empty() {
        return EMPTY;
    }

    public HistoricalMatch lookup(Confederation confederation, String stage, Integer rank, StandingBuckets buckets) {
        List<String> stages = candidateStages(stage);
        if (rank != null) {
            for (String s : stages) {
                Double p = probabilities.get(HistoricalProbabilityEntry.rankKey(confederation, s, rank));
                if (p != null) return HistoricalMatch.rank(p);
            }
        }
        if (buckets != null && buckets.ppg() != null) {
            for (String s : stages) {
                Double p = probabilities.get(HistoricalProbabilityEntry.bucketKey(confederation, s, buckets.rank(), buckets.ppg()));
                if (p != null) return HistoricalMatch.bucket(p);
            }
        }
        return HistoricalMatch.none();
    }

    static List<String> candidateStages(String stage) {
        if (stage == null) return List.of("");
        int idx = stage.indexOf(STAGE_SUFFIX_SEPARATOR);
        if (idx > 0) {
            return List.of(stage, stage.substring(0, idx));
        }
        return List.of(stage);
    }

    public int size() { return probabilities.size(); }
    public int getRankEntries() { return rankEntries; }
    public int getBucketEntries() { return bucketEntries; }

    /** SHA-256 over the table content; recorded on each run that consulted it. */
    public String fingerprint() { return fingerprint; }
}
