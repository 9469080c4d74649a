package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.MaterializationCounts;
import com.chambua.qualifiers.model.ProbabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a run's results to the {@link TeamProbabilityStore}. A key repeated within
 * one batch keeps its last result.
 */
@Component
public class ProbabilityMaterializer {
    private static final Logger log = LoggerFactory.getLogger(ProbabilityMaterializer.class);

    private final TeamProbabilityStore store;

    public ProbabilityMaterializer(TeamProbabilityStore store) {
        this.store = store;
    }

    public MaterializationCounts apply(List<ProbabilityResult> results) {
        if (results == null || results.isEmpty()) {
            return MaterializationCounts.none();
        }
        Map<String, ProbabilityResult> byKey = new LinkedHashMap<>();
        for (ProbabilityResult r : results) {
            byKey.put(r.storeKey(), r);
        }
        if (byKey.size() < results.size()) {
            log.warn("[Materialize] {} duplicate team keys in batch; last result kept", results.size() - byKey.size());
        }
        try {
            MaterializationCounts counts = store.upsertAll(new ArrayList<>(byKey.values()));
            log.info("[Materialize] inserted={} updated={}", counts.inserted(), counts.updated());
            return counts;
        } catch (RuntimeException e) {
            throw new MaterializationException("Failed to write probability table: " + e.getMessage(), e);
        }
    }
}
