package com.chambua.qualifiers.service;

import com.chambua.qualifiers.dto.StandingIngestItem;
import com.chambua.qualifiers.model.ProbabilityResult;
import com.chambua.qualifiers.util.HashUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/** Order-independent SHA-256 fingerprints of run input and run output. */
@Component
public class ContentHasher {

    static final String NULL_ITEM = "<null>";

    public String inputHash(Collection<StandingIngestItem> items) {
        List<String> lines = new ArrayList<>(items.size());
        for (StandingIngestItem item : items) {
            lines.add(item == null ? NULL_ITEM : item.canonicalLine());
        }
        return HashUtils.sha256OfSortedLines(lines);
    }

    public String outputHash(Collection<ProbabilityResult> results) {
        List<String> lines = new ArrayList<>(results.size());
        for (ProbabilityResult r : results) {
            lines.add(r.storeKey() + "|" + String.format(Locale.ROOT, "%.2f", r.probFillSlot()) + "|" + r.status().name());
        }
        return HashUtils.sha256OfSortedLines(lines);
    }
}
