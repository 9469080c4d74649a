package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalMatch;
import com.chambua.qualifiers.model.HistoricalProbabilityEntry;
import com.chambua.qualifiers.model.LookupLevel;
import com.chambua.qualifiers.model.PpgBucket;
import com.chambua.qualifiers.model.RankBucket;
import com.chambua.qualifiers.model.StandingBuckets;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistoricalLookupTableTest {

    private final StandingBucketizer bucketizer = new StandingBucketizer();

    private static HistoricalProbabilityEntry rank(Confederation c, String stage, int rank, String p) {
        return HistoricalProbabilityEntry.forRank(c, stage, rank, new BigDecimal(p), 10);
    }

    private static HistoricalProbabilityEntry bucket(Confederation c, String stage, RankBucket rb, PpgBucket pb, String p) {
        return HistoricalProbabilityEntry.forBucket(c, stage, rb, pb, new BigDecimal(p), 10);
    }

    @Test
    void exactRankEntryWins() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                rank(Confederation.UEFA, "Group Stage", 1, "0.9200"),
                bucket(Confederation.UEFA, "Group Stage", RankBucket.FIRST, PpgBucket.TWO_OR_MORE, "0.5000")));

        HistoricalMatch m = table.lookup(Confederation.UEFA, "Group Stage", 1, bucketizer.bucket(1, 18, 8, 12));

        assertThat(m.level()).isEqualTo(LookupLevel.RANK);
        assertThat(m.probability()).isEqualTo(0.92);
    }

    @Test
    void fallsBackToBucketWhenRankIsMissing() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                bucket(Confederation.CAF, "Group Stage", RankBucket.SECOND, PpgBucket.ONE_FIVE_TO_TWO, "0.5500")));

        HistoricalMatch m = table.lookup(Confederation.CAF, "Group Stage", 2, bucketizer.bucket(2, 10, 6, 3));

        assertThat(m.level()).isEqualTo(LookupLevel.BUCKET);
        assertThat(m.probability()).isEqualTo(0.55);
    }

    @Test
    void missingPpgBucketSkipsBucketLevel() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                bucket(Confederation.CAF, "Group Stage", RankBucket.SECOND, PpgBucket.BELOW_ONE, "0.5500")));

        StandingBuckets noGames = bucketizer.bucket(2, 0, 0, 0);
        assertThat(table.lookup(Confederation.CAF, "Group Stage", 2, noGames).level()).isEqualTo(LookupLevel.NONE);
    }

    @Test
    void stageSuffixFallsBackToSimplifiedStage() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                rank(Confederation.AFC, "Third Round", 2, "0.7500")));

        HistoricalMatch m = table.lookup(Confederation.AFC, "Third Round - Group B", 2, bucketizer.bucket(2, 10, 6, 3));

        assertThat(m.level()).isEqualTo(LookupLevel.RANK);
        assertThat(m.probability()).isEqualTo(0.75);
    }

    @Test
    void exactStageIsPreferredOverSimplifiedStage() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                rank(Confederation.AFC, "Third Round", 2, "0.7500"),
                rank(Confederation.AFC, "Third Round - Group B", 2, "0.6000")));

        HistoricalMatch m = table.lookup(Confederation.AFC, "Third Round - Group B", 2, bucketizer.bucket(2, 10, 6, 3));

        assertThat(m.probability()).isEqualTo(0.6);
    }

    @Test
    void stageMatchingIgnoresCaseAndSpacing() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                rank(Confederation.CONMEBOL, "Round  Robin", 6, "0.3000")));

        assertThat(table.lookup(Confederation.CONMEBOL, "round robin", 6, bucketizer.bucket(6, 15, 14, -2)).level())
                .isEqualTo(LookupLevel.RANK);
    }

    @Test
    void otherConfederationsDoNotMatch() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                rank(Confederation.UEFA, "Group Stage", 1, "0.9200")));

        assertThat(table.lookup(Confederation.OFC, "Group Stage", 1, bucketizer.bucket(1, 9, 3, 8)))
                .isEqualTo(HistoricalMatch.none());
    }

    @Test
    void unrankedRowOnlyMatchesAtBucketLevel() {
        HistoricalLookupTable table = new HistoricalLookupTable(List.of(
                bucket(Confederation.CONCACAF, "Final Round", RankBucket.SIXTH_OR_LOWER, PpgBucket.BELOW_ONE, "0.0500")));

        HistoricalMatch m = table.lookup(Confederation.CONCACAF, "Final Round", null, bucketizer.bucket(null, 2, 6, -8));

        assertThat(m.level()).isEqualTo(LookupLevel.BUCKET);
        assertThat(m.probability()).isEqualTo(0.05);
    }

    @Test
    void duplicateKeysAreRejected() {
        assertThatThrownBy(() -> new HistoricalLookupTable(List.of(
                rank(Confederation.UEFA, "Group Stage", 1, "0.9000"),
                rank(Confederation.UEFA, "group stage", 1, "0.8000"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fingerprintDependsOnContentNotOrder() {
        HistoricalProbabilityEntry a = rank(Confederation.UEFA, "Group Stage", 1, "0.9000");
        HistoricalProbabilityEntry b = rank(Confederation.UEFA, "Group Stage", 2, "0.6000");

        String forward = new HistoricalLookupTable(List.of(a, b)).fingerprint();
        String reverse = new HistoricalLookupTable(List.of(b, a)).fingerprint();
        String changed = new HistoricalLookupTable(List.of(a, rank(Confederation.UEFA, "Group Stage", 2, "0.6100"))).fingerprint();

        assertThat(forward).isEqualTo(reverse).hasSize(64);
        assertThat(changed).isNotEqualTo(forward);
    }

    @Test
    void emptyTableNeverMatches() {
        HistoricalLookupTable table = HistoricalLookupTable.empty();
        assertThat(table.size()).isZero();
        assertThat(table.lookup(Confederation.UEFA, "Group Stage", 1, bucketizer.bucket(1, 3, 1, 1)).isPresent()).isFalse();
    }
}
