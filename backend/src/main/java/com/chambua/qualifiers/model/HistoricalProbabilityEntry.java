package com.chambua.qualifiers.model;

import com.chambua.qualifiers.util.TeamNameNormalizer;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Pre-computed P(qualify | confederation, stage, rank or bucket). Rows are replaced in bulk
 * by a lookup rebuild and never edited individually. {@code lookupKey} makes the key tuple
 * unique even though half of its columns are null for each level.
 */
@Entity
@Table(name = "historical_probability_lookup", uniqueConstraints = {
        @UniqueConstraint(name = "uniq_prob_lookup", columnNames = {"lookup_key"})
}, indexes = {
        @Index(name = "idx_prob_lookup_confed_stage", columnList = "confederation, stage")
})
public class HistoricalProbabilityEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lookup_key", nullable = false, length = 400)
    private String lookupKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Confederation confederation;

    @Column(nullable = false)
    private String stage;

    @Column(name = "group_rank")
    private Integer groupRank;

    @Enumerated(EnumType.STRING)
    @Column(name = "rank_bucket", length = 20)
    private RankBucket rankBucket;

    @Enumerated(EnumType.STRING)
    @Column(name = "ppg_bucket", length = 20)
    private PpgBucket ppgBucket;

    @Enumerated(EnumType.STRING)
    @Column(name = "lookup_level", nullable = false, length = 16)
    private LookupLevel lookupLevel;

    @Column(name = "historical_qual_prob", nullable = false, precision = 5, scale = 4)
    private BigDecimal historicalQualProb;

    @Column(name = "sample_size", nullable = false)
    private Integer sampleSize;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public HistoricalProbabilityEntry() {}

    public static HistoricalProbabilityEntry forRank(Confederation confederation, String stage, int rank,
                                                     BigDecimal probability, int sampleSize) {
        HistoricalProbabilityEntry e = new HistoricalProbabilityEntry();
        e.confederation = confederation;
        e.stage = stage;
        e.groupRank = rank;
        e.lookupLevel = LookupLevel.RANK;
        e.historicalQualProb = probability;
        e.sampleSize = sampleSize;
        e.lookupKey = rankKey(confederation, stage, rank);
        return e;
    }

    public static HistoricalProbabilityEntry forBucket(Confederation confederation, String stage, RankBucket rankBucket,
                                                       PpgBucket ppgBucket, BigDecimal probability, int sampleSize) {
        HistoricalProbabilityEntry e = new HistoricalProbabilityEntry();
        e.confederation = confederation;
        e.stage = stage;
        e.rankBucket = rankBucket;
        e.ppgBucket = ppgBucket;
        e.lookupLevel = LookupLevel.BUCKET;
        e.historicalQualProb = probability;
        e.sampleSize = sampleSize;
        e.lookupKey = bucketKey(confederation, stage, rankBucket, ppgBucket);
        return e;
    }

    public static String rankKey(Confederation confederation, String stage, int rank) {
        return "rank|" + confederation.name() + "|" + TeamNameNormalizer.key(stage) + "|" + rank;
    }

    public static String bucketKey(Confederation confederation, String stage, RankBucket rankBucket, PpgBucket ppgBucket) {
        return "bucket|" + confederation.name() + "|" + TeamNameNormalizer.key(stage) + "|"
                + rankBucket.getLabel() + "|" + ppgBucket.getLabel();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getLookupKey() { return lookupKey; }
    public void setLookupKey(String lookupKey) { this.lookupKey = lookupKey; }
    public Confederation getConfederation() { return confederation; }
    public void setConfederation(Confederation confederation) { this.confederation = confederation; }
    public String getStage() { return stage; }
    public void setStage(String stage) { this.stage = stage; }
    public Integer getGroupRank() { return groupRank; }
    public void setGroupRank(Integer groupRank) { this.groupRank = groupRank; }
    public RankBucket getRankBucket() { return rankBucket; }
    public void setRankBucket(RankBucket rankBucket) { this.rankBucket = rankBucket; }
    public PpgBucket getPpgBucket() { return ppgBucket; }
    public void setPpgBucket(PpgBucket ppgBucket) { this.ppgBucket = ppgBucket; }
    public LookupLevel getLookupLevel() { return lookupLevel; }
    public void setLookupLevel(LookupLevel lookupLevel) { this.lookupLevel = lookupLevel; }
    public BigDecimal getHistoricalQualProb() { return historicalQualProb; }
    public void setHistoricalQualProb(BigDecimal historicalQualProb) { this.historicalQualProb = historicalQualProb; }
    public Integer getSampleSize() { return sampleSize; }
    public void setSampleSize(Integer sampleSize) { this.sampleSize = sampleSize; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
