package com.chambua.qualifiers.service;

import com.chambua.qualifiers.config.BlendingProperties;
import com.chambua.qualifiers.config.QualifierProperties;
import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.dto.StandingIngestItem;
import com.chambua.qualifiers.model.BlendOutcome;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalMatch;
import com.chambua.qualifiers.model.MaterializationCounts;
import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.model.ProbabilityResult;
import com.chambua.qualifiers.model.QualificationStatus;
import com.chambua.qualifiers.model.RunType;
import com.chambua.qualifiers.model.StandingBuckets;
import com.chambua.qualifiers.model.StandingRow;
import com.chambua.qualifiers.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs the probability batch: parse, bucket, look up, blend, materialize, and record
 * the outcome on the run ledger. Bad rows are skipped and recorded; only a store
 * failure or an empty batch fails the whole run.
 */
@Service
public class QualifierProbabilityService {
    private static final Logger log = LoggerFactory.getLogger(QualifierProbabilityService.class);

    private final StandingRowParser parser;
    private final StandingBucketizer bucketizer;
    private final ProbabilityBlender blender;
    private final HistoricalLookupService lookupService;
    private final ProbabilityMaterializer materializer;
    private final PredictionRunLedger ledger;
    private final ContentHasher hasher;
    private final StandingsSource standingsSource;
    private final QualifierProperties properties;
    private final BlendingProperties blendingProperties;

    public QualifierProbabilityService(StandingRowParser parser,
                                       StandingBucketizer bucketizer,
                                       ProbabilityBlender blender,
                                       HistoricalLookupService lookupService,
                                       ProbabilityMaterializer materializer,
                                       PredictionRunLedger ledger,
                                       ContentHasher hasher,
                                       StandingsSource standingsSource,
                                       QualifierProperties properties,
                                       BlendingProperties blendingProperties) {
        this.parser = parser;
        this.bucketizer = bucketizer;
        this.blender = blender;
        this.lookupService = lookupService;
        this.materializer = materializer;
        this.ledger = ledger;
        this.hasher = hasher;
        this.standingsSource = standingsSource;
        this.properties = properties;
        this.blendingProperties = blendingProperties;
    }

    public PredictionRunSummaryDTO runFromSource(String triggeredBy) {
        List<StandingIngestItem> items;
        try {
            items = standingsSource.fetchCurrentStandings();
        } catch (RuntimeException e) {
            log.error("[Prediction][Source] could not read standings: {}", e.getMessage(), e);
            PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, hasher.inputHash(List.of()), triggeredBy,
                    blendingProperties.getModelVersion());
            return PredictionRunSummaryDTO.from(ledger.fail(run, "Standings source unavailable: " + e.getMessage(), e), false);
        }
        return run(items, triggeredBy);
    }

    public PredictionRunSummaryDTO run(List<StandingIngestItem> items, String triggeredBy) {
        List<StandingIngestItem> input = items == null ? List.of() : items;
        String inputHash = hasher.inputHash(input);

        ledger.sweepStaleRuns(Duration.ofMinutes(properties.getRuns().getStaleAfterMinutes()));

        String modelVersion = blendingProperties.getModelVersion();
        HistoricalLookupTable table;
        try {
            table = lookupService.current();
        } catch (RuntimeException e) {
            log.error("[Prediction][Run] historical lookup unavailable: {}", e.getMessage(), e);
            PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, inputHash, triggeredBy, modelVersion);
            return PredictionRunSummaryDTO.from(ledger.fail(run, "Historical lookup unavailable: " + e.getMessage(), e), false);
        }

        if (properties.getRuns().isSkipDuplicateInput()) {
            Optional<PredictionRun> prior = ledger.findReusableRun(RunType.PROBABILITY_UPDATE, inputHash,
                    table.fingerprint(), modelVersion);
            if (prior.isPresent()) {
                log.info("[Prediction][Run] input, lookup and model unchanged since runId={}; skipping recompute",
                        prior.get().getId());
                return PredictionRunSummaryDTO.from(prior.get(), true);
            }
        }

        PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, inputHash, triggeredBy, modelVersion);
        try {
            return PredictionRunSummaryDTO.from(execute(run, input, table), false);
        } catch (MaterializationException e) {
            log.error("[Prediction][Run] runId={} store failure: {}", run.getId(), e.getMessage(), e);
            return PredictionRunSummaryDTO.from(ledger.fail(run, e.getMessage(), e), false);
        } catch (RuntimeException e) {
            log.error("[Prediction][Run] runId={} aborted: {}", run.getId(), e.getMessage(), e);
            return PredictionRunSummaryDTO.from(ledger.fail(run, "Run aborted: " + e.getMessage(), e), false);
        }
    }

    private PredictionRun execute(PredictionRun run, List<StandingIngestItem> input, HistoricalLookupTable table) {
        run.setHistoricalLookupHash(table.fingerprint());

        if (input.isEmpty()) {
            return ledger.fail(run, "No standings rows supplied", null);
        }

        List<ProbabilityResult> results = new ArrayList<>();
        List<RowFailure> failures = new ArrayList<>();
        int rankMatches = 0, bucketMatches = 0, noMatch = 0;
        int rowNum = 0;
        for (StandingIngestItem item : input) {
            rowNum++;
            try {
                StandingRow row = parser.parse(item);
                StandingBuckets buckets = bucketizer.bucket(row);
                HistoricalMatch historical = table.lookup(row.confederation(), row.stage(), row.rank(), buckets);
                BlendOutcome outcome = blender.blend(row, historical);
                results.add(ProbabilityResult.of(row, outcome.probability(), outcome.level()));
                switch (outcome.level()) {
                    case RANK -> rankMatches++;
                    case BUCKET -> bucketMatches++;
                    case NONE -> noMatch++;
                }
            } catch (IllegalArgumentException rowEx) {
                String team = item == null ? null : item.getTeam();
                log.warn("[Prediction][Row] row={} team={} skipped: {}", rowNum, team, rowEx.getMessage());
                failures.add(new RowFailure(rowNum, team, item == null ? null : item.toString(), rowEx.getMessage()));
            }
        }
        ledger.recordRowErrors(run, failures);
        run.setRowsProcessed(input.size());
        run.setRowsFailed(failures.size());
        run.setRankLevelMatches(rankMatches);
        run.setBucketLevelMatches(bucketMatches);
        run.setNoHistoricalMatch(noMatch);

        if (results.isEmpty()) {
            log.warn("[Prediction][Run] runId={} every row failed; probability table left unchanged", run.getId());
            return ledger.finish(run);
        }

        List<String> warnings = new ArrayList<>();
        List<ProbabilityResult> hosts = hostResults(warnings);
        results.addAll(hosts);
        run.setHostTeams(hosts.size());

        MaterializationCounts counts = materializer.apply(results);
        run.setRowsInserted(counts.inserted());
        run.setRowsUpdated(counts.updated());

        applyStatistics(run, results);
        run.setOutputHash(hasher.outputHash(results));
        if (!warnings.isEmpty()) {
            run.setWarnings(ledger.toJson(warnings));
        }
        log.info("[Prediction][Run] runId={} results={} failed={} hosts={}",
                run.getId(), results.size(), failures.size(), hosts.size());
        return ledger.finish(run);
    }

    private List<ProbabilityResult> hostResults(List<String> warnings) {
        List<ProbabilityResult> hosts = new ArrayList<>();
        for (QualifierProperties.Host host : properties.getHosts()) {
            if (host.getTeam() == null || host.getTeam().isBlank()) {
                warnings.add("Host entry without a team name ignored");
                continue;
            }
            Confederation confederation;
            try {
                confederation = Confederation.fromLabel(host.getConfederation());
            } catch (IllegalArgumentException e) {
                warnings.add("Host " + host.getTeam() + " ignored: " + e.getMessage());
                continue;
            }
            hosts.add(ProbabilityResult.host(TeamNameNormalizer.clean(host.getTeam()), confederation, host.getGroup()));
        }
        return hosts;
    }

    private void applyStatistics(PredictionRun run, List<ProbabilityResult> results) {
        int qualified = 0, inProgress = 0;
        Map<String, Integer> tiers = new LinkedHashMap<>();
        for (String tier : List.of("Very High", "High", "Medium", "Low", "Very Low")) {
            tiers.put(tier, 0);
        }
        Map<String, Integer> byConfederation = new TreeMap<>();
        DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
        for (ProbabilityResult r : results) {
            if (r.status() == QualificationStatus.QUALIFIED) qualified++;
            else inProgress++;
            stats.accept(r.probFillSlot());
            tiers.merge(tier(r.probFillSlot()), 1, Integer::sum);
            byConfederation.merge(r.confederation().name(), 1, Integer::sum);
        }
        run.setQualifiedCount(qualified);
        run.setInProgressCount(inProgress);
        run.setAvgProbability(Math.round(stats.getAverage() * 100.0) / 100.0);
        run.setMinProbability(stats.getMin());
        run.setMaxProbability(stats.getMax());
        run.setProbabilityDistribution(ledger.toJson(tiers));
        run.setConfederationCounts(ledger.toJson(byConfederation));
    }

    static String tier(double probability) {
        if (probability >= 90) return "Very High";
        if (probability >= 70) return "High";
        if (probability >= 50) return "Medium";
        if (probability >= 25) return "Low";
        return "Very Low";
    }
}
