package com.chambua.qualifiers.config;

import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.service.HistoricalLookupService;
import com.chambua.qualifiers.service.PredictionRunLedger;
import com.chambua.qualifiers.service.QualifierProbabilityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Background jobs, off unless {@code qualifiers.scheduler.enabled=true}. */
@Component
@ConditionalOnProperty(prefix = "qualifiers.scheduler", name = "enabled", havingValue = "true")
public class PredictionScheduler {
    private static final Logger log = LoggerFactory.getLogger(PredictionScheduler.class);

    private final QualifierProbabilityService probabilityService;
    private final HistoricalLookupService lookupService;
    private final PredictionRunLedger ledger;
    private final QualifierProperties properties;

    public PredictionScheduler(QualifierProbabilityService probabilityService,
                               HistoricalLookupService lookupService,
                               PredictionRunLedger ledger,
                               QualifierProperties properties) {
        this.probabilityService = probabilityService;
        this.lookupService = lookupService;
        this.ledger = ledger;
        this.properties = properties;
    }

    @Scheduled(cron = "${qualifiers.scheduler.probability-cron:0 0 */6 * * *}")
    public void refreshProbabilities() {
        try {
            PredictionRunSummaryDTO summary = probabilityService.runFromSource("scheduler");
            log.info("[Scheduler][Prediction] runId={} status={} reused={}", summary.getId(), summary.getStatus(), summary.isReused());
        } catch (Exception e) {
            log.warn("[Scheduler][Prediction] run failed: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${qualifiers.scheduler.rebuild-cron:0 0 3 * * SUN}")
    public void rebuildLookup() {
        try {
            PredictionRun run = lookupService.rebuild("scheduler");
            log.info("[Scheduler][Lookup] runId={} status={}", run.getId(), run.getStatus());
        } catch (Exception e) {
            log.warn("[Scheduler][Lookup] rebuild failed: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${qualifiers.scheduler.sweep-cron:0 15 * * * *}")
    public void sweepStaleRuns() {
        try {
            int swept = ledger.sweepStaleRuns(Duration.ofMinutes(properties.getRuns().getStaleAfterMinutes()));
            if (swept > 0) {
                log.info("[Scheduler][Sweep] {} stale run(s) marked FAILED", swept);
            }
        } catch (Exception e) {
            log.warn("[Scheduler][Sweep] failed: {}", e.getMessage());
        }
    }
}
