package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.model.PredictionRunError;
import com.chambua.qualifiers.model.RunStatus;
import com.chambua.qualifiers.model.RunType;
import com.chambua.qualifiers.repository.PredictionRunErrorRepository;
import com.chambua.qualifiers.repository.PredictionRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only record of every run. A run starts RUNNING and moves exactly once to
 * SUCCESS, PARTIAL or FAILED; terminal runs are never touched again.
 */
@Service
public class PredictionRunLedger {
    private static final Logger log = LoggerFactory.getLogger(PredictionRunLedger.class);

    static final String STALE_MESSAGE = "Run abandoned: exceeded stale timeout";

    private final PredictionRunRepository runRepository;
    private final PredictionRunErrorRepository errorRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PredictionRunLedger(PredictionRunRepository runRepository,
                               PredictionRunErrorRepository errorRepository,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.runRepository = runRepository;
        this.errorRepository = errorRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public PredictionRun start(RunType type, String inputHash, String triggeredBy, String modelVersion) {
        PredictionRun run = new PredictionRun();
        run.setRunType(type);
        run.setInputHash(inputHash);
        run.setTriggeredBy(triggeredBy == null || triggeredBy.isBlank() ? "system" : triggeredBy);
        run.setModelVersion(modelVersion);
        run.setStatus(RunStatus.RUNNING);
        run.setStartedAt(Instant.now(clock));
        run = runRepository.save(run);
        log.info("[Ledger][Start] runId={} type={} inputHash={}", run.getId(), type, inputHash);
        return run;
    }

    @Transactional(readOnly = true)
    public Optional<PredictionRun> findReusableRun(RunType type, String inputHash) {
        return runRepository.findFirstByRunTypeAndInputHashAndStatusOrderByIdDesc(type, inputHash, RunStatus.SUCCESS);
    }

    /** A prior SUCCESS run is only reusable when it saw the same lookup table and model version. */
    @Transactional(readOnly = true)
    public Optional<PredictionRun> findReusableRun(RunType type, String inputHash, String lookupHash, String modelVersion) {
        return runRepository.findFirstByRunTypeAndInputHashAndHistoricalLookupHashAndModelVersionAndStatusOrderByIdDesc(
                type, inputHash, lookupHash, modelVersion, RunStatus.SUCCESS);
    }

    @Transactional
    public void recordRowErrors(PredictionRun run, List<RowFailure> failures) {
        if (failures == null || failures.isEmpty()) return;
        Instant now = Instant.now(clock);
        List<PredictionRunError> errors = new ArrayList<>(failures.size());
        for (RowFailure f : failures) {
            PredictionRunError e = new PredictionRunError();
            e.setPredictionRun(run);
            e.setRowNumber(f.rowNumber());
            e.setTeam(f.team());
            e.setPayload(f.payload());
            e.setReason(f.reason());
            e.setCreatedAt(now);
            errors.add(e);
        }
        errorRepository.saveAll(errors);
    }

    /** Derives the terminal status from the run's counters and closes it. */
    @Transactional
    public PredictionRun finish(PredictionRun run) {
        ensureOpen(run);
        int processed = run.getRowsProcessed() == null ? 0 : run.getRowsProcessed();
        int failed = run.getRowsFailed() == null ? 0 : run.getRowsFailed();
        run.setStatus(RunStatus.fromCounts(processed, failed));
        close(run);
        PredictionRun saved = runRepository.save(run);
        log.info("[Ledger][Finish] runId={} status={} processed={} failed={} ms={}",
                saved.getId(), saved.getStatus(), processed, failed, saved.getExecutionMs());
        return saved;
    }

    @Transactional
    public PredictionRun fail(PredictionRun run, String message, Throwable cause) {
        ensureOpen(run);
        run.setStatus(RunStatus.FAILED);
        run.setErrorMessage(message);
        if (cause != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exceptionType", cause.getClass().getName());
            details.put("message", cause.getMessage());
            run.setErrorDetails(toJson(details));
        }
        close(run);
        PredictionRun saved = runRepository.save(run);
        log.warn("[Ledger][Fail] runId={} reason={}", saved.getId(), message);
        return saved;
    }

    /** Marks RUNNING runs started before {@code now - staleAfter} as FAILED. */
    @Transactional
    public int sweepStaleRuns(Duration staleAfter) {
        Instant cutoff = Instant.now(clock).minus(staleAfter);
        List<PredictionRun> stale = runRepository.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff);
        for (PredictionRun run : stale) {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(STALE_MESSAGE);
            close(run);
        }
        if (!stale.isEmpty()) {
            runRepository.saveAll(stale);
            log.warn("[Ledger][Sweep] marked {} abandoned run(s) FAILED", stale.size());
        }
        return stale.size();
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize run detail", e);
        }
    }

    private void close(PredictionRun run) {
        Instant now = Instant.now(clock);
        run.setCompletedAt(now);
        if (run.getStartedAt() != null) {
            run.setExecutionMs(Math.max(0L, Duration.between(run.getStartedAt(), now).toMillis()));
        }
    }

    private static void ensureOpen(PredictionRun run) {
        if (run.getStatus() != null && run.getStatus().isTerminal()) {
            throw new IllegalStateException("Run " + run.getId() + " is already " + run.getStatus());
        }
    }
}
