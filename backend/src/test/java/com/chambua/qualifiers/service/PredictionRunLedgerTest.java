package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.PredictionRun;
import com.chambua.qualifiers.model.RunStatus;
import com.chambua.qualifiers.model.RunType;
import com.chambua.qualifiers.repository.PredictionRunErrorRepository;
import com.chambua.qualifiers.repository.PredictionRunRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class PredictionRunLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String HASH = "a".repeat(64);

    @Autowired private PredictionRunRepository runRepository;
    @Autowired private PredictionRunErrorRepository errorRepository;

    private PredictionRunLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PredictionRunLedger(runRepository, errorRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void startOpensARunningRun() {
        PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, HASH, null, "v1");

        assertThat(run.getId()).isNotNull();
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getStartedAt()).isEqualTo(NOW);
        assertThat(run.getTriggeredBy()).isEqualTo("system");
    }

    @Test
    void finishDerivesStatusFromCounters() {
        assertThat(finishWith(10, 0).getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(finishWith(10, 3).getStatus()).isEqualTo(RunStatus.PARTIAL);
        assertThat(finishWith(10, 10).getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(finishWith(0, 0).getStatus()).isEqualTo(RunStatus.FAILED);
    }

    private PredictionRun finishWith(int processed, int failed) {
        PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, HASH, "test", "v1");
        run.setRowsProcessed(processed);
        run.setRowsFailed(failed);
        PredictionRun finished = ledger.finish(run);
        assertThat(finished.getCompletedAt()).isEqualTo(NOW);
        assertThat(finished.getExecutionMs()).isZero();
        return finished;
    }

    @Test
    void terminalRunsCannotBeReopened() {
        PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, HASH, "test", "v1");
        run.setRowsProcessed(1);
        ledger.finish(run);

        assertThatThrownBy(() -> ledger.finish(run)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ledger.fail(run, "late", null)).isInstanceOf(IllegalStateException.class);
        assertThat(runRepository.findById(run.getId()).orElseThrow().getStatus()).isEqualTo(RunStatus.SUCCESS);
    }

    @Test
    void failRecordsExceptionDetails() {
        PredictionRun run = ledger.start(RunType.LOOKUP_REBUILD, HASH, "test", null);

        PredictionRun failed = ledger.fail(run, "boom", new IllegalStateException("disk full"));

        assertThat(failed.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("boom");
        assertThat(failed.getErrorDetails()).contains("java.lang.IllegalStateException").contains("disk full");
    }

    @Test
    void rowErrorsAreStoredAgainstTheRun() {
        PredictionRun run = ledger.start(RunType.PROBABILITY_UPDATE, HASH, "test", "v1");

        ledger.recordRowErrors(run, List.of(
                new RowFailure(3, "Fiji", "{...}", "Points cannot be negative: -1"),
                new RowFailure(1, null, null, "Empty standings row")));

        assertThat(errorRepository.findByPredictionRunIdOrderByRowNumberAsc(run.getId()))
                .extracting(e -> e.getRowNumber(), e -> e.getReason())
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(1, "Empty standings row"),
                        org.assertj.core.groups.Tuple.tuple(3, "Points cannot be negative: -1"));
        assertThat(errorRepository.countByPredictionRunId(run.getId())).isEqualTo(2);
    }

    @Test
    void onlySuccessfulRunsAreReusable() {
        PredictionRun partial = ledger.start(RunType.PROBABILITY_UPDATE, HASH, "test", "v1");
        partial.setRowsProcessed(4);
        partial.setRowsFailed(1);
        ledger.finish(partial);
        assertThat(ledger.findReusableRun(RunType.PROBABILITY_UPDATE, HASH)).isEmpty();

        PredictionRun success = ledger.start(RunType.PROBABILITY_UPDATE, HASH, "test", "v1");
        success.setRowsProcessed(4);
        ledger.finish(success);
        assertThat(ledger.findReusableRun(RunType.PROBABILITY_UPDATE, HASH)).map(PredictionRun::getId).contains(success.getId());
        assertThat(ledger.findReusableRun(RunType.HISTORICAL_IMPORT, HASH)).isEmpty();
    }

    @Test
    void staleSweepOnlyTouchesOldRunningRuns() {
        PredictionRun old = running(NOW.minus(Duration.ofHours(3)));
        PredictionRun recent = running(NOW.minus(Duration.ofMinutes(30)));

        int swept = ledger.sweepStaleRuns(Duration.ofMinutes(120));

        assertThat(swept).isEqualTo(1);
        PredictionRun oldAfter = runRepository.findById(old.getId()).orElseThrow();
        assertThat(oldAfter.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(oldAfter.getErrorMessage()).isEqualTo(PredictionRunLedger.STALE_MESSAGE);
        assertThat(oldAfter.getExecutionMs()).isEqualTo(Duration.ofHours(3).toMillis());
        assertThat(runRepository.findById(recent.getId()).orElseThrow().getStatus()).isEqualTo(RunStatus.RUNNING);
    }

    private PredictionRun running(Instant startedAt) {
        PredictionRun run = new PredictionRun();
        run.setRunType(RunType.PROBABILITY_UPDATE);
        run.setInputHash(HASH);
        run.setStartedAt(startedAt);
        return runRepository.save(run);
    }
}
