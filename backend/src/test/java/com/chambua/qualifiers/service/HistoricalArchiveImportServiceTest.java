package com.chambua.qualifiers.service;

import com.chambua.qualifiers.config.ClockConfig;
import com.chambua.qualifiers.dto.PredictionRunSummaryDTO;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.GoalDiffBucket;
import com.chambua.qualifiers.model.HistoricalStanding;
import com.chambua.qualifiers.model.PpgBucket;
import com.chambua.qualifiers.model.RankBucket;
import com.chambua.qualifiers.model.RunStatus;
import com.chambua.qualifiers.model.RunType;
import com.chambua.qualifiers.repository.HistoricalStandingRepository;
import com.chambua.qualifiers.repository.PredictionRunErrorRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;

import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import({HistoricalArchiveImportService.class, StandingBucketizer.class, PredictionRunLedger.class,
        ClockConfig.class, JacksonAutoConfiguration.class})
class HistoricalArchiveImportServiceTest {

    @Autowired private HistoricalArchiveImportService importService;
    @Autowired private HistoricalStandingRepository standingRepository;
    @Autowired private PredictionRunErrorRepository errorRepository;

    private static byte[] fixture() throws Exception {
        try (InputStream in = new ClassPathResource("fixtures/historical_standings.csv").getInputStream()) {
            return in.readAllBytes();
        }
    }

    private HistoricalStanding find(String team) {
        return standingRepository.findAll().stream().filter(s -> s.getTeam().equals(team)).findFirst().orElseThrow();
    }

    @Test
    void importsRowsSkipsDuplicatesAndRecordsBadRows() throws Exception {
        PredictionRunSummaryDTO summary = importService.importCsv(fixture(), "historical_standings.csv", "test");

        assertThat(summary.getRunType()).isEqualTo(RunType.HISTORICAL_IMPORT.name());
        assertThat(summary.getStatus()).isEqualTo(RunStatus.PARTIAL.name());
        assertThat(summary.getRowsProcessed()).isEqualTo(9);
        assertThat(summary.getRowsInserted()).isEqualTo(6);
        assertThat(summary.getRowsFailed()).isEqualTo(2);
        assertThat(standingRepository.count()).isEqualTo(6);
        assertThat(errorRepository.findByPredictionRunIdOrderByRowNumberAsc(summary.getId()))
                .extracting(e -> e.getRowNumber())
                .containsExactly(6, 10);
    }

    @Test
    void derivesQualificationBucketsAndMissingFields() throws Exception {
        importService.importCsv(fixture(), "historical_standings.csv", "test");

        HistoricalStanding serbia = find("Serbia");
        assertThat(serbia.isQualified()).isTrue();
        assertThat(serbia.getRankBucket()).isEqualTo(RankBucket.FIRST);
        assertThat(serbia.getPpgBucket()).isEqualTo(PpgBucket.TWO_OR_MORE);
        assertThat(serbia.getPointsPerGame()).isEqualByComparingTo(new BigDecimal("2.50"));

        HistoricalStanding portugal = find("Portugal");
        assertThat(portugal.isQualified()).isFalse();
        assertThat(portugal.getGoalDifference()).isEqualTo(11);
        assertThat(portugal.getGoalDiffBucket()).isEqualTo(GoalDiffBucket.TEN_OR_MORE);

        HistoricalStanding azerbaijan = find("Azerbaijan");
        assertThat(azerbaijan.getGroupName()).isEqualTo("Group Stage");
        assertThat(azerbaijan.getGoalDiffBucket()).isEqualTo(GoalDiffBucket.MINUS_TEN_OR_LESS);

        HistoricalStanding nigeria = find("Nigeria");
        assertThat(nigeria.getConfederation()).isEqualTo(Confederation.CAF);
        assertThat(nigeria.isQualified()).isTrue();
        assertThat(nigeria.getImportRunId()).isNotNull();
    }

    @Test
    void sameFileTwiceReusesTheFirstImport() throws Exception {
        PredictionRunSummaryDTO first = importService.importCsv(fixture(), "historical_standings.csv", "test");
        PredictionRunSummaryDTO second = importService.importCsv(fixture(), "historical_standings.csv", "test");

        // PARTIAL imports are not reusable, so the second pass runs and finds only duplicates
        assertThat(second.isReused()).isFalse();
        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(second.getRowsInserted()).isZero();
        assertThat(standingRepository.count()).isEqualTo(6);
    }

    @Test
    void cleanFileImportedTwiceIsReported() throws Exception {
        byte[] clean = ("season,confederation,stage,group_name,team,rank,points,games_played,goal_difference,qualified,note\n"
                + "2010,OFC,Stage 3,Group A,New Zealand,1,14,6,10,true,\n").getBytes(StandardCharsets.UTF_8);

        PredictionRunSummaryDTO first = importService.importCsv(clean, "ofc.csv", "test");
        PredictionRunSummaryDTO second = importService.importCsv(clean, "ofc.csv", "test");

        assertThat(first.getStatus()).isEqualTo(RunStatus.SUCCESS.name());
        assertThat(second.isReused()).isTrue();
        assertThat(second.getId()).isEqualTo(first.getId());
    }
}
