package com.chambua.qualifiers.service;

import com.chambua.qualifiers.config.BlendingProperties;
import com.chambua.qualifiers.model.BlendOutcome;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.HistoricalMatch;
import com.chambua.qualifiers.model.LookupLevel;
import com.chambua.qualifiers.model.QualificationStatus;
import com.chambua.qualifiers.model.StandingRow;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProbabilityBlenderTest {

    private final ProbabilityBlender blender = new ProbabilityBlender(new BlendingProperties());

    private static StandingRow inProgress(Confederation c, Integer rank, int points, int played, int gd) {
        return new StandingRow("Team", c, "Group A", rank, points, played, gd, QualificationStatus.IN_PROGRESS);
    }

    @Test
    void qualifiedTeamIsAlwaysHundred() {
        StandingRow row = new StandingRow("Argentina", Confederation.CONMEBOL, "Round Robin", 1, 38, 18, 21, QualificationStatus.QUALIFIED);
        BlendOutcome out = blender.blend(row, HistoricalMatch.rank(0.2));
        assertThat(out.probability()).isEqualTo(100.0);
        assertThat(out.level()).isEqualTo(LookupLevel.NONE);
    }

    @Test
    void qualifiedRowWithImpossibleCountersIsRejected() {
        StandingRow negativePoints = new StandingRow("Odd", Confederation.OFC, "Group A", 1, -3, 4, 0, QualificationStatus.QUALIFIED);
        StandingRow zeroRank = new StandingRow("Odd", Confederation.OFC, "Group A", 0, 9, 4, 0, QualificationStatus.QUALIFIED);

        assertThatThrownBy(() -> blender.blend(negativePoints, HistoricalMatch.none()))
                .isInstanceOf(InvalidStandingException.class)
                .hasMessageContaining("Points");
        assertThatThrownBy(() -> blender.blend(zeroRank, HistoricalMatch.none()))
                .isInstanceOf(InvalidStandingException.class)
                .hasMessageContaining("Rank");
    }

    @Test
    void groupLeaderWithStrongHistoryBlendsFormAndHistory() {
        // form = 70 + 20 * 2.25 / 3 + 0.4 * (10 + 10) = 93 ; 0.6 * 93 + 0.4 * 92 = 92.6
        BlendOutcome out = blender.blend(inProgress(Confederation.UEFA, 1, 18, 8, 12), HistoricalMatch.rank(0.92));

        assertThat(out.probability()).isCloseTo(92.6, within(0.001));
        assertThat(out.level()).isEqualTo(LookupLevel.RANK);
        assertThat(out.formComponent()).isCloseTo(93.0, within(1e-9));
        assertThat(out.historicalComponent()).isCloseTo(92.0, within(1e-9));
    }

    @Test
    void leaderScoresAboveFourthPlace() {
        double leader = blender.blend(inProgress(Confederation.UEFA, 1, 18, 8, 12), HistoricalMatch.rank(0.92)).probability();
        double fourth = blender.blend(inProgress(Confederation.UEFA, 4, 18, 8, 12), HistoricalMatch.rank(0.35)).probability();

        assertThat(leader).isGreaterThan(85.0);
        assertThat(leader).isGreaterThan(fourth);
    }

    @Test
    void withoutHistoryFormAloneIsUsed() {
        // 70 + 0 + 0.4 * 10, scaled by the OFC multiplier
        BlendOutcome out = blender.blend(inProgress(Confederation.OFC, 1, 0, 0, 0), HistoricalMatch.none());
        assertThat(out.probability()).isCloseTo(51.8, within(0.001));
        assertThat(out.historicalComponent()).isNull();
    }

    @Test
    void bucketMatchBlendsAndAppliesConfederationMultiplier() {
        // form = 70 + 20 * 2 / 3 + 0.4 * 13 ; (0.6 * form + 0.4 * 50) * 0.9
        BlendOutcome out = blender.blend(inProgress(Confederation.CONCACAF, 2, 12, 6, 3), HistoricalMatch.bucket(0.5));
        assertThat(out.level()).isEqualTo(LookupLevel.BUCKET);
        assertThat(out.probability()).isCloseTo(65.81, within(0.001));
    }

    @Test
    void moreGamesWonMeansStrictlyHigherProbability() {
        double previous = -1;
        for (int points = 0; points <= 24; points++) {
            double p = blender.blend(inProgress(Confederation.CAF, 3, points, 8, 0), HistoricalMatch.none()).probability();
            assertThat(p).isGreaterThan(previous);
            previous = p;
        }
    }

    @Test
    void bottomOfTableStillRewardsEveryPoint() {
        for (Integer rank : new Integer[]{6, null}) {
            double previous = 0;
            for (int points = 0; points <= 24; points++) {
                double p = blender.blend(inProgress(Confederation.OFC, rank, points, 8, -25), HistoricalMatch.none()).probability();
                assertThat(p).isGreaterThan(previous);
                previous = p;
            }
        }
    }

    @Test
    void formScoreStaysInsideTheClampBounds() {
        StandingRow weakest = inProgress(Confederation.UEFA, null, 0, 10, -30);
        StandingRow strongest = inProgress(Confederation.UEFA, 1, 30, 10, 40);

        assertThat(blender.formScore(weakest)).isCloseTo(5.0, within(1e-9));
        assertThat(blender.formScore(strongest)).isCloseTo(98.0, within(1e-9));
        assertThat(blender.blend(weakest, HistoricalMatch.rank(0.0)).probability()).isGreaterThan(0.0);
        assertThat(blender.blend(strongest, HistoricalMatch.rank(1.0)).probability()).isLessThan(100.0);
    }

    @Test
    void resultsStayWithinBounds() {
        BlendingProperties props = new BlendingProperties();
        Map<Confederation, Double> multipliers = new EnumMap<>(Confederation.class);
        multipliers.put(Confederation.UEFA, 2.0);
        props.setConfederationMultipliers(multipliers);
        ProbabilityBlender aggressive = new ProbabilityBlender(props);

        assertThat(aggressive.blend(inProgress(Confederation.UEFA, 1, 30, 10, 40), HistoricalMatch.rank(1.0)).probability())
                .isEqualTo(100.0);
        Map<Confederation, Double> crushing = new EnumMap<>(Confederation.class);
        crushing.put(Confederation.UEFA, -1.0);
        BlendingProperties negative = new BlendingProperties();
        negative.setConfederationMultipliers(crushing);
        assertThat(new ProbabilityBlender(negative).blend(inProgress(Confederation.UEFA, null, 0, 10, -30), HistoricalMatch.none())
                .probability()).isEqualTo(0.0);
    }

    @Test
    void clampBoundsComeFromConfiguration() {
        BlendingProperties props = new BlendingProperties();
        props.setMinProbability(10.0);
        props.setMaxProbability(95.0);
        ProbabilityBlender bounded = new ProbabilityBlender(props);

        assertThat(bounded.blend(inProgress(Confederation.UEFA, null, 0, 10, -30), HistoricalMatch.none()).probability()).isEqualTo(10.0);
        assertThat(bounded.blend(inProgress(Confederation.UEFA, 1, 30, 10, 40), HistoricalMatch.rank(1.0)).probability()).isEqualTo(95.0);
    }

    @Test
    void invalidCountersAreRejected() {
        assertThatThrownBy(() -> blender.blend(inProgress(Confederation.UEFA, 1, -2, 8, 0), HistoricalMatch.none()))
                .isInstanceOf(InvalidStandingException.class);
        assertThatThrownBy(() -> blender.blend(inProgress(Confederation.UEFA, 1, 2, -1, 0), HistoricalMatch.none()))
                .isInstanceOf(InvalidStandingException.class);
        assertThatThrownBy(() -> blender.blend(inProgress(Confederation.UEFA, 0, 2, 1, 0), HistoricalMatch.none()))
                .isInstanceOf(InvalidStandingException.class);
    }

    @Test
    void invalidWeightsFailFast() {
        BlendingProperties props = new BlendingProperties();
        props.setFormWeight(0);
        props.setHistoricalWeight(0);
        ProbabilityBlender broken = new ProbabilityBlender(props);

        assertThatThrownBy(() -> broken.blend(inProgress(Confederation.UEFA, 1, 3, 1, 1), HistoricalMatch.none()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resultHasAtMostTwoDecimals() {
        double p = blender.blend(inProgress(Confederation.AFC, 2, 7, 3, 1), HistoricalMatch.bucket(0.3333)).probability();
        assertThat(Math.abs(p * 100 - Math.round(p * 100))).isLessThan(1e-6);
    }
}
